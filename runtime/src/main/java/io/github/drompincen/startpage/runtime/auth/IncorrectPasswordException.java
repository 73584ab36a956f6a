package io.github.drompincen.startpage.runtime.auth;

public class IncorrectPasswordException extends RuntimeException {

    public IncorrectPasswordException() {
        super("Incorrect old password");
    }
}
