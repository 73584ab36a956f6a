package io.github.drompincen.startpage.runtime;

/** A request that is well-formed JSON but cannot be applied: empty batch, missing field, blank value. */
public class InvalidArgumentException extends RuntimeException {

    public InvalidArgumentException(String message) {
        super(message);
    }
}
