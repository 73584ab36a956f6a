package io.github.drompincen.startpage.protocol.api;

public record LoginRequest(String password) {}
