package io.github.drompincen.startpage.protocol.api;

import java.util.List;

public record CategoryOrderRequest(List<String> order) {}
