package io.github.drompincen.startpage.protocol.api;

import java.util.List;

public record ReorderLinksRequest(List<ReorderItem> items) {}
