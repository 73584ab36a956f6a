package io.github.drompincen.startpage.protocol.api;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ReorderItem(Long id, String category, @JsonProperty("sort_index") Integer sortIndex) {}
