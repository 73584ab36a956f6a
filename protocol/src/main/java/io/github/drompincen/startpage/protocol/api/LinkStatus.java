package io.github.drompincen.startpage.protocol.api;

import java.util.Locale;

public enum LinkStatus {
    ONLINE, OFFLINE, ERROR;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
