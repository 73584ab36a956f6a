package io.github.drompincen.startpage.runtime.catalog;

public class LinkNotFoundException extends RuntimeException {

    private final long linkId;

    public LinkNotFoundException(long linkId) {
        super("Link not found: " + linkId);
        this.linkId = linkId;
    }

    public long getLinkId() {
        return linkId;
    }
}
