package io.github.drompincen.startpage.runtime.status;

import io.github.drompincen.startpage.protocol.api.LinkStatusDto;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Probes whether a bookmarked URL answers. Tries HEAD first and falls back to GET when HEAD
 * fails or is refused with a 4xx/5xx, since many sites reject HEAD. Every request is bounded by
 * the configured timeout and network failures come back as an {@code offline} result.
 */
@Service
public class LinkStatusService {

    private static final Logger log = LoggerFactory.getLogger(LinkStatusService.class);

    private final HttpClient httpClient;
    private final Duration timeout;

    public LinkStatusService(@Value("${startpage.status.timeout:PT5S}") Duration timeout) {
        this.timeout = timeout;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    public LinkStatusDto check(String url) {
        if (url == null || url.isBlank()) {
            return LinkStatusDto.error("URL is required");
        }
        URI uri;
        try {
            uri = URI.create(url.trim());
        } catch (IllegalArgumentException e) {
            return LinkStatusDto.error("Invalid URL: " + url);
        }
        String scheme = uri.getScheme();
        if (scheme == null || uri.getHost() == null
                || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
            return LinkStatusDto.error("Only absolute http(s) URLs can be checked");
        }

        long start = System.nanoTime();
        try {
            int code;
            try {
                code = send(uri, "HEAD");
            } catch (IOException e) {
                log.debug("HEAD {} failed ({}), retrying with GET", uri, e.getMessage());
                code = send(uri, "GET");
            }
            if (code >= 400) {
                code = send(uri, "GET");
            }
            long latencyMs = (System.nanoTime() - start) / 1_000_000L;
            return code < 400 ? LinkStatusDto.online(latencyMs) : LinkStatusDto.offline(code);
        } catch (IOException | UncheckedIOException e) {
            log.warn("Reachability check failed for {}: {}", uri, e.toString());
            return LinkStatusDto.unreachable(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        } catch (IllegalArgumentException e) {
            // parses as a URI but the client refuses it, e.g. a port out of range
            return LinkStatusDto.error("Invalid URL: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return LinkStatusDto.unreachable("Interrupted");
        }
    }

    private int send(URI uri, String method) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder(uri)
                .timeout(timeout)
                .method(method, HttpRequest.BodyPublishers.noBody())
                .build();
        return httpClient.send(request, HttpResponse.BodyHandlers.discarding()).statusCode();
    }
}
