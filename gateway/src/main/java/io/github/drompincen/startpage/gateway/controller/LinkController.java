package io.github.drompincen.startpage.gateway.controller;

import io.github.drompincen.startpage.gateway.security.AccessGate;
import io.github.drompincen.startpage.protocol.api.CreateLinkRequest;
import io.github.drompincen.startpage.protocol.api.LinkDto;
import io.github.drompincen.startpage.protocol.api.ReorderLinksRequest;
import io.github.drompincen.startpage.protocol.api.UpdateLinkRequest;
import io.github.drompincen.startpage.runtime.catalog.LinkCatalogService;
import io.github.drompincen.startpage.runtime.catalog.LinkQuery;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/links")
public class LinkController {

    private final AccessGate accessGate;
    private final LinkCatalogService catalogService;

    public LinkController(AccessGate accessGate, LinkCatalogService catalogService) {
        this.accessGate = accessGate;
        this.catalogService = catalogService;
    }

    @GetMapping
    public List<LinkDto> list(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
                              @RequestParam(required = false) String category,
                              @RequestParam(required = false) Boolean favorite) {
        return catalogService.list(new LinkQuery(category, favorite), accessGate.isAdmin(authorization));
    }

    @PostMapping
    public ResponseEntity<LinkDto> create(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @RequestBody CreateLinkRequest body) {
        accessGate.requireAdmin(authorization);
        return ResponseEntity.ok(catalogService.create(body));
    }

    // mapped before /{linkId} so "reorder" is never parsed as an id
    @PutMapping("/reorder")
    public ResponseEntity<Map<String, String>> reorder(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @RequestBody ReorderLinksRequest body) {
        accessGate.requireAdmin(authorization);
        catalogService.reorder(body.items());
        return ResponseEntity.ok(Map.of("status", "ok"));
    }

    @PutMapping("/{linkId}")
    public ResponseEntity<LinkDto> update(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @PathVariable long linkId,
            @RequestBody UpdateLinkRequest body) {
        accessGate.requireAdmin(authorization);
        return ResponseEntity.ok(catalogService.update(linkId, body));
    }

    @PostMapping("/{linkId}/click")
    public ResponseEntity<Map<String, String>> click(@PathVariable long linkId) {
        catalogService.trackClick(linkId);
        return ResponseEntity.ok(Map.of("status", "ok"));
    }

    @DeleteMapping("/{linkId}")
    public ResponseEntity<Map<String, String>> delete(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @PathVariable long linkId) {
        accessGate.requireAdmin(authorization);
        catalogService.delete(linkId);
        return ResponseEntity.ok(Map.of("status", "deleted"));
    }
}
