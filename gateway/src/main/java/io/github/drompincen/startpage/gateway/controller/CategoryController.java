package io.github.drompincen.startpage.gateway.controller;

import io.github.drompincen.startpage.gateway.security.AccessGate;
import io.github.drompincen.startpage.protocol.api.CategoryOrderRequest;
import io.github.drompincen.startpage.runtime.catalog.LinkCatalogService;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/categories")
public class CategoryController {

    private final AccessGate accessGate;
    private final LinkCatalogService catalogService;

    public CategoryController(AccessGate accessGate, LinkCatalogService catalogService) {
        this.accessGate = accessGate;
        this.catalogService = catalogService;
    }

    @GetMapping
    public List<String> list(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        return catalogService.listCategories(accessGate.isAdmin(authorization));
    }

    @PutMapping("/order")
    public ResponseEntity<Map<String, List<String>>> setOrder(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @RequestBody CategoryOrderRequest body) {
        accessGate.requireAdmin(authorization);
        return ResponseEntity.ok(Map.of("order", catalogService.setCategoryOrder(body.order())));
    }
}
