package io.github.drompincen.startpage.gateway.controller;

import io.github.drompincen.startpage.gateway.security.AccessGate;
import io.github.drompincen.startpage.protocol.api.SettingsDto;
import io.github.drompincen.startpage.runtime.settings.SettingsService;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/settings")
public class SettingsController {

    private final AccessGate accessGate;
    private final SettingsService settingsService;

    public SettingsController(AccessGate accessGate, SettingsService settingsService) {
        this.accessGate = accessGate;
        this.settingsService = settingsService;
    }

    @GetMapping
    public SettingsDto get() {
        return settingsService.get();
    }

    @PutMapping
    public ResponseEntity<SettingsDto> put(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @RequestBody SettingsDto body) {
        accessGate.requireAdmin(authorization);
        return ResponseEntity.ok(settingsService.put(body));
    }
}
