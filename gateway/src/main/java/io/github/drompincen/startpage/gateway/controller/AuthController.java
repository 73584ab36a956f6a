package io.github.drompincen.startpage.gateway.controller;

import io.github.drompincen.startpage.gateway.security.AccessGate;
import io.github.drompincen.startpage.protocol.api.ChangePasswordRequest;
import io.github.drompincen.startpage.protocol.api.LoginRequest;
import io.github.drompincen.startpage.protocol.api.TokenResponse;
import io.github.drompincen.startpage.runtime.auth.CredentialService;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/auth")
public class AuthController {

    private final AccessGate accessGate;
    private final CredentialService credentialService;

    public AuthController(AccessGate accessGate, CredentialService credentialService) {
        this.accessGate = accessGate;
        this.credentialService = credentialService;
    }

    @PostMapping("/login")
    public ResponseEntity<TokenResponse> login(@RequestBody LoginRequest body) {
        return ResponseEntity.ok(TokenResponse.bearer(accessGate.login(body.password())));
    }

    @PostMapping("/change-password")
    public ResponseEntity<Map<String, String>> changePassword(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @RequestBody ChangePasswordRequest body) {
        accessGate.requireAdmin(authorization);
        credentialService.changePassword(body.oldPassword(), body.newPassword());
        return ResponseEntity.ok(Map.of("message", "Password changed successfully"));
    }
}
