package io.github.drompincen.startpage.gateway.security;

import io.github.drompincen.startpage.persistence.document.AdminDocument;
import io.github.drompincen.startpage.runtime.auth.CredentialService;
import io.github.drompincen.startpage.runtime.auth.InvalidTokenException;
import io.github.drompincen.startpage.runtime.auth.TokenService;
import io.github.drompincen.startpage.runtime.auth.UnauthorizedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Decides who is calling from the {@code Authorization} header. Admin-only endpoints go through
 * {@link #requireAdmin}; public endpoints that show more to the admin use {@link #resolveViewer},
 * which treats a missing or bad token as an anonymous caller instead of failing.
 */
@Component
public class AccessGate {

    private static final Logger log = LoggerFactory.getLogger(AccessGate.class);
    private static final String BEARER = "Bearer";

    private final TokenService tokenService;
    private final CredentialService credentialService;

    public AccessGate(TokenService tokenService, CredentialService credentialService) {
        this.tokenService = tokenService;
        this.credentialService = credentialService;
    }

    public String login(String password) {
        if (!credentialService.verify(password)) {
            log.warn("Rejected admin login attempt");
            throw new UnauthorizedException("Invalid password");
        }
        log.info("Admin logged in");
        return tokenService.issue(AdminDocument.ADMIN_USERNAME);
    }

    public String requireAdmin(String authorizationHeader) {
        String token = bearerToken(authorizationHeader)
                .orElseThrow(() -> new UnauthorizedException("Not authenticated"));
        try {
            return tokenService.verify(token);
        } catch (InvalidTokenException e) {
            throw new UnauthorizedException("Could not validate credentials");
        }
    }

    /** Admin identity if the header carries a valid token, otherwise empty. */
    public Optional<String> resolveViewer(String authorizationHeader) {
        return bearerToken(authorizationHeader).flatMap(tokenService::verifyOptional);
    }

    public boolean isAdmin(String authorizationHeader) {
        return resolveViewer(authorizationHeader).isPresent();
    }

    static Optional<String> bearerToken(String header) {
        if (header == null) {
            return Optional.empty();
        }
        String trimmed = header.trim();
        int space = trimmed.indexOf(' ');
        if (space < 0 || !trimmed.substring(0, space).equalsIgnoreCase(BEARER)) {
            return Optional.empty();
        }
        String token = trimmed.substring(space + 1).trim();
        return token.isEmpty() ? Optional.empty() : Optional.of(token);
    }
}
