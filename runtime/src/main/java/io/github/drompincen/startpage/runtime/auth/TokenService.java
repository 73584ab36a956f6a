package io.github.drompincen.startpage.runtime.auth;

import io.github.drompincen.startpage.persistence.document.AdminDocument;
import org.jose4j.jwa.AlgorithmConstraints;
import org.jose4j.jws.AlgorithmIdentifiers;
import org.jose4j.jws.JsonWebSignature;
import org.jose4j.jwt.JwtClaims;
import org.jose4j.jwt.MalformedClaimException;
import org.jose4j.jwt.NumericDate;
import org.jose4j.jwt.consumer.ErrorCodes;
import org.jose4j.jwt.consumer.InvalidJwtException;
import org.jose4j.jwt.consumer.JwtConsumer;
import org.jose4j.jwt.consumer.JwtConsumerBuilder;
import org.jose4j.keys.HmacKey;
import org.jose4j.lang.JoseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Issues and verifies HS256-signed JWT bearer tokens for the admin identity.
 *
 * <p>Tokens are self-contained: there is no server-side session table and no revocation list,
 * so logging out is the client discarding its token. A token verifies only when its signature
 * matches, its {@code exp} claim is in the future and its {@code sub} claim is the admin.
 * Expiry is evaluated against the injected {@link Clock} with no skew allowance.</p>
 */
@Service
public class TokenService {

    private static final Logger log = LoggerFactory.getLogger(TokenService.class);

    public static final String DEFAULT_SECRET = "change-this-secret-key-in-production-to-a-random-string";
    private static final AlgorithmConstraints HS256_ONLY =
            new AlgorithmConstraints(AlgorithmConstraints.ConstraintType.PERMIT, AlgorithmIdentifiers.HMAC_SHA256);

    private final Clock clock;
    private final HmacKey signingKey;
    private final Duration ttl;

    public TokenService(Clock clock,
                        @Value("${startpage.auth.secret-key:" + DEFAULT_SECRET + "}") String secret,
                        @Value("${startpage.auth.token-ttl:PT24H}") Duration ttl) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalArgumentException("startpage.auth.secret-key must not be blank");
        }
        if (DEFAULT_SECRET.equals(secret)) {
            log.warn("Token signing key is the built-in default; set startpage.auth.secret-key "
                    + "(STARTPAGE_AUTH_SECRET_KEY) so issued tokens cannot be forged");
        }
        this.clock = clock;
        this.signingKey = new HmacKey(secret.getBytes(StandardCharsets.UTF_8));
        this.ttl = ttl;
    }

    public String issue(String identity) {
        Instant now = clock.instant();
        JwtClaims claims = new JwtClaims();
        claims.setSubject(identity);
        claims.setIssuedAt(NumericDate.fromSeconds(now.getEpochSecond()));
        claims.setExpirationTime(NumericDate.fromSeconds(now.plus(ttl).getEpochSecond()));

        JsonWebSignature jws = new JsonWebSignature();
        jws.setPayload(claims.toJson());
        jws.setAlgorithmHeaderValue(AlgorithmIdentifiers.HMAC_SHA256);
        jws.setHeader("typ", "JWT");
        jws.setKey(signingKey);
        // operators may configure secrets shorter than 256 bits
        jws.setDoKeyValidation(false);
        try {
            return jws.getCompactSerialization();
        } catch (JoseException e) {
            throw new IllegalStateException("Failed to sign token", e);
        }
    }

    /** Returns the admin identity carried by {@code token}, or throws {@link InvalidTokenException}. */
    public String verify(String token) {
        if (token == null || token.isBlank()) {
            throw new InvalidTokenException("Missing token");
        }
        JwtClaims claims;
        try {
            claims = consumerAt(clock.instant()).processToClaims(token);
        } catch (InvalidJwtException e) {
            if (e.hasExpired()) {
                throw new InvalidTokenException("Token expired", e);
            }
            if (e.hasErrorCode(ErrorCodes.SIGNATURE_INVALID)) {
                throw new InvalidTokenException("Invalid token signature", e);
            }
            throw new InvalidTokenException("Malformed token", e);
        }

        String subject;
        try {
            subject = claims.getSubject();
        } catch (MalformedClaimException e) {
            throw new InvalidTokenException("Malformed token subject", e);
        }
        if (!AdminDocument.ADMIN_USERNAME.equals(subject)) {
            throw new InvalidTokenException("Token subject is not the admin");
        }
        return subject;
    }

    /** Like {@link #verify} but treats an absent, malformed or expired token as anonymous. */
    public Optional<String> verifyOptional(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(verify(token));
        } catch (InvalidTokenException e) {
            log.debug("Ignoring token on read path: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private JwtConsumer consumerAt(Instant now) {
        return new JwtConsumerBuilder()
                .setRequireExpirationTime()
                .setRequireSubject()
                .setEvaluationTime(NumericDate.fromSeconds(now.getEpochSecond()))
                .setAllowedClockSkewInSeconds(0)
                .setVerificationKey(signingKey)
                .setRelaxVerificationKeyValidation()
                .setJwsAlgorithmConstraints(HS256_ONLY)
                .build();
    }
}
