package in.civicdesk.auth;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.civicdesk.domain.common.AuthenticationException;
import in.civicdesk.domain.user.User;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.util.Base64;

/**
 * HS256 compact JWT tokens.
 *
 * Claims: sub (user id), role, iat, and exp only when a TTL is configured.
 * With a zero TTL tokens never expire.
 */
public final class JwtAuthenticator implements Authenticator {
    private static final Logger log = LoggerFactory.getLogger(JwtAuthenticator.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String HEADER = base64Encode("{\"alg\":\"HS256\",\"typ\":\"JWT\"}");
    private static final String BEARER_PREFIX = "Bearer ";

    private final byte[] secret;
    private final Duration ttl;
    private final Clock clock;

    public JwtAuthenticator(String secret, Duration ttl, Clock clock) {
        if (secret == null || secret.isEmpty()) {
            throw new IllegalArgumentException("Token secret must not be empty");
        }
        this.secret = secret.getBytes(StandardCharsets.UTF_8);
        this.ttl = ttl != null ? ttl : Duration.ZERO;
        this.clock = clock;
    }

    @Override
    public String issueToken(User user) {
        long now = clock.millis() / 1000;

        ObjectNode claims = MAPPER.createObjectNode();
        claims.put("sub", user.userId());
        claims.put("role", user.role().wireName());
        claims.put("iat", now);
        if (!ttl.isZero()) {
            claims.put("exp", now + ttl.toSeconds());
        }

        String payload = base64Encode(claims.toString());
        return HEADER + "." + payload + "." + sign(HEADER + "." + payload);
    }

    @Override
    public String resolveUserId(String token) {
        if (token == null || token.isBlank()) {
            throw new AuthenticationException("Missing token");
        }
        // auth scheme is case-insensitive
        if (token.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            token = token.substring(BEARER_PREFIX.length()).trim();
        }

        String[] parts = token.split("\\.");
        if (parts.length != 3) {
            log.debug("Invalid token format");
            throw new AuthenticationException("Malformed token");
        }

        byte[] expected = sign(parts[0] + "." + parts[1]).getBytes(StandardCharsets.US_ASCII);
        if (!MessageDigest.isEqual(expected, parts[2].getBytes(StandardCharsets.US_ASCII))) {
            log.debug("Invalid token signature");
            throw new AuthenticationException("Invalid token");
        }

        JsonNode claims;
        try {
            claims = MAPPER.readTree(Base64.getUrlDecoder().decode(parts[1]));
        } catch (Exception e) {
            throw new AuthenticationException("Malformed token", e);
        }

        JsonNode sub = claims.get("sub");
        if (sub == null || !sub.isTextual() || sub.asText().isEmpty()) {
            throw new AuthenticationException("Malformed token");
        }

        JsonNode exp = claims.get("exp");
        if (exp != null && exp.canConvertToLong() && clock.millis() / 1000 > exp.asLong()) {
            log.debug("Token expired");
            throw new AuthenticationException("Token expired");
        }

        return sub.asText();
    }

    private String sign(String data) {
        try {
            Mac mac = Mac.getInstance("HmacSHA256");
            mac.init(new SecretKeySpec(secret, "HmacSHA256"));
            byte[] hash = mac.doFinal(data.getBytes(StandardCharsets.UTF_8));
            return Base64.getUrlEncoder().withoutPadding().encodeToString(hash);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to sign token", e);
        }
    }

    private static String base64Encode(String data) {
        return Base64.getUrlEncoder().withoutPadding()
            .encodeToString(data.getBytes(StandardCharsets.UTF_8));
    }
}
