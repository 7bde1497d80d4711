package in.civicdesk.config;

import in.civicdesk.service.escalation.EscalationScheduler;
import in.civicdesk.service.media.SizeHeuristicMediaGate;
import in.civicdesk.util.Env;

import java.time.Duration;
import java.time.temporal.ChronoUnit;

/**
 * Process configuration, read once at startup from environment variables
 * (or system properties of the same name).
 */
public record AppConfig(
    int port,
    String tokenSecret,
    Duration tokenTtl,              // Duration.ZERO = tokens never expire
    Duration escalationPeriod,
    Duration escalationStaleAfter,
    String escalationDepartment,
    int minPhotoBytes,
    long maxBodyBytes,
    String adminEmail,              // nullable
    String adminPassword            // nullable
) {
    public static final String DEV_TOKEN_SECRET = "civicdesk-dev-secret-change-in-production";

    public static AppConfig fromEnv() {
        return new AppConfig(
            Env.getInt("PORT", 4000),
            Env.get("TOKEN_SECRET", DEV_TOKEN_SECRET),
            Env.getDuration("TOKEN_EXPIRATION_HOURS", ChronoUnit.HOURS, Duration.ZERO),
            Env.getDuration("ESCALATION_PERIOD_SECONDS", ChronoUnit.SECONDS, EscalationScheduler.DEFAULT_PERIOD),
            Env.getDuration("ESCALATION_STALE_DAYS", ChronoUnit.DAYS, EscalationScheduler.DEFAULT_STALE_AFTER),
            Env.get("ESCALATION_DEPARTMENT", EscalationScheduler.DEFAULT_DEPARTMENT),
            Env.getInt("MEDIA_MIN_PHOTO_BYTES", SizeHeuristicMediaGate.DEFAULT_MIN_PHOTO_BYTES),
            Env.getLong("MAX_BODY_MB", 25) * 1024L * 1024L,
            Env.get("ADMIN_EMAIL", null),
            Env.get("ADMIN_PASSWORD", null)
        );
    }

    public boolean usesDevSecret() {
        return DEV_TOKEN_SECRET.equals(tokenSecret);
    }

    public boolean seedsAdmin() {
        return adminEmail != null && adminPassword != null;
    }
}
