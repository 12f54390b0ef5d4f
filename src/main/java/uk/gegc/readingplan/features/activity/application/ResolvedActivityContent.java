package uk.gegc.readingplan.features.activity.application;

import com.fasterxml.jackson.databind.JsonNode;
import uk.gegc.readingplan.features.activity.domain.model.ActivityType;

import java.time.Instant;

/**
 * Activity payload as served to clients.
 *
 * @param fallback  true when static content replaced a failed generation; such content is never cached
 * @param expiresAt cache expiry, null for fallback content
 */
public record ResolvedActivityContent(
        ActivityType type,
        JsonNode content,
        String contentHash,
        boolean fallback,
        Instant expiresAt
) {
}
