package uk.gegc.readingplan.features.activity.application;

import uk.gegc.readingplan.features.activity.application.validation.AnswerValidationContext;

import java.util.Optional;
import java.util.UUID;

/**
 * Cache-aside store for generated activity content keyed by (plan, day, activity type).
 */
public interface ActivityContentCache {

    /**
     * Returns unexpired cached content, or generates and caches fresh content.
     * When generation fails the type's fallback content is returned and nothing is written,
     * so the next read tries the generator again. When the cache write fails the generated
     * content is returned uncached.
     */
    ResolvedActivityContent resolve(ActivityContentKey key, ActivityGenerationContext context);

    /**
     * Returns whatever is stored for the key, expired or not, without calling the generator.
     */
    Optional<ResolvedActivityContent> findStored(ActivityContentKey key);

    /**
     * Answer validation context for a day, backed by the stored entries of {@link #findStored}.
     * Both the day view and answer submission validate against this.
     */
    AnswerValidationContext validationContext(UUID planId, int dayIndex);

    /**
     * Generates new content and replaces the cached entry.
     *
     * @throws uk.gegc.readingplan.shared.exception.ContentGenerationException when the generator
     *         fails; the previous entry is left untouched
     */
    ResolvedActivityContent regenerate(ActivityContentKey key, ActivityGenerationContext context);

    /**
     * Deletes every cached entry of a day so the next reads regenerate.
     *
     * @return number of entries removed
     */
    int clearDay(UUID planId, int dayIndex);

    int purgeExpired();
}
