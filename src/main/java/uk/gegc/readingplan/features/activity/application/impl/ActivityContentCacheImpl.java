package uk.gegc.readingplan.features.activity.application.impl;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;
import uk.gegc.readingplan.features.activity.application.ActivityContentCache;
import uk.gegc.readingplan.features.activity.application.ActivityContentKey;
import uk.gegc.readingplan.features.activity.application.ActivityGenerationContext;
import uk.gegc.readingplan.features.activity.application.FallbackContentProvider;
import uk.gegc.readingplan.features.activity.application.ResolvedActivityContent;
import uk.gegc.readingplan.features.activity.application.validation.AnswerValidationContext;
import uk.gegc.readingplan.features.activity.config.ActivityProperties;
import uk.gegc.readingplan.features.activity.domain.model.ActivityContent;
import uk.gegc.readingplan.features.activity.domain.repository.ActivityContentRepository;
import uk.gegc.readingplan.features.ai.application.ContentGenerator;
import uk.gegc.readingplan.shared.exception.ContentGenerationException;
import uk.gegc.readingplan.shared.util.ContentHashUtil;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class ActivityContentCacheImpl implements ActivityContentCache {

    private static final TypeReference<Map<String, Object>> CONTENT_TYPE = new TypeReference<>() {
    };

    private final ActivityContentRepository contentRepository;
    private final ContentGenerator contentGenerator;
    private final FallbackContentProvider fallbackContentProvider;
    private final ContentHashUtil contentHashUtil;
    private final ActivityProperties activityProperties;
    private final ObjectMapper objectMapper;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    @Override
    public ResolvedActivityContent resolve(ActivityContentKey key, ActivityGenerationContext context) {
        Instant now = Instant.now(clock);
        Optional<ActivityContent> cached = contentRepository.findByPlanIdAndDayIndexAndActivityType(
                key.planId(), key.dayIndex(), key.type());
        if (cached.isPresent() && cached.get().isFresh(now)) {
            log.debug("Activity content cache hit for {}", key);
            return toResolved(cached.get());
        }

        JsonNode generated;
        try {
            generated = contentGenerator.generateActivity(context.student(), context.chapterText(), key.type());
        } catch (RuntimeException e) {
            log.warn("Generation failed for {}, serving fallback content: {}", key, e.getMessage());
            return fallback(key, context);
        }
        if (generated == null || !generated.isObject()) {
            log.warn("Generated {} content is not a JSON object, serving fallback content", key);
            return fallback(key, context);
        }
        try {
            return toResolved(upsert(key, generated, context.student().age()));
        } catch (DataAccessException e) {
            log.warn("Could not cache generated content for {}, serving it uncached: {}", key, e.getMessage());
            return new ResolvedActivityContent(key.type(), generated, contentHashUtil.hash(generated), false, null);
        }
    }

    @Override
    public Optional<ResolvedActivityContent> findStored(ActivityContentKey key) {
        return contentRepository.findByPlanIdAndDayIndexAndActivityType(key.planId(), key.dayIndex(), key.type())
                .map(this::toResolved);
    }

    @Override
    public AnswerValidationContext validationContext(UUID planId, int dayIndex) {
        return type -> findStored(new ActivityContentKey(planId, dayIndex, type))
                .map(ResolvedActivityContent::content);
    }

    @Override
    public ResolvedActivityContent regenerate(ActivityContentKey key, ActivityGenerationContext context) {
        JsonNode generated;
        try {
            generated = contentGenerator.generateActivity(context.student(), context.chapterText(), key.type());
        } catch (ContentGenerationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ContentGenerationException("Failed to regenerate " + key.type().getKey() + " content", e);
        }
        ActivityContent stored = upsert(key, generated, context.student().age());
        log.info("Regenerated {} content for plan {} day {} (hash {})",
                key.type().getKey(), key.planId(), key.dayIndex(), stored.getContentHash());
        return toResolved(stored);
    }

    @Override
    public int clearDay(UUID planId, int dayIndex) {
        int removed = contentRepository.deleteByPlanIdAndDayIndex(planId, dayIndex);
        log.info("Cleared {} cached activity entries for plan {} day {}", removed, planId, dayIndex);
        return removed;
    }

    @Override
    public int purgeExpired() {
        return contentRepository.deleteExpired(Instant.now(clock));
    }

    private ActivityContent upsert(ActivityContentKey key, JsonNode generated, int studentAge) {
        if (generated == null || !generated.isObject()) {
            throw new ContentGenerationException("Generated " + key.type().getKey() + " content is not a JSON object");
        }
        Map<String, Object> content = objectMapper.convertValue(generated, CONTENT_TYPE);
        String hash = contentHashUtil.hash(generated);
        Instant now = Instant.now(clock);
        Instant expiresAt = now.plus(activityProperties.getCacheTtl());

        try {
            return writeEntry(key, content, hash, studentAge, now, expiresAt);
        } catch (DataIntegrityViolationException e) {
            // Another request inserted the row first; overwrite it
            log.debug("Concurrent insert for {}, retrying as update", key);
            return writeEntry(key, content, hash, studentAge, now, expiresAt);
        }
    }

    private ActivityContent writeEntry(ActivityContentKey key, Map<String, Object> content, String hash,
                                       int studentAge, Instant now, Instant expiresAt) {
        return transactionTemplate.execute(status -> {
            ActivityContent entry = contentRepository
                    .findByPlanIdAndDayIndexAndActivityType(key.planId(), key.dayIndex(), key.type())
                    .orElseGet(() -> new ActivityContent(key.planId(), key.dayIndex(), key.type()));
            entry.refresh(content, hash, studentAge, now, expiresAt);
            return contentRepository.saveAndFlush(entry);
        });
    }

    private ResolvedActivityContent fallback(ActivityContentKey key, ActivityGenerationContext context) {
        JsonNode content = fallbackContentProvider.fallback(key.type(), context.student().age());
        return new ResolvedActivityContent(key.type(), content, contentHashUtil.hash(content), true, null);
    }

    private ResolvedActivityContent toResolved(ActivityContent entry) {
        JsonNode content = objectMapper.valueToTree(entry.getContent());
        return new ResolvedActivityContent(entry.getActivityType(), content, entry.getContentHash(), false, entry.getExpiresAt());
    }
}
