package uk.gegc.readingplan.features.plan.application.generation;

import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Process-local record of which student currently has a generation task running, and for which plan.
 *
 * <p>Only covers this instance; the durable generation lease is the cross-instance guard.
 */
@Component
public class GenerationLockRegistry {

    private final ConcurrentMap<Long, UUID> locks = new ConcurrentHashMap<>();

    /**
     * @return true when the lock was free and is now held for {@code planId}
     */
    public boolean tryAcquire(Long studentId, UUID planId) {
        UUID previous = locks.putIfAbsent(studentId, planId);
        return previous == null || previous.equals(planId);
    }

    public Optional<UUID> holder(Long studentId) {
        return Optional.ofNullable(locks.get(studentId));
    }

    /**
     * Releases the lock only if it is still held for {@code planId}.
     */
    public boolean release(Long studentId, UUID planId) {
        return locks.remove(studentId, planId);
    }

    public int size() {
        return locks.size();
    }
}
