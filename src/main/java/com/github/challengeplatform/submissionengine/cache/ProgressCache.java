package com.github.challengeplatform.submissionengine.cache;

import com.github.challengeplatform.submissionengine.domain.CacheStats;
import com.github.challengeplatform.submissionengine.domain.ProgressEntry;
import com.github.challengeplatform.submissionengine.domain.ProgressStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.stream.Collectors;

/**
 * In-memory progress of submissions, used to answer status polls without touching the database. Entries are
 * immutable snapshots replaced atomically, so readers never see a partially applied update. The cache is advisory;
 * the submission table stays the source of truth.
 *
 * @author timo.buechert
 */
@Component
@Slf4j
public class ProgressCache {

    private final ConcurrentMap<String, ProgressEntry> entries = new ConcurrentHashMap<>();

    private final Clock clock;

    private final Duration retention;

    public ProgressCache(final Clock clock,
                         @Value("${submission.cache.retention:PT1H}") final Duration retention) {
        this.clock = clock;
        this.retention = retention;
    }

    public void set(final String submissionId, final ProgressStatus status, final String message,
                    final int progress, final String step, final String error) {
        final Instant now = clock.instant();
        final ProgressEntry entry = entries.compute(submissionId, (id, previous) -> previous == null
                ? ProgressEntry.create(id, status, message, progress, step, error, now)
                : previous.update(status, message, progress, step, error, now));

        log.info("Cache updated: {} -> {} ({}%): {}", submissionId, status.value(), entry.progressPercentage(), message);
    }

    public void set(final String submissionId, final ProgressStatus status, final String message,
                    final int progress, final String step) {
        set(submissionId, status, message, progress, step, null);
    }

    public Optional<ProgressEntry> get(final String submissionId) {
        final ProgressEntry entry = entries.get(submissionId);
        if (entry == null) {
            log.debug("Cache miss: {}", submissionId);
        }
        return Optional.ofNullable(entry);
    }

    public boolean remove(final String submissionId) {
        final boolean removed = entries.remove(submissionId) != null;
        if (removed) {
            log.info("Cache removed: {}", submissionId);
        }
        return removed;
    }

    /**
     * @return every entry that has not reached a terminal status, keyed by submission id
     */
    public Map<String, ProgressEntry> allActive() {
        return entries.values().stream()
                .filter(entry -> !entry.isFinal())
                .collect(Collectors.toMap(ProgressEntry::submissionId, entry -> entry));
    }

    public CacheStats stats() {
        final Map<String, ProgressEntry> snapshot = Map.copyOf(entries);
        final Map<String, Integer> byStatus = new TreeMap<>();
        snapshot.values().forEach(entry -> byStatus.merge(entry.status().value(), 1, Integer::sum));
        final int active = (int) snapshot.values().stream().filter(entry -> !entry.isFinal()).count();

        return new CacheStats(snapshot.size(), byStatus, active);
    }

    /**
     * Evicts terminal entries not updated within the retention window.
     *
     * @return the number of evicted entries
     */
    public int cleanupOldEntries() {
        final Instant threshold = clock.instant().minus(retention);
        int removed = 0;

        for (final ProgressEntry entry : entries.values()) {
            // an entry updated after the scan read it is left in place
            if (entry.isFinal() && entry.updatedAt().isBefore(threshold) && entries.remove(entry.submissionId(), entry)) {
                removed++;
            }
        }

        if (removed > 0) {
            log.info("Cache cleanup: removed {} old entries", removed);
        }
        return removed;
    }

    @Scheduled(fixedDelayString = "${submission.cache.cleanup-interval:PT5M}",
            initialDelayString = "${submission.cache.cleanup-interval:PT5M}")
    public void scheduledCleanup() {
        try {
            cleanupOldEntries();
        } catch (final RuntimeException e) {
            log.error("Error in cache cleanup", e);
        }
    }

    public int size() {
        return entries.size();
    }

}
