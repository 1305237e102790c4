package com.vidnyan.cursormcp.application.service;

import com.vidnyan.cursormcp.config.RulesProperties;
import com.vidnyan.cursormcp.domain.rule.RuleSet;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * In-memory rule sets keyed by technology.
 *
 * An entry is fresh while less than the TTL has passed since it was stored. Stale
 * entries stay in place until the next load overwrites them; nothing is evicted.
 * Loads for the same technology run one at a time, so concurrent readers of a stale
 * entry trigger a single load.
 */
@Slf4j
@Component
public class RuleCache {

    public record CacheEntry(RuleSet ruleSet, Instant storedAt) {

        public boolean isFresh(Instant now, Duration ttl) {
            return Duration.between(storedAt, now).compareTo(ttl) < 0;
        }
    }

    private final Map<String, CacheEntry> entries = new ConcurrentHashMap<>();
    private final Map<String, Object> loadLocks = new ConcurrentHashMap<>();
    private final Duration ttl;
    private final Clock clock;

    public RuleCache(RulesProperties properties, Clock clock) {
        this.ttl = properties.getCacheTtl();
        this.clock = clock;
        log.info("Initialized rule cache with TTL: {}", ttl);
    }

    /**
     * Return the fresh entry for the technology, or run the loader and store its result.
     */
    public RuleSet getOrLoad(String technology, Supplier<RuleSet> loader) {
        Optional<RuleSet> cached = fresh(technology);
        if (cached.isPresent()) {
            log.debug("Cache hit for technology: {}", technology);
            return cached.get();
        }

        synchronized (loadLocks.computeIfAbsent(technology, key -> new Object())) {
            cached = fresh(technology);
            if (cached.isPresent()) {
                log.debug("Rules for {} were loaded by another request", technology);
                return cached.get();
            }

            log.debug("Cache miss for technology: {}", technology);
            RuleSet loaded = loader.get();
            entries.put(technology, new CacheEntry(loaded, clock.instant()));
            return loaded;
        }
    }

    public Optional<CacheEntry> entry(String technology) {
        return Optional.ofNullable(entries.get(technology));
    }

    public Duration ttl() {
        return ttl;
    }

    private Optional<RuleSet> fresh(String technology) {
        CacheEntry entry = entries.get(technology);
        if (entry != null && entry.isFresh(clock.instant(), ttl)) {
            return Optional.of(entry.ruleSet());
        }
        return Optional.empty();
    }
}
