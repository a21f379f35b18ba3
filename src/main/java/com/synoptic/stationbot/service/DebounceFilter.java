package com.synoptic.stationbot.service;

import io.micronaut.context.annotation.Value;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Drops repeated triggers for the same menu message within a short window.
 *
 * <p>Entries are keyed by (conversation, message). A trigger is suppressed iff the
 * entry holds the same action signature and was recorded less than the window ago;
 * otherwise the trigger's signature and time replace the entry. The check and the
 * update run inside one {@link ConcurrentMap#compute} so two racing duplicates cannot
 * both pass.
 *
 * <p>State is process-local and is lost on restart.
 */
@Singleton
public class DebounceFilter {

    private static final Logger log = LoggerFactory.getLogger(DebounceFilter.class);

    private final Duration window;
    private final ConcurrentMap<Key, Entry> entries = new ConcurrentHashMap<>();

    @Inject
    public DebounceFilter(@Value("${station-bot.debounce-window:1500ms}") Duration window) {
        if (window.isNegative()) {
            throw new IllegalArgumentException("debounce window must not be negative: " + window);
        }
        this.window = window;
    }

    /**
     * Decides whether a trigger is a duplicate and records it when it is not.
     *
     * @param conversationId  conversation the trigger came from
     * @param messageId       menu message clicked; null for typed commands
     * @param actionSignature payload identifying the action
     * @param now             trigger time
     * @return true if the trigger must be dropped
     */
    public boolean shouldSuppress(long conversationId, Integer messageId, String actionSignature, Instant now) {
        Key key = new Key(conversationId, messageId);
        boolean[] suppressed = new boolean[1];

        entries.compute(key, (k, last) -> {
            if (last != null
                    && Objects.equals(last.signature(), actionSignature)
                    && Duration.between(last.at(), now).compareTo(window) < 0) {
                suppressed[0] = true;
                return last;
            }
            return new Entry(actionSignature, now);
        });

        if (suppressed[0]) {
            log.debug("Suppressed duplicate conversation={} message={} action={}",
                    conversationId, messageId, actionSignature);
        }
        return suppressed[0];
    }

    /**
     * Removes entries recorded at least one window before {@code now}.
     *
     * @return number of entries removed
     */
    public int evictStale(Instant now) {
        Instant cutoff = now.minus(window);
        int before = entries.size();
        entries.entrySet().removeIf(e -> !e.getValue().at().isAfter(cutoff));
        int removed = Math.max(0, before - entries.size());
        if (removed > 0) {
            log.debug("Evicted {} debounce entries older than {}", removed, cutoff);
        }
        return removed;
    }

    public Duration window() {
        return window;
    }

    int size() {
        return entries.size();
    }

    private record Key(long conversationId, Integer messageId) {
    }

    private record Entry(String signature, Instant at) {
    }
}
