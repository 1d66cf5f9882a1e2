package com.flagship.procurement_ledger.chat;

import com.flagship.procurement_ledger.observability.ProcurementMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;

/**
 * Drops inbound chat events that were already handled.
 *
 * The transport may redeliver an event (consumer restart, HTTP retry). Replaying
 * a confirmation would append a second request, so each event id is claimed in
 * Redis with {@code SET NX} before the event is processed.
 *
 * Redis is a fast path only: if it is missing or unreachable the event is processed.
 */
@Service
@Slf4j
public class InboundEventDeduplicator {

    private static final String REDIS_KEY_PREFIX = "chat-event:";

    private final Optional<StringRedisTemplate> redisTemplate;
    private final ProcurementMetrics metrics;
    private final Duration ttl;

    public InboundEventDeduplicator(Optional<StringRedisTemplate> redisTemplate,
                                    ProcurementMetrics metrics,
                                    @Value("${chat.inbound.dedup-ttl:PT24H}") Duration ttl) {
        this.redisTemplate = redisTemplate;
        this.metrics = metrics;
        this.ttl = ttl;
    }

    /**
     * Claims an event id.
     *
     * @param eventId id from the envelope, may be null
     * @return false if the id was claimed before, true otherwise
     */
    public boolean claim(String eventId) {
        if (eventId == null || eventId.isBlank() || redisTemplate.isEmpty()) {
            return true;
        }

        try {
            Boolean claimed = redisTemplate.get().opsForValue()
                    .setIfAbsent(REDIS_KEY_PREFIX + eventId, "1", ttl);

            if (Boolean.FALSE.equals(claimed)) {
                log.info("Chat event {} already processed, skipping", eventId);
                metrics.recordDuplicateEvent();
                return false;
            }
            return true;

        } catch (Exception e) {
            log.warn("Redis claim failed for chat event {}, processing without de-duplication: {}",
                    eventId, e.getMessage());
            return true;
        }
    }

    /**
     * Gives up a claim so a redelivery of the event is processed again.
     */
    public void release(String eventId) {
        if (eventId == null || eventId.isBlank() || redisTemplate.isEmpty()) {
            return;
        }

        try {
            redisTemplate.get().delete(REDIS_KEY_PREFIX + eventId);
            log.debug("Released claim on chat event {}", eventId);
        } catch (Exception e) {
            log.warn("Could not release claim on chat event {}, a redelivery will be dropped: {}",
                    eventId, e.getMessage());
        }
    }
}
