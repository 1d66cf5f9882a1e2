package com.flagship.procurement_ledger.observability;

import com.flagship.procurement_ledger.conversation.SessionStore;
import com.flagship.procurement_ledger.store.LedgerStore;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * Health indicators for the procurement ledger service.
 */
public class HealthIndicators {

    /**
     * The ledger store is required: without it no request can be recorded.
     */
    @Component("ledgerStoreHealth")
    public static class LedgerStoreHealthIndicator implements HealthIndicator {

        private final LedgerStore ledgerStore;
        private final SessionStore sessions;

        public LedgerStoreHealthIndicator(LedgerStore ledgerStore, SessionStore sessions) {
            this.ledgerStore = ledgerStore;
            this.sessions = sessions;
        }

        @Override
        public Health health() {
            try {
                ledgerStore.verifyConnection();
                return Health.up()
                        .withDetail("activeSessions", sessions.activeSessions())
                        .build();
            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .build();
            }
        }
    }

    /**
     * Redis only de-duplicates inbound events, so it reports DEGRADED rather than DOWN.
     */
    @Component("redisHealth")
    public static class RedisHealthIndicator implements HealthIndicator {

        private final StringRedisTemplate redisTemplate;

        public RedisHealthIndicator(StringRedisTemplate redisTemplate) {
            this.redisTemplate = redisTemplate;
        }

        @Override
        public Health health() {
            try {
                var connectionFactory = redisTemplate.getConnectionFactory();
                if (connectionFactory == null) {
                    return degraded("No connection factory configured");
                }

                try (var connection = connectionFactory.getConnection()) {
                    String result = connection.ping();
                    if ("PONG".equals(result)) {
                        return Health.up()
                                .withDetail("response", result)
                                .build();
                    }
                    return degraded("Unexpected ping response: " + result);
                }

            } catch (Exception e) {
                return degraded(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            }
        }

        private Health degraded(String error) {
            return Health.status("DEGRADED")
                    .withDetail("error", error)
                    .withDetail("note", "Inbound events are processed without de-duplication")
                    .build();
        }
    }

    /**
     * Kafka carries both inbound events and replies.
     */
    @Component("kafkaHealth")
    public static class KafkaHealthIndicator implements HealthIndicator {

        private final KafkaTemplate<String, String> kafkaTemplate;

        public KafkaHealthIndicator(KafkaTemplate<String, String> kafkaTemplate) {
            this.kafkaTemplate = kafkaTemplate;
        }

        @Override
        public Health health() {
            try {
                var metrics = kafkaTemplate.metrics();
                if (metrics == null || metrics.isEmpty()) {
                    return Health.down()
                            .withDetail("error", "No Kafka connections established")
                            .build();
                }
                return Health.up()
                        .withDetail("metricsCount", metrics.size())
                        .build();

            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .build();
            }
        }
    }
}
