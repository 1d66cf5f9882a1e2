package com.flagship.procurement_ledger.conversation;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * In-memory scratch state per chat identity.
 *
 * Holds at most one active flow per identity. Entries expire after a period
 * without activity, so abandoned conversations do not accumulate. State is
 * not persisted: after a restart users simply start over.
 */
@Component
@Slf4j
public class SessionStore {

    private final Cache<String, FlowState> sessions;

    public SessionStore(@Value("${procurement.session.idle-ttl:PT60M}") Duration idleTtl) {
        this.sessions = Caffeine.newBuilder()
                .expireAfterAccess(idleTtl)
                .build();
    }

    public Optional<FlowState> current(String identity) {
        return Optional.ofNullable(sessions.getIfPresent(identity));
    }

    /**
     * Returns the active flow if it is of the given type.
     */
    public <T extends FlowState> Optional<T> current(String identity, Class<T> type) {
        return current(identity)
                .filter(type::isInstance)
                .map(type::cast);
    }

    /**
     * Starts a flow, replacing whatever flow the identity had.
     */
    public void begin(String identity, FlowState state) {
        FlowState previous = sessions.asMap().put(identity, state);
        if (previous != null) {
            log.debug("Replaced {} flow of {} with {}", previous.kind(), identity, state.kind());
        }
    }

    public void end(String identity) {
        sessions.invalidate(identity);
    }

    public long activeSessions() {
        sessions.cleanUp();
        return sessions.estimatedSize();
    }
}
