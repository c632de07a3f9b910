package com.crossreview.core.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns every in-flight {@link ReviewSession}, keyed by session id.
 * Exactly one instance per id: creating a session under an existing id deactivates the old one.
 */
@Service
public class SessionRegistry {

    private static final Logger log = LoggerFactory.getLogger(SessionRegistry.class);

    private final ConcurrentHashMap<String, ReviewSession> sessions = new ConcurrentHashMap<>();

    public ReviewSession create(String sessionId, String projectPath, List<String> files) {
        var session = new ReviewSession(sessionId, projectPath, files);
        ReviewSession previous = sessions.put(sessionId, session);
        if (previous != null) {
            log.info("Replacing existing review session {}", sessionId);
            previous.deactivate();
        }
        log.info("Created review session {} with {} file(s)", sessionId, files.size());
        return session;
    }

    public Optional<ReviewSession> find(String sessionId) {
        if (sessionId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(sessions.get(sessionId));
    }

    /**
     * @throws SessionNotFoundException if no active session exists under {@code sessionId}
     */
    public ReviewSession require(String sessionId) {
        return find(sessionId)
                .filter(ReviewSession::isActive)
                .orElseThrow(() -> new SessionNotFoundException(sessionId));
    }

    /**
     * Removes and deactivates the session. Idempotent.
     *
     * @return the removed session, if there was one
     */
    public Optional<ReviewSession> remove(String sessionId) {
        ReviewSession removed = sessionId == null ? null : sessions.remove(sessionId);
        if (removed != null) {
            removed.deactivate();
            log.info("Removed review session {}", sessionId);
        }
        return Optional.ofNullable(removed);
    }

    public int size() {
        return sessions.size();
    }

    public Set<String> ids() {
        return Set.copyOf(sessions.keySet());
    }
}
