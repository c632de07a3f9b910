package com.crossreview.dispatch.api;

import com.crossreview.core.events.EventBus;
import com.crossreview.core.events.ReviewEvent;
import com.crossreview.core.session.ReviewSession;
import com.crossreview.core.session.SessionRegistry;
import com.crossreview.core.session.SessionSnapshot;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Streams the events of one review session to SSE clients.
 * <p>
 * A client that connects to a known session first receives a {@code review.snapshot} event with
 * the session's current state, so it can join between steps. Each stream is completed by the
 * server right after it forwards the event that ends its session; a client connecting to a
 * session that has already ended gets the snapshot and a completed stream.
 */
@Service
public class SseStreamingService {

    private static final Logger log = LoggerFactory.getLogger(SseStreamingService.class);

    static final String EVENT_SNAPSHOT = "review.snapshot";

    /** High-risk files are advanced one caller step at a time, so idle gaps can be long. */
    private static final long DEFAULT_TIMEOUT_MS = 30 * 60 * 1000L;

    private static final long HEARTBEAT_INTERVAL_SECONDS = 30;

    private final EventBus eventBus;
    private final SessionRegistry sessions;
    private final long timeoutMs;

    private final Map<String, List<SessionStream>> streamsBySession = new ConcurrentHashMap<>();

    private final ScheduledExecutorService heartbeatScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "sse-heartbeat");
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public SseStreamingService(EventBus eventBus, SessionRegistry sessions) {
        this(eventBus, sessions, DEFAULT_TIMEOUT_MS);
    }

    SseStreamingService(EventBus eventBus, SessionRegistry sessions, long timeoutMs) {
        this.eventBus = eventBus;
        this.sessions = sessions;
        this.timeoutMs = timeoutMs;
    }

    @PostConstruct
    void startHeartbeat() {
        heartbeatScheduler.scheduleAtFixedRate(this::sendHeartbeats,
                HEARTBEAT_INTERVAL_SECONDS, HEARTBEAT_INTERVAL_SECONDS, TimeUnit.SECONDS);
    }

    @PreDestroy
    void stop() {
        heartbeatScheduler.shutdownNow();
        streamsBySession.keySet().forEach(this::closeSession);
    }

    void sendHeartbeats() {
        streamsBySession.values().forEach(streams -> streams.forEach(stream -> {
            try {
                stream.emitter().send(SseEmitter.event().comment("heartbeat"));
            } catch (IOException | IllegalStateException e) {
                log.debug("Heartbeat failed for session {}, dropping stream: {}", stream.sessionId(), e.getMessage());
                remove(stream);
            }
        }));
    }

    public SseEmitter createEmitter(String sessionId) {
        SseEmitter emitter = new SseEmitter(timeoutMs);
        Optional<SessionSnapshot> snapshot = sessions.find(sessionId).map(ReviewSession::snapshot);

        if (snapshot.isPresent() && snapshot.get().stage().isTerminal()) {
            sendSnapshot(emitter, snapshot.get());
            emitter.complete();
            log.info("Session {} already {}, sent snapshot and closed stream", sessionId, snapshot.get().stage());
            return emitter;
        }

        var stream = new SessionStream(sessionId, emitter);
        stream.subscription = eventBus.subscribe(sessionId, event -> forward(stream, event));
        streamsBySession.computeIfAbsent(sessionId, k -> new CopyOnWriteArrayList<>()).add(stream);

        emitter.onCompletion(() -> remove(stream));
        emitter.onTimeout(() -> {
            log.debug("SSE stream timed out for session {}", sessionId);
            remove(stream);
        });
        emitter.onError(ex -> remove(stream));

        snapshot.ifPresentOrElse(s -> sendSnapshot(emitter, s), () -> sendComment(emitter, "waiting for session"));
        log.info("SSE stream opened for session {} ({} open)", sessionId, activeEmitterCount(sessionId));
        return emitter;
    }

    /**
     * Completes and drops every stream of the session.
     */
    private void closeSession(String sessionId) {
        List<SessionStream> streams = streamsBySession.remove(sessionId);
        if (streams == null) {
            return;
        }
        for (SessionStream stream : streams) {
            stream.unsubscribe();
            stream.emitter().complete();
        }
        log.info("Closed {} SSE stream(s) for ended session {}", streams.size(), sessionId);
    }

    public int activeEmitterCount() {
        return streamsBySession.values().stream().mapToInt(List::size).sum();
    }

    public int activeEmitterCount(String sessionId) {
        List<SessionStream> streams = streamsBySession.get(sessionId);
        return streams == null ? 0 : streams.size();
    }

    private void forward(SessionStream stream, ReviewEvent event) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("sessionId", event.sessionId());
        if (event.file() != null) {
            data.put("file", event.file());
        }
        data.putAll(event.payload());
        data.put("timestamp", event.timestamp().toString());
        try {
            stream.emitter().send(SseEmitter.event().name(event.eventType()).data(data));
        } catch (IOException | IllegalStateException e) {
            log.debug("Dropping SSE stream for session {} after failed send of {}: {}",
                    event.sessionId(), event.eventType(), e.getMessage());
            remove(stream);
            return;
        }
        if (event.endsSession()) {
            remove(stream);
            stream.emitter().complete();
            log.debug("Session {} ended with {}, SSE stream completed", event.sessionId(), event.eventType());
        }
    }

    private void sendSnapshot(SseEmitter emitter, SessionSnapshot snapshot) {
        try {
            emitter.send(SseEmitter.event().name(EVENT_SNAPSHOT).data(snapshot));
        } catch (IOException e) {
            log.warn("Failed to send snapshot for session {}: {}", snapshot.sessionId(), e.getMessage());
        }
    }

    private void sendComment(SseEmitter emitter, String comment) {
        try {
            emitter.send(SseEmitter.event().comment(comment));
        } catch (IOException e) {
            log.warn("Failed to send initial comment: {}", e.getMessage());
        }
    }

    private void remove(SessionStream stream) {
        stream.unsubscribe();
        streamsBySession.computeIfPresent(stream.sessionId(), (id, streams) -> {
            streams.remove(stream);
            return streams.isEmpty() ? null : streams;
        });
    }

    private static final class SessionStream {

        private final String sessionId;
        private final SseEmitter emitter;
        private volatile EventBus.Subscription subscription;

        SessionStream(String sessionId, SseEmitter emitter) {
            this.sessionId = sessionId;
            this.emitter = emitter;
        }

        String sessionId() {
            return sessionId;
        }

        SseEmitter emitter() {
            return emitter;
        }

        void unsubscribe() {
            EventBus.Subscription current = subscription;
            if (current != null) {
                current.unsubscribe();
            }
        }
    }
}
