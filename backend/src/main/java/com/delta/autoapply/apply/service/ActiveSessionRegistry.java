package com.delta.autoapply.apply.service;

import com.delta.autoapply.apply.flow.CancellationSignal;
import com.delta.autoapply.apply.model.ApplicationSession;
import com.delta.autoapply.apply.model.IllegalSessionStateException;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory sessions plus the cancellation signal of whichever flow currently owns each one.
 */
@Component
public class ActiveSessionRegistry {
    private final Map<UUID, ApplicationSession> sessions = new ConcurrentHashMap<>();
    private final Map<UUID, CancellationSignal> flows = new ConcurrentHashMap<>();
    private final Map<UUID, String> progress = new ConcurrentHashMap<>();

    public void register(ApplicationSession session) {
        sessions.put(session.getId(), session);
    }

    public Optional<ApplicationSession> find(UUID sessionId) {
        return Optional.ofNullable(sessionId == null ? null : sessions.get(sessionId));
    }

    public List<ApplicationSession> list() {
        return sessions.values().stream()
            .sorted(Comparator.comparing(ApplicationSession::getStartedAt).reversed())
            .toList();
    }

    /**
     * Claims the session for a new flow. A session is owned by at most one flow at a time.
     */
    public CancellationSignal beginFlow(UUID sessionId) {
        CancellationSignal signal = CancellationSignal.create();
        CancellationSignal existing = flows.putIfAbsent(sessionId, signal);
        if (existing != null) {
            throw new IllegalSessionStateException("Session " + sessionId + " already has an automation flow running");
        }
        return signal;
    }

    public void endFlow(UUID sessionId) {
        flows.remove(sessionId);
    }

    public boolean isInFlight(UUID sessionId) {
        return flows.containsKey(sessionId);
    }

    public CancellationSignal signalFor(UUID sessionId) {
        return flows.get(sessionId);
    }

    public void recordProgress(UUID sessionId, String message) {
        if (message != null) {
            progress.put(sessionId, message);
        }
    }

    public String latestProgress(UUID sessionId) {
        return progress.get(sessionId);
    }
}
