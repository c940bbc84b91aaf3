package com.delta.autoapply.apply.audit;

import com.delta.autoapply.apply.model.ApplicationSession;

public interface AuditLogger {
    /**
     * Persists the terminal state of a session. Failures are logged, never thrown.
     */
    void record(ApplicationSession session);
}
