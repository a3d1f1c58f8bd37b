package io.github.drompincen.simgate.runtime.session;

import io.github.drompincen.simgate.runtime.engine.EngineException;
import io.github.drompincen.simgate.runtime.engine.ModelHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A caller-visible handle bound to exactly one engine model.
 * <p>
 * All access to the model goes through {@link #exclusive(ModelCall)}, which holds a per-session
 * lock for the duration of the call, so one session never runs two engine calls at once while
 * different sessions proceed independently. Instances are created and timestamped by
 * {@link SessionManager} only; callers should resolve sessions by id for every operation rather
 * than keep references around.
 */
public final class Session {

    private static final Logger log = LoggerFactory.getLogger(Session.class);

    private final String id;
    private final String casePath;
    private final ModelHandle model;
    private final Instant createdAt;
    private final ReentrantLock modelLock = new ReentrantLock(true);

    // written by SessionManager under its registry lock
    private volatile Instant lastAccessedAt;
    private long accessSeq;

    // guarded by modelLock
    private boolean released;

    Session(String id, ModelHandle model, String casePath, Instant createdAt, long accessSeq) {
        this.id = id;
        this.model = model;
        this.casePath = casePath;
        this.createdAt = createdAt;
        this.lastAccessedAt = createdAt;
        this.accessSeq = accessSeq;
    }

    public String id() {
        return id;
    }

    public String casePath() {
        return casePath;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant lastAccessedAt() {
        return lastAccessedAt;
    }

    long accessSeq() {
        return accessSeq;
    }

    void touch(Instant now, long seq) {
        this.lastAccessedAt = now;
        this.accessSeq = seq;
    }

    boolean isExpired(Instant now, Duration ttl) {
        return Duration.between(lastAccessedAt, now).compareTo(ttl) > 0;
    }

    /**
     * Runs {@code call} against the model while holding the session lock.
     *
     * @return the call's result, or empty when the session was released before the lock was
     *         obtained (closed, evicted or expired in the meantime)
     * @throws EngineException whatever the engine raised
     */
    public <T> Optional<T> exclusive(ModelCall<T> call) throws EngineException {
        modelLock.lock();
        try {
            if (released) {
                return Optional.empty();
            }
            return Optional.ofNullable(call.call(model));
        } finally {
            modelLock.unlock();
        }
    }

    public boolean isReleased() {
        modelLock.lock();
        try {
            return released;
        } finally {
            modelLock.unlock();
        }
    }

    /**
     * Closes the model once. Waits for an in-flight {@link #exclusive} call to finish first.
     *
     * @return {@code true} when this call performed the release
     */
    boolean release() {
        modelLock.lock();
        try {
            if (released) {
                return false;
            }
            released = true;
            try {
                model.close();
            } catch (RuntimeException e) {
                log.warn("Engine failed to release model of session {}: {}", id, e.getMessage(), e);
            }
            return true;
        } finally {
            modelLock.unlock();
        }
    }
}
