package io.github.drompincen.simgate.runtime.session;

import io.github.drompincen.simgate.protocol.api.SessionSummaryDto;
import io.github.drompincen.simgate.runtime.engine.ModelHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Registry of live {@link Session}s with capacity and idle-time bounds.
 * <p>
 * Every read-modify-write on the registry runs under one lock, so concurrent {@link #create}
 * calls can never jointly exceed the capacity. Models of removed sessions are released after that
 * lock is dropped; releasing waits for any in-flight call on the same session, and once an id has
 * been removed no lookup resolves it again.
 */
public class SessionManager {

    private static final Logger log = LoggerFactory.getLogger(SessionManager.class);

    /** Least recently used first; equal timestamps fall back to access order. */
    private static final Comparator<Session> LRU_ORDER = Comparator
            .comparing(Session::lastAccessedAt)
            .thenComparingLong(Session::accessSeq);

    private final Map<String, Session> registry = new HashMap<>();
    private final ReentrantLock registryLock = new ReentrantLock();
    private final int capacity;
    private final Duration ttl;
    private final Clock clock;
    private long accessCounter;
    private boolean shutdown;

    public SessionManager(int capacity, Duration ttl, Clock clock) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1, got " + capacity);
        }
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive, got " + ttl);
        }
        this.capacity = capacity;
        this.ttl = ttl;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public int capacity() {
        return capacity;
    }

    public Duration ttl() {
        return ttl;
    }

    /**
     * Registers a new session owning {@code model}. Expired sessions are swept first; when the
     * registry is still full the least recently accessed session is evicted.
     *
     * @return the new session id
     */
    public String create(ModelHandle model, String casePath) {
        Objects.requireNonNull(model, "model");
        List<Session> removed = new ArrayList<>();
        String id;
        registryLock.lock();
        try {
            if (shutdown) {
                throw new IllegalStateException("SessionManager has been shut down");
            }
            Instant now = clock.instant();
            sweepExpired(now, removed);
            if (registry.size() >= capacity) {
                Session oldest = registry.values().stream().min(LRU_ORDER).orElseThrow();
                registry.remove(oldest.id());
                removed.add(oldest);
                log.info("Evicted session {} ({}) to stay within capacity {}",
                        oldest.id(), oldest.casePath(), capacity);
            }
            id = UUID.randomUUID().toString();
            registry.put(id, new Session(id, model, casePath, now, ++accessCounter));
        } finally {
            registryLock.unlock();
        }
        releaseAll(removed);
        log.info("Created session {} for {}", id, casePath);
        return id;
    }

    /**
     * Resolves a live session and marks it as accessed. An expired session is removed and
     * reported as absent.
     */
    public Optional<Session> get(String sessionId) {
        if (sessionId == null) {
            return Optional.empty();
        }
        Session expired;
        registryLock.lock();
        try {
            Session session = registry.get(sessionId);
            if (session == null) {
                return Optional.empty();
            }
            Instant now = clock.instant();
            if (!session.isExpired(now, ttl)) {
                session.touch(now, ++accessCounter);
                log.debug("Touched session {}", sessionId);
                return Optional.of(session);
            }
            registry.remove(sessionId);
            expired = session;
        } finally {
            registryLock.unlock();
        }
        log.info("Session {} expired after {} idle", sessionId, ttl);
        expired.release();
        return Optional.empty();
    }

    /**
     * Removes a session and releases its model before returning.
     *
     * @return whether the session existed
     */
    public boolean close(String sessionId) {
        if (sessionId == null) {
            return false;
        }
        Session session;
        registryLock.lock();
        try {
            session = registry.remove(sessionId);
        } finally {
            registryLock.unlock();
        }
        if (session == null) {
            return false;
        }
        session.release();
        log.info("Closed session {}", sessionId);
        return true;
    }

    /**
     * Snapshot of the live sessions after an expiry sweep, oldest first.
     */
    public List<SessionSummaryDto> list() {
        List<Session> removed = new ArrayList<>();
        List<SessionSummaryDto> summaries;
        registryLock.lock();
        try {
            sweepExpired(clock.instant(), removed);
            summaries = registry.values().stream()
                    .sorted(Comparator.comparing(Session::createdAt).thenComparing(Session::id))
                    .map(s -> new SessionSummaryDto(s.id(), s.casePath(), s.createdAt(), s.lastAccessedAt()))
                    .toList();
        } finally {
            registryLock.unlock();
        }
        releaseAll(removed);
        return summaries;
    }

    public int size() {
        registryLock.lock();
        try {
            return registry.size();
        } finally {
            registryLock.unlock();
        }
    }

    /**
     * Releases every session and refuses further {@link #create} calls.
     */
    public void shutdown() {
        List<Session> remaining;
        registryLock.lock();
        try {
            shutdown = true;
            remaining = new ArrayList<>(registry.values());
            registry.clear();
        } finally {
            registryLock.unlock();
        }
        releaseAll(remaining);
        log.info("Session manager shut down, released {} sessions", remaining.size());
    }

    private void sweepExpired(Instant now, List<Session> removed) {
        Iterator<Session> it = registry.values().iterator();
        while (it.hasNext()) {
            Session s = it.next();
            if (s.isExpired(now, ttl)) {
                it.remove();
                removed.add(s);
                log.info("Session {} expired after {} idle", s.id(), ttl);
            }
        }
    }

    private static void releaseAll(List<Session> sessions) {
        for (Session s : sessions) {
            s.release();
        }
    }
}
