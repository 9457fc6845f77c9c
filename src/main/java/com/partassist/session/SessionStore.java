package com.partassist.session;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-wide session map. Each session owns a fair lock so that work for one session runs in
 * arrival order while unrelated sessions proceed in parallel.
 */
public class SessionStore {
    private static final Logger log = LoggerFactory.getLogger(SessionStore.class);

    private final ConcurrentMap<String, Entry> sessions = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration idleTimeout;

    public SessionStore() {
        this(Clock.systemUTC(), Duration.ofMinutes(30));
    }

    public SessionStore(Clock clock, Duration idleTimeout) {
        this.clock = clock;
        this.idleTimeout = idleTimeout == null ? Duration.ZERO : idleTimeout;
    }

    public SessionState getOrCreate(String sessionId) {
        return withSession(sessionId, Session::snapshot);
    }

    public void append(String sessionId, Turn turn) {
        withSession(sessionId, session -> {
            session.append(turn);
            return null;
        });
    }

    public void reset(String sessionId) {
        withSession(sessionId, session -> {
            session.reset();
            return null;
        });
        log.debug("Session reset sessionId={}", sessionId);
    }

    /**
     * Runs {@code work} while holding the session's lock. Calls for the same id are serialized in
     * arrival order; the session is created when unknown.
     */
    public <T> T withSession(String sessionId, Function<Session, T> work) {
        requireId(sessionId);
        while (true) {
            Entry entry = sessions.computeIfAbsent(sessionId, id -> new Entry(id, clock.instant()));
            entry.lock.lock();
            try {
                if (entry.evicted) {
                    continue;
                }
                try {
                    return work.apply(entry.session);
                } finally {
                    entry.session.touch(clock.instant());
                }
            } finally {
                entry.lock.unlock();
            }
        }
    }

    /**
     * Drops sessions idle for longer than the configured window. Sessions with a turn in flight
     * or queued are kept.
     */
    public int evictIdle() {
        if (idleTimeout.isZero() || idleTimeout.isNegative()) {
            return 0;
        }
        Instant cutoff = clock.instant().minus(idleTimeout);
        int evicted = 0;
        for (Entry entry : sessions.values()) {
            if (entry.lock.hasQueuedThreads() || !entry.lock.tryLock()) {
                continue;
            }
            try {
                if (!entry.evicted && entry.session.lastActiveAt.isBefore(cutoff)) {
                    entry.evicted = true;
                    sessions.remove(entry.session.sessionId, entry);
                    evicted++;
                }
            } finally {
                entry.lock.unlock();
            }
        }
        if (evicted > 0) {
            log.info("Evicted idle sessions count={} remaining={}", evicted, sessions.size());
        }
        return evicted;
    }

    public int size() {
        return sessions.size();
    }

    /**
     * Number of callers currently waiting for this session's lock.
     */
    public int queuedTurns(String sessionId) {
        Entry entry = sessions.get(sessionId);
        return entry == null ? 0 : entry.lock.getQueueLength();
    }

    private static void requireId(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("Session id must not be blank");
        }
    }

    private static final class Entry {
        private final ReentrantLock lock = new ReentrantLock(true);
        private final Session session;
        private boolean evicted;

        private Entry(String sessionId, Instant now) {
            this.session = new Session(sessionId, now);
        }
    }

    /**
     * Live session handle, only valid inside {@link #withSession}.
     */
    public static final class Session {
        private final String sessionId;
        private final List<Turn> history = new ArrayList<>();
        private final Instant createdAt;
        private Instant lastActiveAt;
        private String lastTopic;

        private Session(String sessionId, Instant createdAt) {
            this.sessionId = sessionId;
            this.createdAt = createdAt;
            this.lastActiveAt = createdAt;
        }

        public String sessionId() {
            return sessionId;
        }

        public void append(Turn turn) {
            if (turn == null) {
                throw new IllegalArgumentException("Turn must not be null");
            }
            history.add(turn);
        }

        public void reset() {
            history.clear();
            lastTopic = null;
        }

        public void lastTopic(String topic) {
            this.lastTopic = topic;
        }

        public SessionState snapshot() {
            return new SessionState(sessionId, history, lastTopic, createdAt, lastActiveAt);
        }

        private void touch(Instant now) {
            lastActiveAt = now;
        }
    }
}
