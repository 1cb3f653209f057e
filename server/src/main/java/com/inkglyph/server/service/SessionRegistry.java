package com.inkglyph.server.service;

import com.inkglyph.server.config.RecognizerSettings;
import com.inkglyph.server.ink.SessionListener;
import com.inkglyph.server.ink.StrokeSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;

/**
 * Live capture sessions by id. Each session has a single writer, the client
 * that owns the id.
 *
 * <p>
 * Clients that go away without deleting their session are handled on the next
 * {@link #create()}: sessions idle longer than the configured timeout are
 * dropped, and when the registry is still full the least recently used one
 * goes.
 */
@Service
public class SessionRegistry {

    private static final Logger logger = LoggerFactory.getLogger(SessionRegistry.class);

    private final ConcurrentMap<String, SessionEntry> sessions = new ConcurrentHashMap<>();
    private final long idleTimeoutMillis;
    private final int maxSessions;

    public static class SessionEntry implements SessionListener {
        private final String id;
        private final StrokeSession session = new StrokeSession();
        private final LatestResultHolder latest = new LatestResultHolder();
        private volatile long currentRevision;
        private volatile long lastAccessMillis;

        SessionEntry(String id, long now) {
            this.id = id;
            this.lastAccessMillis = now;
            session.addListener(this);
        }

        @Override
        public void onSessionChanged(StrokeSession changed, long revision) {
            currentRevision = revision;
        }

        public String getId() {
            return id;
        }

        public StrokeSession getSession() {
            return session;
        }

        public LatestResultHolder getLatest() {
            return latest;
        }

        public long getCurrentRevision() {
            return currentRevision;
        }

        public long getLastAccessMillis() {
            return lastAccessMillis;
        }

        void touch(long now) {
            lastAccessMillis = now;
        }

        /**
         * Whether the held outcome was computed from the session as it is now.
         */
        public boolean isLatestCurrent() {
            RecognitionOutcome outcome = latest.get();
            return outcome != null && outcome.getSessionRevision() == currentRevision;
        }
    }

    public SessionRegistry(RecognizerSettings settings) {
        this.idleTimeoutMillis = TimeUnit.SECONDS.toMillis(settings.sessionIdleTimeoutSeconds);
        this.maxSessions = settings.maxSessions;
    }

    public SessionEntry create() {
        long now = System.currentTimeMillis();
        evictIdle(now);
        while (sessions.size() >= maxSessions) {
            Optional<SessionEntry> oldest = sessions.values().stream()
                    .min(Comparator.comparingLong(SessionEntry::getLastAccessMillis));
            if (oldest.isEmpty()) {
                break;
            }
            sessions.remove(oldest.get().getId(), oldest.get());
            logger.warn("Session limit {} reached, dropped least recently used session {}", maxSessions,
                    oldest.get().getId());
        }

        String id = UUID.randomUUID().toString();
        SessionEntry entry = new SessionEntry(id, now);
        sessions.put(id, entry);
        logger.info("Created session {} ({} live)", id, sessions.size());
        return entry;
    }

    /**
     * Looks up a session and marks it as used.
     */
    public Optional<SessionEntry> find(String id) {
        SessionEntry entry = sessions.get(id);
        if (entry != null) {
            entry.touch(System.currentTimeMillis());
        }
        return Optional.ofNullable(entry);
    }

    public boolean remove(String id) {
        boolean removed = sessions.remove(id) != null;
        if (removed) {
            logger.info("Removed session {} ({} live)", id, sessions.size());
        }
        return removed;
    }

    /**
     * Drops every session not used within the idle timeout before {@code now}.
     *
     * @return number of sessions dropped
     */
    public int evictIdle(long now) {
        int evicted = 0;
        for (SessionEntry entry : sessions.values()) {
            if (now - entry.getLastAccessMillis() > idleTimeoutMillis && sessions.remove(entry.getId(), entry)) {
                evicted++;
            }
        }
        if (evicted > 0) {
            logger.info("Evicted {} idle sessions ({} live)", evicted, sessions.size());
        }
        return evicted;
    }

    public int size() {
        return sessions.size();
    }
}
