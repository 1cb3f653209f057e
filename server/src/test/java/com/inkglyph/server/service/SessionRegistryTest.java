package com.inkglyph.server.service;

import com.inkglyph.server.config.RecognizerConfig;
import com.inkglyph.server.config.RecognizerSettings;
import com.inkglyph.server.ink.Point;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class SessionRegistryTest {

    private static RecognizerSettings settings(long idleTimeoutSeconds, int maxSessions) {
        RecognizerConfig.ConfigRoot root = new RecognizerConfig.ConfigRoot();
        root.sessions = new RecognizerConfig.SessionConfig();
        root.sessions.idleTimeoutSeconds = idleTimeoutSeconds;
        root.sessions.maxSessions = maxSessions;
        return RecognizerSettings.from(root);
    }

    @Test
    public void testCreateFindRemove() {
        SessionRegistry registry = new SessionRegistry(RecognizerSettings.defaults());
        SessionRegistry.SessionEntry entry = registry.create();

        assertEquals(1, registry.size());
        assertSame(entry, registry.find(entry.getId()).orElseThrow());
        assertTrue(registry.remove(entry.getId()));
        assertFalse(registry.remove(entry.getId()));
        assertTrue(registry.find(entry.getId()).isEmpty());
    }

    @Test
    public void testOutcomeGoesStaleWhenInkChanges() {
        SessionRegistry.SessionEntry entry = new SessionRegistry(RecognizerSettings.defaults()).create();
        entry.getSession().beginStroke(new Point(1, 1));
        entry.getSession().extendStroke(new Point(20, 20));
        long revision = entry.getCurrentRevision();
        assertEquals(entry.getSession().snapshot().getRevision(), revision);

        entry.getLatest().offer(RecognitionOutcome.empty(1, revision));
        assertTrue(entry.isLatestCurrent());

        entry.getSession().extendStroke(new Point(30, 30));
        assertFalse(entry.isLatestCurrent());
    }

    @Test
    public void testIdleSessionsAreEvicted() {
        SessionRegistry registry = new SessionRegistry(settings(60, 100));
        SessionRegistry.SessionEntry abandoned = registry.create();
        SessionRegistry.SessionEntry active = registry.create();

        long later = Math.max(abandoned.getLastAccessMillis(), active.getLastAccessMillis()) + 60_000;
        active.touch(later);

        assertEquals(1, registry.evictIdle(later + 1));
        assertTrue(registry.find(abandoned.getId()).isEmpty());
        assertTrue(registry.find(active.getId()).isPresent());
    }

    @Test
    public void testFullRegistryDropsLeastRecentlyUsed() {
        SessionRegistry registry = new SessionRegistry(settings(3600, 2));
        SessionRegistry.SessionEntry first = registry.create();
        SessionRegistry.SessionEntry second = registry.create();
        first.touch(second.getLastAccessMillis() + 1000);

        SessionRegistry.SessionEntry third = registry.create();

        assertEquals(2, registry.size());
        assertTrue(registry.find(second.getId()).isEmpty());
        assertTrue(registry.find(first.getId()).isPresent());
        assertTrue(registry.find(third.getId()).isPresent());
    }
}
