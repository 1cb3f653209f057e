package com.inkglyph.server.ink;

public interface SessionListener {

    // Invoked after every mutation that changed the session, on the writer's
    // thread. Call session.snapshot() only if the contents are needed.
    void onSessionChanged(StrokeSession session, long revision);
}
