package com.raditha.sentinel.model;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Hands out {@link Variable.Temporary} values with ids unique within this arena.
 * One arena backs a whole {@link AnalysisModel}, so ids never collide across functions.
 */
public final class TemporaryArena {

    private final AtomicLong next = new AtomicLong();

    public Variable.Temporary allocate(String type) {
        return new Variable.Temporary(next.getAndIncrement(), type);
    }

    /**
     * Number of temporaries allocated so far.
     */
    public long size() {
        return next.get();
    }
}
