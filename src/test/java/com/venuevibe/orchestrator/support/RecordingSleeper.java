package com.venuevibe.orchestrator.support;

import com.venuevibe.orchestrator.retry.Sleeper;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Records requested pauses instead of sleeping; optionally advances a {@link MutableClock}.
 */
public class RecordingSleeper implements Sleeper {

    private final List<Duration> sleeps = new ArrayList<>();
    private final MutableClock clock;

    public RecordingSleeper() {
        this(null);
    }

    public RecordingSleeper(MutableClock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized void sleep(Duration duration) {
        sleeps.add(duration);
        if (clock != null) {
            clock.advance(duration);
        }
    }

    public synchronized List<Duration> getSleeps() {
        return List.copyOf(sleeps);
    }
}
