package com.codemend.core.cancel;

import java.util.ArrayList;
import java.util.List;

/**
 * PollClock whose time only moves when something sleeps on it.
 */
public class ManualPollClock implements PollClock {

    private long now;
    private final List<Long> sleeps = new ArrayList<>();
    private Runnable onSleep = () -> { };

    @Override
    public long nowMillis() {
        return now;
    }

    @Override
    public boolean sleep(long millis, CancellationToken token) {
        onSleep.run();
        if (token.isCancellationRequested()) {
            return false;
        }
        sleeps.add(millis);
        now += millis;
        return true;
    }

    public void onSleep(Runnable action) {
        this.onSleep = action;
    }

    public List<Long> getSleeps() {
        return sleeps;
    }
}
