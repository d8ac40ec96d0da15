package com.codemend.core.cancel;

/**
 * Time source and cancellable sleeper for polling and retry loops.
 */
public interface PollClock {

    long nowMillis();

    /**
     * Waits up to {@code millis}.
     *
     * @return false if the wait ended because of cancellation
     */
    boolean sleep(long millis, CancellationToken token);

    PollClock SYSTEM = new PollClock() {
        @Override
        public long nowMillis() {
            return System.currentTimeMillis();
        }

        @Override
        public boolean sleep(long millis, CancellationToken token) {
            return token.sleep(millis);
        }
    };
}
