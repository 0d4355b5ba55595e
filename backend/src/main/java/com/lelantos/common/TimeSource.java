package com.lelantos.common;

/**
 * Wall clock plus sleep. Everything that paces or backs off goes through this so tests can run on virtual time.
 */
public interface TimeSource {

    long nowMillis();

    void sleep(long millis) throws InterruptedException;

    static TimeSource system() {
        return SystemTimeSource.INSTANCE;
    }

    final class SystemTimeSource implements TimeSource {

        private static final SystemTimeSource INSTANCE = new SystemTimeSource();

        private SystemTimeSource() {
        }

        @Override
        public long nowMillis() {
            return System.currentTimeMillis();
        }

        @Override
        public void sleep(long millis) throws InterruptedException {
            if (millis > 0) {
                Thread.sleep(millis);
            }
        }
    }
}
