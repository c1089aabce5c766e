package util;

import org.slf4j.Logger;

/** Lap timer; each {@link #stop} logs the time since the previous lap. */
public class Timing {
    private final Logger logger;
    private long t0 = System.nanoTime();

    public Timing(Logger logger) {
        this.logger = logger;
    }

    /** Logs and returns the lap in milliseconds. */
    public double stop(String label) {
        long dt = System.nanoTime() - t0;
        double ms = dt / 1_000_000.0;
        if (logger.isDebugEnabled())
            logger.debug("{}: {} ms", label, String.format("%.2f", ms));
        t0 = System.nanoTime();
        return ms;
    }
}
