package eu.toolchain.epidemic;

/**
 * Wall-clock waiting for tests, the protocol itself has no notion of convergence.
 */
public final class Await {
    private static final long POLL = 10;

    private Await() {
    }

    public interface Condition {
        boolean check() throws Exception;
    }

    public interface Probe {
        long value() throws Exception;
    }

    /**
     * @return {@code true} if the condition held before the deadline.
     */
    public static boolean until(final long timeout, final Condition condition) throws Exception {
        final long deadline = System.currentTimeMillis() + timeout;

        while (System.currentTimeMillis() < deadline) {
            if (condition.check())
                return true;

            Thread.sleep(POLL);
        }

        return condition.check();
    }

    /**
     * Wait until the probed value has not changed for {@code quiet} milliseconds.
     *
     * @return {@code true} if the value settled before the deadline.
     */
    public static boolean settled(final long quiet, final long timeout, final Probe probe) throws Exception {
        final long deadline = System.currentTimeMillis() + timeout;

        long last = probe.value();
        long since = System.currentTimeMillis();

        while (System.currentTimeMillis() < deadline) {
            Thread.sleep(POLL);

            final long current = probe.value();
            final long now = System.currentTimeMillis();

            if (current != last) {
                last = current;
                since = now;
                continue;
            }

            if (now - since >= quiet)
                return true;
        }

        return false;
    }
}
