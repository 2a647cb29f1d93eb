package dev.guardrails.domain.valueobject;

/**
 * What a scan produced: a backend result, or a degraded stand-in carrying the cause.
 * Every scan request yields exactly one outcome; the scan client never throws instead.
 *
 * <p>A completed result that carries the backend's own error marker is degraded too:
 * it publishes an error status and ends the event in {@code degraded-published}.
 */
public sealed interface ScanOutcome permits ScanOutcome.Completed, ScanOutcome.Degraded {

    ScanResult result();

    boolean isDegraded();

    /** Why the scan is degraded, or {@code null} when it is not. */
    String cause();

    static ScanOutcome completed(ScanResult result) {
        return new Completed(result);
    }

    static ScanOutcome degraded(String repository, String cause, int attempts, double elapsedMs) {
        return new Degraded(ScanResult.degraded(repository, cause, elapsedMs), cause, attempts);
    }

    record Completed(ScanResult result) implements ScanOutcome {
        public Completed {
            if (result == null) throw new IllegalArgumentException("result required");
        }

        @Override
        public boolean isDegraded() { return result.isError(); }

        @Override
        public String cause() { return result.error(); }
    }

    record Degraded(ScanResult result, String cause, int attempts) implements ScanOutcome {
        public Degraded {
            if (result == null || !result.isError())
                throw new IllegalArgumentException("degraded outcome requires an error result");
        }

        @Override
        public boolean isDegraded() { return true; }
    }
}
