package dev.badgersnacks.buildsync.model;

import java.util.Objects;

/**
 * Result of a single remote lookup. Fetchers always return one of these instead of throwing.
 */
public interface FetchOutcome {

    static FetchOutcome found(String buildCode) {
        return new Found(buildCode);
    }

    static FetchOutcome notAvailable() {
        return NotAvailable.INSTANCE;
    }

    static FetchOutcome transportError(String reason) {
        return new TransportError(reason);
    }

    record Found(String buildCode) implements FetchOutcome {
        public Found {
            Objects.requireNonNull(buildCode, "buildCode");
            if (buildCode.isBlank()) {
                throw new IllegalArgumentException("Build code must not be blank");
            }
        }
    }

    record NotAvailable() implements FetchOutcome {
        private static final NotAvailable INSTANCE = new NotAvailable();
    }

    record TransportError(String reason) implements FetchOutcome {
        public TransportError {
            reason = reason == null || reason.isBlank() ? "unknown transport failure" : reason;
        }
    }
}
