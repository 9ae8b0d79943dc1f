package me.golemcore.meter.domain.model;

/**
 * Raised by usage adapters when a provider cannot be queried. The message is
 * shown to clients verbatim as the snapshot error.
 */
public class UsageFetchException extends Exception {

    private static final long serialVersionUID = 1L;

    private final UsageErrorKind kind;

    public UsageFetchException(UsageErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public UsageFetchException(UsageErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public UsageErrorKind getKind() {
        return kind;
    }
}
