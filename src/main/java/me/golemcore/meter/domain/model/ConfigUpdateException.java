package me.golemcore.meter.domain.model;

/**
 * Rejected configuration update. The stored configuration is left untouched.
 */
public class ConfigUpdateException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public enum Reason {
        MALFORMED,
        PAYLOAD_TOO_LARGE,
        INVALID_VALUE
    }

    private final Reason reason;

    public ConfigUpdateException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public ConfigUpdateException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
