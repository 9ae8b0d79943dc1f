package me.golemcore.meter.domain.model;

/**
 * Thrown when a service id has no registered adapter.
 */
public class UnknownServiceException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String serviceId;

    public UnknownServiceException(String serviceId) {
        super("Unknown service: " + serviceId);
        this.serviceId = serviceId;
    }

    public String getServiceId() {
        return serviceId;
    }
}
