package me.golemcore.meter.domain.model;

/**
 * Classification of adapter fetch failures.
 */
public enum UsageErrorKind {
    CREDENTIAL_MISSING,
    AUTH,
    NETWORK,
    PARSE
}
