package io.cortex.core.error;

public enum ErrorKind {
    INPUT,
    DOMAIN_STATE,
    INFRASTRUCTURE,
    CORRUPTION
}
