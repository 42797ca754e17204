package io.cortex.core.error;

/**
 * Machine-readable error codes returned by every store operation. Callers switch on these rather than on messages.
 */
public enum ErrorCode {
    INVALID_PATH(ErrorKind.INPUT),
    INVALID_SLUG(ErrorKind.INPUT),
    INVALID_INPUT(ErrorKind.INPUT),
    DESCRIPTION_TOO_LONG(ErrorKind.INPUT),

    MEMORY_NOT_FOUND(ErrorKind.DOMAIN_STATE),
    MEMORY_EXPIRED(ErrorKind.DOMAIN_STATE),
    DESTINATION_EXISTS(ErrorKind.DOMAIN_STATE),
    CATEGORY_NOT_FOUND(ErrorKind.DOMAIN_STATE),

    STORAGE_ERROR(ErrorKind.INFRASTRUCTURE),
    READ_FAILED(ErrorKind.INFRASTRUCTURE),
    WRITE_FAILED(ErrorKind.INFRASTRUCTURE),
    INDEX_UPDATE_FAILED(ErrorKind.INFRASTRUCTURE),

    MISSING_FRONTMATTER(ErrorKind.CORRUPTION),
    INVALID_FRONTMATTER(ErrorKind.CORRUPTION),
    MISSING_FIELD(ErrorKind.CORRUPTION),
    INVALID_TIMESTAMP(ErrorKind.CORRUPTION),
    INVALID_TAGS(ErrorKind.CORRUPTION),
    INVALID_SOURCE(ErrorKind.CORRUPTION),
    INVALID_CITATIONS(ErrorKind.CORRUPTION),
    INVALID_INDEX(ErrorKind.CORRUPTION);

    private final ErrorKind kind;

    ErrorCode(ErrorKind kind) {
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }
}
