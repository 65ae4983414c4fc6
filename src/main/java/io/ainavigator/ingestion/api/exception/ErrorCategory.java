package io.ainavigator.ingestion.api.exception;

/**
 * Why a feed could not be read. Transient categories are worth another attempt.
 */
public enum ErrorCategory {
    TIMEOUT,
    CONNECTION_REFUSED,
    DNS_ERROR,
    NETWORK_ERROR,
    IO_ERROR,
    INVALID_URL,
    NOT_FOUND,
    ACCESS_FORBIDDEN,
    AUTH_REQUIRED,
    SERVER_ERROR,
    SERVER_UNAVAILABLE,
    HTTP_ERROR,
    PARSE_ERROR,
    RATE_LIMITED,
    UNKNOWN;

    public boolean isTransient() {
        return switch (this) {
            case TIMEOUT, CONNECTION_REFUSED, NETWORK_ERROR, IO_ERROR, SERVER_UNAVAILABLE, RATE_LIMITED -> true;
            default -> false;
        };
    }
}
