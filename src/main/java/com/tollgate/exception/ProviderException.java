package com.tollgate.exception;

import lombok.Getter;

/**
 * Upstream text-generation failure, including missing credentials.
 */
@Getter
public class ProviderException extends RuntimeException {

    private final String provider;

    public ProviderException(String provider, String message) {
        super(message);
        this.provider = provider;
    }

    public ProviderException(String provider, String message, Throwable cause) {
        super(message, cause);
        this.provider = provider;
    }
}
