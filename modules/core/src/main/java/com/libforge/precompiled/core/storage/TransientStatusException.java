package com.libforge.precompiled.core.storage;

import java.io.IOException;

/**
 * Retryable HTTP status (408, 429, 5xx). Only raised between attempts; callers of
 * {@link CacheStore} see a {@link NetworkException} once retries run out.
 */
class TransientStatusException extends IOException {

    private final int status;

    TransientStatusException(int status) {
        super("HTTP " + status);
        this.status = status;
    }

    int status() {
        return status;
    }

    static boolean isTransient(int status) {
        return status == 408 || status == 429 || status >= 500;
    }
}
