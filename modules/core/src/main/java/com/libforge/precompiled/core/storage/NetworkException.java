package com.libforge.precompiled.core.storage;

import com.libforge.precompiled.types.FailureKind;
import com.libforge.precompiled.types.ResolutionException;
import com.libforge.precompiled.types.Stage;

import java.net.URI;

/**
 * A download failed for good: a non-retryable status or retries exhausted.
 */
public class NetworkException extends ResolutionException {

    private final URI uri;

    public NetworkException(Stage stage, URI uri, String detail, Throwable cause) {
        super(FailureKind.NETWORK_ERROR, stage, detail, cause);
        this.uri = uri;
    }

    public URI uri() {
        return uri;
    }
}
