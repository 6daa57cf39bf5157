package com.libforge.precompiled.core.storage;

import com.libforge.precompiled.types.FailureKind;
import com.libforge.precompiled.types.ResolutionException;
import com.libforge.precompiled.types.Stage;

import java.net.URI;

/**
 * The release host answered 404. Never retried.
 */
public class RemoteNotFoundException extends ResolutionException {

    private final URI uri;

    public RemoteNotFoundException(Stage stage, URI uri) {
        super(FailureKind.NOT_FOUND, stage, "not found: " + uri);
        this.uri = uri;
    }

    public URI uri() {
        return uri;
    }
}
