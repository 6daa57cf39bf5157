package com.libforge.precompiled.core.security;

import com.libforge.precompiled.types.FailureKind;
import com.libforge.precompiled.types.ResolutionException;
import com.libforge.precompiled.types.Stage;

/**
 * A detached signature did not verify against the configured public key. The cached
 * payload and signature have already been evicted when this is thrown.
 */
public class SignatureInvalidException extends ResolutionException {

    private final String fileName;

    public SignatureInvalidException(FailureKind kind, Stage stage, String fileName) {
        super(kind, stage, "signature verification failed for " + fileName);
        this.fileName = fileName;
    }

    public String fileName() {
        return fileName;
    }
}
