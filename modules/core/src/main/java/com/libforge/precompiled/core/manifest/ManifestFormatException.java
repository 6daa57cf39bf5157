package com.libforge.precompiled.core.manifest;

import com.libforge.precompiled.types.FailureKind;
import com.libforge.precompiled.types.ResolutionException;
import com.libforge.precompiled.types.Stage;

/**
 * A verified manifest does not have the expected shape.
 */
public class ManifestFormatException extends ResolutionException {

    public ManifestFormatException(String detail) {
        super(FailureKind.MANIFEST_MALFORMED, Stage.MANIFEST, detail);
    }

    public ManifestFormatException(String detail, Throwable cause) {
        super(FailureKind.MANIFEST_MALFORMED, Stage.MANIFEST, detail, cause);
    }
}
