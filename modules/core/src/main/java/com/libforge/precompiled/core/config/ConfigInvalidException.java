package com.libforge.precompiled.core.config;

import com.libforge.precompiled.types.FailureKind;
import com.libforge.precompiled.types.ResolutionException;
import com.libforge.precompiled.types.Stage;

/**
 * Malformed {@code precompiled_binaries} settings. Always fatal, never defaulted.
 */
public class ConfigInvalidException extends ResolutionException {

    public ConfigInvalidException(String message) {
        super(FailureKind.CONFIG_INVALID, Stage.CONFIG, message);
    }

    public ConfigInvalidException(String message, Throwable cause) {
        super(FailureKind.CONFIG_INVALID, Stage.CONFIG, message, cause);
    }
}
