package com.libforge.precompiled.formats;

import com.libforge.precompiled.types.FailureKind;
import com.libforge.precompiled.types.ResolutionException;
import com.libforge.precompiled.types.Stage;

/**
 * Thrown when no handler recognizes the archive's file-name suffix.
 */
public class UnsupportedArchiveException extends ResolutionException {

    private final String fileName;

    public UnsupportedArchiveException(String fileName) {
        super(FailureKind.UNSUPPORTED_ARCHIVE, Stage.EXTRACT, "Unsupported archive type: " + fileName);
        this.fileName = fileName;
    }

    public String fileName() {
        return fileName;
    }
}
