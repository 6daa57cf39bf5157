package com.libforge.precompiled.formats;

import com.libforge.precompiled.types.FailureKind;
import com.libforge.precompiled.types.ResolutionException;
import com.libforge.precompiled.types.Stage;

/**
 * Wraps I/O failures while decoding an archive or writing the extracted library.
 */
public class ArchiveException extends ResolutionException {

    public ArchiveException(String message, Throwable cause) {
        super(FailureKind.ARCHIVE_CORRUPT, Stage.EXTRACT, message, cause);
    }
}
