package com.libforge.precompiled.formats;

import com.libforge.precompiled.types.FailureKind;
import com.libforge.precompiled.types.ResolutionException;
import com.libforge.precompiled.types.Stage;

/**
 * Thrown when an archive holds no file with the expected library extension.
 */
public class LibraryNotFoundInArchiveException extends ResolutionException {

    private final String expectedExtension;

    public LibraryNotFoundInArchiveException(String archiveName, String expectedExtension) {
        super(FailureKind.LIBRARY_NOT_FOUND_IN_ARCHIVE, Stage.EXTRACT,
                "No library with extension \"" + expectedExtension + "\" found in " + archiveName);
        this.expectedExtension = expectedExtension;
    }

    public String expectedExtension() {
        return expectedExtension;
    }
}
