package com.libforge.precompiled.formats.api;

import java.io.IOException;
import java.io.InputStream;

/**
 * Transport-level transformation applied around an archive, e.g. gzip around tar.
 */
public interface Codec {
    /**
     * Wraps the encoded stream so reads return decoded bytes.
     */
    InputStream decode(InputStream input) throws IOException;
}
