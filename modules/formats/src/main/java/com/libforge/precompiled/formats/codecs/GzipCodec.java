package com.libforge.precompiled.formats.codecs;

import com.libforge.precompiled.formats.api.Codec;

import java.io.IOException;
import java.io.InputStream;
import java.util.zip.GZIPInputStream;

/**
 * Codec for GZIP compression (.gz, .tgz files).
 */
public class GzipCodec implements Codec {

    @Override
    public InputStream decode(InputStream input) throws IOException {
        return new GZIPInputStream(input, 64 * 1024);
    }
}
