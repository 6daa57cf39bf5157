package com.libforge.precompiled.core.storage;

import java.io.IOException;
import java.net.URI;

/**
 * The only place network GETs happen. Implementations return every HTTP status as a
 * response; status interpretation and retry belong to {@link CacheStore}.
 */
public interface HttpTransport {

    Response get(URI uri) throws IOException;

    record Response(int status, byte[] body) {

        public boolean isSuccess() {
            return status >= 200 && status < 300;
        }
    }
}
