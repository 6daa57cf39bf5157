package com.libforge.precompiled.core.security;

import com.libforge.precompiled.core.storage.CacheLayout;
import com.libforge.precompiled.core.storage.CacheStore;
import com.libforge.precompiled.types.FailureKind;
import com.libforge.precompiled.types.Reporter;
import com.libforge.precompiled.types.Stage;

import java.net.URI;
import java.nio.file.Path;

/**
 * Fetch, verify, evict: the discipline shared by manifests and artifacts.
 *
 * <p>Payload and detached signature are fetched through the cache, then verified.
 * On failure both files are deleted, cached or freshly downloaded alike, so no later
 * run can pass against bytes that were never revalidated.
 */
public class VerifiedFetcher {

    private final CacheStore cache;
    private final SignatureVerifier verifier;

    public VerifiedFetcher(CacheStore cache, SignatureVerifier verifier) {
        this.cache = cache;
        this.verifier = verifier;
    }

    /**
     * @param signatureKind kind raised when verification fails
     * @return the verified payload bytes, also present at {@code localPath}
     */
    public byte[] fetchVerified(Path localPath, URI uri, FailureKind signatureKind, Stage stage, Reporter reporter) {
        Path signaturePath = CacheLayout.signatureOf(localPath);
        URI signatureUri = URI.create(uri + CacheLayout.SIGNATURE_SUFFIX);

        byte[] payload = cache.getOrFetch(localPath, uri, stage, reporter);
        byte[] signature = cache.getOrFetch(signaturePath, signatureUri, stage, reporter);

        String fileName = localPath.getFileName().toString();
        if (!verifier.verify(payload, signature)) {
            reporter.warn("Signature verification failed for " + fileName + ", evicting cached copy", null);
            cache.evict(stage, localPath, signaturePath);
            throw new SignatureInvalidException(signatureKind, stage, fileName);
        }
        reporter.debugf("Verified signature of %s", fileName);
        return payload;
    }
}
