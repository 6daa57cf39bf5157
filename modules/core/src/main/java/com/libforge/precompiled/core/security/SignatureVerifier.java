package com.libforge.precompiled.core.security;

import com.libforge.precompiled.core.config.ConfigInvalidException;

import java.security.GeneralSecurityException;
import java.security.InvalidKeyException;
import java.security.PublicKey;
import java.security.Signature;
import java.security.SignatureException;
import java.security.spec.InvalidKeySpecException;

/**
 * Verifies detached Ed25519 signatures against one 32-byte public key.
 *
 * <p>Pure and stateless apart from the decoded key; safe to share between threads.
 */
public class SignatureVerifier {

    public static final int SIGNATURE_LENGTH = 64;

    private final PublicKey publicKey;

    /**
     * @throws ConfigInvalidException if the key is not a point on the curve
     */
    public SignatureVerifier(byte[] rawPublicKey) {
        this.publicKey = decodeChecked(rawPublicKey);
    }

    /**
     * Rejects keys the provider would only refuse at verification time. Key decoding
     * is lazy; {@code initVerify} is where the curve point gets checked.
     *
     * @throws ConfigInvalidException if the key is not a usable Ed25519 public key
     */
    public static void checkPublicKey(byte[] rawPublicKey) {
        decodeChecked(rawPublicKey);
    }

    private static PublicKey decodeChecked(byte[] rawPublicKey) {
        try {
            PublicKey key = Ed25519Keys.decodePublicKey(rawPublicKey);
            Signature.getInstance(Ed25519Keys.ALGORITHM).initVerify(key);
            return key;
        } catch (InvalidKeyException | InvalidKeySpecException | IllegalArgumentException e) {
            throw new ConfigInvalidException("public_key is not a valid Ed25519 key", e);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Ed25519 provider unavailable", e);
        }
    }

    /**
     * Returns true only if {@code signature} is a valid signature of exactly
     * {@code message}. Malformed signatures verify as false.
     */
    public boolean verify(byte[] message, byte[] signature) {
        if (signature == null || signature.length != SIGNATURE_LENGTH) {
            return false;
        }
        try {
            Signature verifier = Signature.getInstance(Ed25519Keys.ALGORITHM);
            verifier.initVerify(publicKey);
            verifier.update(message);
            return verifier.verify(signature);
        } catch (SignatureException e) {
            return false;
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Ed25519 provider unavailable", e);
        }
    }
}
