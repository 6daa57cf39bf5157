package com.libforge.precompiled.core.security;

import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.Signature;
import java.security.interfaces.EdECPrivateKey;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.X509EncodedKeySpec;
import java.util.Arrays;
import java.util.HexFormat;

/**
 * Ed25519 key material in the raw form used by release tooling: a 32-byte public key
 * and a 64-byte private key made of the 32-byte seed followed by the public key.
 */
public final class Ed25519Keys {

    static final String ALGORITHM = "Ed25519";

    static final int KEY_LENGTH = 32;

    // DER prefixes of the X.509 and PKCS#8 encodings; the raw key follows directly.
    private static final byte[] X509_PREFIX = HexFormat.of().parseHex("302a300506032b6570032100");
    private static final byte[] PKCS8_PREFIX = HexFormat.of().parseHex("302e020100300506032b657004220420");

    private final byte[] seed;
    private final byte[] publicKey;

    private Ed25519Keys(byte[] seed, byte[] publicKey) {
        this.seed = seed;
        this.publicKey = publicKey;
    }

    public static Ed25519Keys generate() {
        try {
            KeyPair pair = KeyPairGenerator.getInstance(ALGORITHM).generateKeyPair();
            byte[] seed = ((EdECPrivateKey) pair.getPrivate()).getBytes()
                    .orElseThrow(() -> new IllegalStateException("Provider did not expose the private seed"));
            return new Ed25519Keys(seed, rawPublicKey(pair.getPublic()));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Ed25519 provider unavailable", e);
        }
    }

    /**
     * @param privateKey 64 bytes: seed followed by public key
     */
    public static Ed25519Keys fromPrivateKey(byte[] privateKey) {
        if (privateKey == null || privateKey.length != 2 * KEY_LENGTH) {
            throw new IllegalArgumentException("private key must be 64 bytes");
        }
        return new Ed25519Keys(
                Arrays.copyOfRange(privateKey, 0, KEY_LENGTH),
                Arrays.copyOfRange(privateKey, KEY_LENGTH, 2 * KEY_LENGTH));
    }

    public byte[] publicKey() {
        return publicKey.clone();
    }

    public byte[] privateKey() {
        byte[] out = Arrays.copyOf(seed, 2 * KEY_LENGTH);
        System.arraycopy(publicKey, 0, out, KEY_LENGTH, KEY_LENGTH);
        return out;
    }

    public String publicKeyHex() {
        return HexFormat.of().formatHex(publicKey);
    }

    public String privateKeyHex() {
        return HexFormat.of().formatHex(privateKey());
    }

    public byte[] sign(byte[] message) {
        try {
            PrivateKey key = KeyFactory.getInstance(ALGORITHM)
                    .generatePrivate(new PKCS8EncodedKeySpec(concat(PKCS8_PREFIX, seed)));
            Signature signer = Signature.getInstance(ALGORITHM);
            signer.initSign(key);
            signer.update(message);
            return signer.sign();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to sign with Ed25519", e);
        }
    }

    static PublicKey decodePublicKey(byte[] raw) throws GeneralSecurityException {
        if (raw == null || raw.length != KEY_LENGTH) {
            throw new IllegalArgumentException("public key must be 32 bytes");
        }
        return KeyFactory.getInstance(ALGORITHM).generatePublic(new X509EncodedKeySpec(concat(X509_PREFIX, raw)));
    }

    static byte[] rawPublicKey(PublicKey key) {
        byte[] encoded = key.getEncoded();
        return Arrays.copyOfRange(encoded, encoded.length - KEY_LENGTH, encoded.length);
    }

    private static byte[] concat(byte[] a, byte[] b) {
        byte[] out = Arrays.copyOf(a, a.length + b.length);
        System.arraycopy(b, 0, out, a.length, b.length);
        return out;
    }
}
