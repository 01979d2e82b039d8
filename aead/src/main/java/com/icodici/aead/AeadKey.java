/*
 * Copyright (c) 2017 Sergey Chernov, iCodici S.n.C, All Rights Reserved
 *
 * Written by Sergey Chernov <real.sergeych@gmail.com>, August 2017.
 *
 */

package com.icodici.aead;

import org.spongycastle.util.Arrays;

import javax.security.auth.Destroyable;
import java.security.SecureRandom;

/**
 * 256-bit symmetric key for {@link AesGcm}. The key bytes are copied in and out, so callers may
 * wipe their own arrays. {@link #toString()} never reveals the key.
 */
public final class AeadKey implements Destroyable {

    public static final int SIZE = AES256.KEY_SIZE;

    private static final SecureRandom rng = new SecureRandom();

    private final byte[] key;
    private volatile boolean destroyed = false;

    /**
     * @param key exactly 32 bytes
     *
     * @throws InvalidKeySizeException if the key is not 32 bytes long
     */
    public AeadKey(byte[] key) {
        if (key.length != SIZE)
            throw new InvalidKeySizeException(SIZE, key.length);
        this.key = key.clone();
    }

    /**
     * Create random key using {@link SecureRandom}.
     */
    public static AeadKey random() {
        byte[] bytes = new byte[SIZE];
        rng.nextBytes(bytes);
        try {
            return new AeadKey(bytes);
        } finally {
            java.util.Arrays.fill(bytes, (byte) 0);
        }
    }

    /**
     * @return copy of the key bytes
     */
    public byte[] getKey() {
        if (destroyed)
            throw new IllegalStateException("key has been destroyed");
        return key.clone();
    }

    public int getBitStrength() {
        return SIZE * 8;
    }

    @Override
    public void destroy() {
        destroyed = true;
        java.util.Arrays.fill(key, (byte) 0);
    }

    @Override
    public boolean isDestroyed() {
        return destroyed;
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof AeadKey))
            return false;
        return Arrays.constantTimeAreEqual(key, ((AeadKey) obj).key);
    }

    @Override
    public int hashCode() {
        // independent of key material, stable across destroy()
        return AeadKey.class.hashCode();
    }

    @Override
    public String toString() {
        return "AeadKey(" + getBitStrength() + " bits)";
    }
}
