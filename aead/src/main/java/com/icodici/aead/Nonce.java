/*
 * Copyright (c) 2017 Sergey Chernov, iCodici S.n.C, All Rights Reserved
 *
 * Written by Sergey Chernov <real.sergeych@gmail.com>, August 2017.
 *
 */

package com.icodici.aead;

import org.spongycastle.util.encoders.Hex;

import java.security.SecureRandom;
import java.util.Arrays;

/**
 * 96-bit GCM nonce (IV). It needs not be secret but must never be used twice with the same key:
 * a repeated nonce exposes the XOR of the two plaintexts and lets an attacker forge tags.
 */
public final class Nonce {

    public static final int SIZE = 12;

    private static final SecureRandom rng = new SecureRandom();

    private final byte[] bytes;

    /**
     * @param bytes exactly 12 bytes
     *
     * @throws InvalidNonceSizeException on any other length
     */
    public Nonce(byte[] bytes) {
        if (bytes.length != SIZE)
            throw new InvalidNonceSizeException(SIZE, bytes.length);
        this.bytes = bytes.clone();
    }

    /**
     * Random nonce from {@link SecureRandom}. With random nonces, do not encrypt more than 2^32
     * messages under one key.
     */
    public static Nonce random() {
        byte[] bytes = new byte[SIZE];
        rng.nextBytes(bytes);
        return new Nonce(bytes);
    }

    public byte[] getBytes() {
        return bytes.clone();
    }

    void copyTo(byte[] destination, int offset) {
        System.arraycopy(bytes, 0, destination, offset, SIZE);
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof Nonce))
            return false;
        return Arrays.equals(bytes, ((Nonce) obj).bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return "Nonce(" + Hex.toHexString(bytes) + ")";
    }
}
