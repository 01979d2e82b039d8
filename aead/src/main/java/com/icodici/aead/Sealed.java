/*
 * Copyright (c) 2017 Sergey Chernov, iCodici S.n.C, All Rights Reserved
 *
 * Written by Sergey Chernov <real.sergeych@gmail.com>, August 2017.
 *
 */

package com.icodici.aead;

/**
 * Result of {@link AesGcm#seal(Nonce, byte[], byte[])}: the ciphertext, same length as the
 * plaintext, and the 16-byte tag. The nonce is not included; the caller transports it alongside.
 */
public final class Sealed {

    private final byte[] ciphertext;
    private final byte[] tag;

    Sealed(byte[] ciphertext, byte[] tag) {
        this.ciphertext = ciphertext;
        this.tag = tag;
    }

    public byte[] getCiphertext() {
        return ciphertext.clone();
    }

    public byte[] getTag() {
        return tag.clone();
    }

    /**
     * @return ciphertext followed by the tag
     */
    public byte[] pack() {
        byte[] result = new byte[ciphertext.length + tag.length];
        System.arraycopy(ciphertext, 0, result, 0, ciphertext.length);
        System.arraycopy(tag, 0, result, ciphertext.length, tag.length);
        return result;
    }
}
