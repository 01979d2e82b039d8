/*
 * Copyright (c) 2017 Sergey Chernov, iCodici S.n.C, All Rights Reserved
 *
 * Written by Sergey Chernov <real.sergeych@gmail.com>, August 2017.
 *
 */

package com.icodici.aead;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Outcome of {@link AesGcm#open(Nonce, byte[], byte[], byte[])}. Authentication failure is a
 * regular outcome, not an exception: a rejected result never carries any plaintext.
 */
public final class OpenResult {

    private static final OpenResult REJECTED = new OpenResult(null);

    private final byte @Nullable [] plaintext;

    private OpenResult(byte @Nullable [] plaintext) {
        this.plaintext = plaintext;
    }

    static OpenResult authentic(byte[] plaintext) {
        return new OpenResult(plaintext);
    }

    static OpenResult rejected() {
        return REJECTED;
    }

    /**
     * @return true if the tag matched and the plaintext is available
     */
    public boolean isAuthentic() {
        return plaintext != null;
    }

    /**
     * @return decrypted data or null if the ciphertext was rejected
     */
    public byte @Nullable [] getPlaintext() {
        return plaintext == null ? null : plaintext.clone();
    }

    /**
     * @return decrypted data
     *
     * @throws AuthenticationFailedException if the ciphertext was rejected
     */
    public byte[] getPlaintextOrThrow() throws AuthenticationFailedException {
        if (plaintext == null)
            throw new AuthenticationFailedException();
        return plaintext.clone();
    }
}
