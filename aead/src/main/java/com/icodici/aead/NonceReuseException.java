/*
 * Copyright (c) 2017 Sergey Chernov, iCodici S.n.C, All Rights Reserved
 *
 * Written by Sergey Chernov <real.sergeych@gmail.com>, August 2017.
 *
 */

package com.icodici.aead;

/**
 * Thrown by {@link AesGcm} in {@link NoncePolicy#TRACK} mode when a nonce is about to be used for
 * the second time with the same key, or when no more nonces can be tracked.
 */
public class NonceReuseException extends IllegalStateException {
    public NonceReuseException(String message) {
        super(message);
    }
}
