/*
 * Copyright (c) 2017 Sergey Chernov, iCodici S.n.C, All Rights Reserved
 *
 * Written by Sergey Chernov <real.sergeych@gmail.com>, August 2017.
 *
 */

package com.icodici.aead;

/**
 * Some fixed-size value (key, nonce, tag or cipher block) has the wrong length. This is always a
 * programming error on the caller side and is never worth retrying.
 */
public abstract class InvalidSizeException extends IllegalArgumentException {

    private final int expectedSize;
    private final int actualSize;

    protected InvalidSizeException(String what, int expectedSize, int actualSize) {
        super(what + " must be " + expectedSize + " bytes, got " + actualSize);
        this.expectedSize = expectedSize;
        this.actualSize = actualSize;
    }

    public int getExpectedSize() {
        return expectedSize;
    }

    public int getActualSize() {
        return actualSize;
    }
}
