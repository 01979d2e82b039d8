/*
 * Copyright (c) 2017 Sergey Chernov, iCodici S.n.C, All Rights Reserved
 *
 * Written by Sergey Chernov <real.sergeych@gmail.com>, August 2017.
 *
 */

package com.icodici.aead;

public class InvalidNonceSizeException extends InvalidSizeException {
    public InvalidNonceSizeException(int expectedSize, int actualSize) {
        super("nonce", expectedSize, actualSize);
    }
}
