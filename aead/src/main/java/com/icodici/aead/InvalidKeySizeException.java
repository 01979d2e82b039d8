/*
 * Copyright (c) 2017 Sergey Chernov, iCodici S.n.C, All Rights Reserved
 *
 * Written by Sergey Chernov <real.sergeych@gmail.com>, August 2017.
 *
 */

package com.icodici.aead;

public class InvalidKeySizeException extends InvalidSizeException {
    public InvalidKeySizeException(int expectedSize, int actualSize) {
        super("key", expectedSize, actualSize);
    }
}
