/*
 * Copyright (c) 2017 Sergey Chernov, iCodici S.n.C, All Rights Reserved
 *
 * Written by Sergey Chernov <real.sergeych@gmail.com>, August 2017.
 *
 */

package com.icodici.aead;

public class InvalidBlockSizeException extends InvalidSizeException {
    public InvalidBlockSizeException(int expectedSize, int actualSize) {
        super("block", expectedSize, actualSize);
    }
}
