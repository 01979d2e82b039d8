/*
 * Copyright (c) 2017 Sergey Chernov, iCodici S.n.C, All Rights Reserved
 *
 * Written by Sergey Chernov <real.sergeych@gmail.com>, August 2017.
 *
 */

package com.icodici.aead;

import java.io.IOException;

/**
 * Raised when encrypted data can't be processed: truncated containers, broken streams and
 * failed authentication (see {@link AuthenticationFailedException}).
 */
public class EncryptionError extends IOException {
    public EncryptionError(String reason) {
        super(reason);
    }
}
