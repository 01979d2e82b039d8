/*
 * Copyright (c) 2017 Sergey Chernov, iCodici S.n.C, All Rights Reserved
 *
 * Written by Sergey Chernov <real.sergeych@gmail.com>, August 2017.
 *
 */

package com.icodici.aead;

/**
 * The authentication tag does not match the ciphertext, the associated data or the nonce. No
 * plaintext is ever released together with this exception.
 */
public class AuthenticationFailedException extends EncryptionError {
    public AuthenticationFailedException() {
        super("authentication failed, data corrupted");
    }
}
