/*
 * Copyright (c) 2017 Sergey Chernov, iCodici S.n.C, All Rights Reserved
 *
 * Written by Sergey Chernov <real.sergeych@gmail.com>, August 2017.
 *
 */

package com.icodici.aead;

/**
 * What {@link AesGcm} does to prevent nonce reuse under one key.
 */
public enum NoncePolicy {
    /**
     * Nothing: uniqueness is the caller's obligation. Fastest, and the only option when the same
     * key lives in several processes.
     */
    CALLER,
    /**
     * Remember every nonce passed to seal and refuse repeats, up to a configured number of
     * nonces per instance.
     */
    TRACK;

    public static NoncePolicy fromName(String name) {
        for (NoncePolicy p : values())
            if (p.name().equalsIgnoreCase(name))
                return p;
        throw new IllegalArgumentException("unknown nonce policy: " + name);
    }
}
