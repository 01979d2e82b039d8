/*
 * Copyright (c) 2017 Sergey Chernov, iCodici S.n.C, All Rights Reserved
 *
 * Written by Sergey Chernov <real.sergeych@gmail.com>, August 2017.
 *
 */

package com.icodici.aead;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.Set;

/**
 * Nonces already used for sealing under one key. Bounded: when full, no more nonces are accepted
 * and the key must be rotated.
 */
class NonceRegistry {

    private static final Logger log = LoggerFactory.getLogger(NonceRegistry.class);

    private final int capacity;
    private final Set<Nonce> used = new HashSet<>();

    NonceRegistry(int capacity) {
        if (capacity <= 0)
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        this.capacity = capacity;
    }

    /**
     * Record the nonce.
     *
     * @throws NonceReuseException if the nonce was registered before or the registry is full
     */
    synchronized void register(Nonce nonce) {
        if (used.contains(nonce)) {
            log.warn("refusing to seal with a nonce already used under this key");
            throw new NonceReuseException("nonce already used with this key");
        }
        if (used.size() >= capacity) {
            log.warn("nonce registry is full ({} nonces), key rotation required", capacity);
            throw new NonceReuseException("too many nonces tracked for this key, rotate the key");
        }
        used.add(nonce);
    }

    synchronized int size() {
        return used.size();
    }

    int getCapacity() {
        return capacity;
    }

    synchronized void clear() {
        used.clear();
    }
}
