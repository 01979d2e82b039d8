/*
 * Copyright (c) 2017 Sergey Chernov, iCodici S.n.C, All Rights Reserved
 *
 * Written by Sergey Chernov <real.sergeych@gmail.com>, August 2017.
 *
 */

package com.icodici.aead;

import org.junit.Test;

import java.util.HashSet;
import java.util.Set;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.equalTo;
import static org.hamcrest.CoreMatchers.not;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class AeadKeyTest {

    @Test
    public void keyIsCopied() {
        byte[] bytes = CTRTransformer.randomBytes(32);
        AeadKey key = new AeadKey(bytes);
        byte[] original = bytes.clone();
        bytes[0] ^= 1;
        assertArrayEquals(original, key.getKey());
        key.getKey()[1] ^= 1;
        assertArrayEquals(original, key.getKey());
        assertEquals(new AeadKey(original), key);
        assertEquals(256, key.getBitStrength());
    }

    @Test
    public void randomKeys() {
        assertThat(AeadKey.random(), not(equalTo(AeadKey.random())));
        assertThat(Nonce.random(), not(equalTo(Nonce.random())));
    }

    @Test
    public void toStringHidesKey() {
        byte[] bytes = new byte[32];
        bytes[0] = (byte) 0xAB;
        assertThat(new AeadKey(bytes).toString(), not(containsString("ab")));
    }

    @Test
    public void hashDoesNotFollowKeyBytes() {
        AeadKey a = new AeadKey(new byte[32]);
        byte[] other = new byte[32];
        java.util.Arrays.fill(other, (byte) 0x5A);
        AeadKey b = new AeadKey(other);
        assertEquals(a.hashCode(), b.hashCode());

        Set<AeadKey> keys = new HashSet<>();
        keys.add(b);
        int before = b.hashCode();
        b.destroy();
        assertEquals(before, b.hashCode());
        assertTrue(keys.contains(b));
    }

    @Test
    public void destroy() {
        AeadKey key = AeadKey.random();
        key.destroy();
        assertTrue(key.isDestroyed());
        try {
            key.getKey();
            fail("destroyed key returned");
        } catch (IllegalStateException e) {
            // expected
        }
    }

    @Test
    public void sizes() {
        for (int size : new int[]{0, 16, 24, 31, 33}) {
            try {
                new AeadKey(new byte[size]);
                fail("key of " + size + " bytes accepted");
            } catch (InvalidKeySizeException e) {
                assertEquals(32, e.getExpectedSize());
                assertEquals(size, e.getActualSize());
            }
        }
        for (int size : new int[]{0, 8, 11, 13, 16}) {
            try {
                new Nonce(new byte[size]);
                fail("nonce of " + size + " bytes accepted");
            } catch (InvalidNonceSizeException e) {
                assertEquals(size, e.getActualSize());
            }
        }
    }

    @Test
    public void nonceValue() {
        byte[] bytes = CTRTransformer.randomBytes(12);
        Nonce nonce = new Nonce(bytes);
        assertArrayEquals(bytes, nonce.getBytes());
        assertEquals(new Nonce(bytes), nonce);
        assertEquals(new Nonce(bytes).hashCode(), nonce.hashCode());
    }
}
