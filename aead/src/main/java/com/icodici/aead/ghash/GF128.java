/*
 * Copyright (c) 2017 Sergey Chernov, iCodici S.n.C, All Rights Reserved
 *
 * Written by Sergey Chernov <real.sergeych@gmail.com>, August 2017.
 *
 */

package com.icodici.aead.ghash;

import com.icodici.aead.InvalidBlockSizeException;
import org.spongycastle.util.Pack;

/**
 * Multiplication in GF(2^128) modulo x^128 + x^7 + x^2 + x + 1, with the bit order used by GCM:
 * the coefficient of x^0 is the most significant bit of the first byte.
 * <p>
 * A 128-bit element is handled as two longs, {@code hi} holding bytes 0..7 and {@code lo} bytes
 * 8..15, both big-endian.
 */
public final class GF128 {

    public static final int SIZE = 16;

    /**
     * Low-order terms of the reduction polynomial, 0xE1 followed by 15 zero bytes.
     */
    public static final long R = 0xE100000000000000L;

    private GF128() {
    }

    /**
     * Multiply two field elements.
     *
     * @param x 16 bytes
     * @param y 16 bytes
     *
     * @return new 16-byte array with x * y
     */
    public static byte[] multiply(byte[] x, byte[] y) {
        if (x.length != SIZE)
            throw new InvalidBlockSizeException(SIZE, x.length);
        if (y.length != SIZE)
            throw new InvalidBlockSizeException(SIZE, y.length);
        long[] z = {Pack.bigEndianToLong(x, 0), Pack.bigEndianToLong(x, 8)};
        multiply(z, Pack.bigEndianToLong(y, 0), Pack.bigEndianToLong(y, 8));
        byte[] result = new byte[SIZE];
        Pack.longToBigEndian(z[0], result, 0);
        Pack.longToBigEndian(z[1], result, 8);
        return result;
    }

    /**
     * In-place z = z * v where z is {hi, lo} and v is (vHi, vLo).
     * <p>
     * For every set bit of z, scanning from x^0, the running multiple of v is added to the
     * accumulator; the multiple is then divided by x (a right shift in this bit order) and reduced
     * by {@link #R} when the x^127 coefficient falls off. Branch free.
     */
    public static void multiply(long[] z, long vHi, long vLo) {
        long zHi = 0;
        long zLo = 0;
        long x = z[0];
        for (int i = 0; i < 128; i++) {
            if (i == 64)
                x = z[1];
            long mask = x >> 63;
            zHi ^= vHi & mask;
            zLo ^= vLo & mask;

            long reduce = (vLo << 63) >> 63;
            vLo = (vLo >>> 1) | (vHi << 63);
            vHi = (vHi >>> 1) ^ (R & reduce);
            x <<= 1;
        }
        z[0] = zHi;
        z[1] = zLo;
    }
}
