/*
 * Copyright (c) 2017 Sergey Chernov, iCodici S.n.C, All Rights Reserved
 *
 * Written by Sergey Chernov <real.sergeych@gmail.com>, August 2017.
 *
 */

package com.icodici.aead;

import org.spongycastle.util.Pack;

import javax.security.auth.Destroyable;
import java.util.Arrays;

/**
 * AES256 block cipher implementation: Rijndael with 128-bit block and 256-bit key, 14 rounds,
 * as described in FIPS-197.
 * <p>
 * The round key schedule is derived once in the constructor and is never changed afterwards
 * (except by {@link #destroy()}), so an instance is safe to use from any number of threads. The
 * substitution tables are built once, when the class is loaded, from the multiplicative inverse
 * in GF(2^8) and the Rijndael affine transform.
 * <p>
 * Not hardened against timing attacks: table lookups depend on secret data.
 */
public final class AES256 implements BlockCipher, Destroyable {

    public static final int BLOCK_SIZE = 16;
    public static final int KEY_SIZE = 32;

    static final int ROUNDS = 14;

    // key length in 32-bit words
    private static final int NK = 8;

    private static final int[] SBOX = new int[256];
    private static final int[] INV_SBOX = new int[256];
    private static final int[] RCON = {0x01, 0x02, 0x04, 0x08, 0x10, 0x20, 0x40};

    private static final int[][] MIX = {
            {2, 3, 1, 1},
            {1, 2, 3, 1},
            {1, 1, 2, 3},
            {3, 1, 1, 2}
    };
    private static final int[][] INV_MIX = {
            {14, 11, 13, 9},
            {9, 14, 11, 13},
            {13, 9, 14, 11},
            {11, 13, 9, 14}
    };

    static {
        // exp/log tables with the generator 3
        int[] exp = new int[256];
        int[] log = new int[256];
        int x = 1;
        for (int i = 0; i < 255; i++) {
            exp[i] = x;
            log[x] = i;
            x ^= xtime(x);
        }
        for (int i = 0; i < 256; i++) {
            int inverse = i == 0 ? 0 : exp[(255 - log[i]) % 255];
            int s = inverse ^ rotl8(inverse, 1) ^ rotl8(inverse, 2) ^ rotl8(inverse, 3)
                    ^ rotl8(inverse, 4) ^ 0x63;
            SBOX[i] = s;
            INV_SBOX[s] = i;
        }
    }

    private final int[] roundKeys;
    private volatile boolean destroyed = false;

    /**
     * Create the cipher and expand the key.
     *
     * @param key exactly 32 bytes
     *
     * @throws InvalidKeySizeException if the key is not 32 bytes long
     */
    public AES256(byte[] key) {
        if (key.length != KEY_SIZE)
            throw new InvalidKeySizeException(KEY_SIZE, key.length);
        roundKeys = expandKey(key);
    }

    public AES256(AeadKey key) {
        byte[] bytes = key.getKey();
        try {
            roundKeys = expandKey(bytes);
        } finally {
            Arrays.fill(bytes, (byte) 0);
        }
    }

    @Override
    public int getBlockSize() {
        return BLOCK_SIZE;
    }

    @Override
    public int getKeySize() {
        return KEY_SIZE;
    }

    @Override
    public String getTag() {
        return "AES256";
    }

    @Override
    public void encryptBlock(byte[] block, byte[] output) {
        checkBlock(block);
        checkBlock(output);
        int[] s = load(block);
        addRoundKey(s, 0);
        for (int round = 1; round < ROUNDS; round++) {
            substitute(s, SBOX);
            shiftRows(s);
            mixColumns(s, MIX);
            addRoundKey(s, round);
        }
        substitute(s, SBOX);
        shiftRows(s);
        addRoundKey(s, ROUNDS);
        store(s, output);
    }

    @Override
    public void decryptBlock(byte[] block, byte[] output) {
        checkBlock(block);
        checkBlock(output);
        int[] s = load(block);
        addRoundKey(s, ROUNDS);
        for (int round = ROUNDS - 1; round > 0; round--) {
            invShiftRows(s);
            substitute(s, INV_SBOX);
            addRoundKey(s, round);
            mixColumns(s, INV_MIX);
        }
        invShiftRows(s);
        substitute(s, INV_SBOX);
        addRoundKey(s, 0);
        store(s, output);
    }

    /**
     * Zero the round keys. Any further encryption or decryption fails with {@link
     * IllegalStateException}.
     */
    @Override
    public void destroy() {
        destroyed = true;
        Arrays.fill(roundKeys, 0);
    }

    @Override
    public boolean isDestroyed() {
        return destroyed;
    }

    /**
     * Round key as a block, for inspection in tests.
     *
     * @param round 0..14
     */
    byte[] roundKey(int round) {
        byte[] result = new byte[BLOCK_SIZE];
        for (int c = 0; c < 4; c++)
            Pack.intToBigEndian(roundKeys[4 * round + c], result, 4 * c);
        return result;
    }

    private void checkBlock(byte[] block) {
        if (block.length != BLOCK_SIZE)
            throw new InvalidBlockSizeException(BLOCK_SIZE, block.length);
        if (destroyed)
            throw new IllegalStateException("AES256 key has been destroyed");
    }

    private static int[] expandKey(byte[] key) {
        int[] w = new int[4 * (ROUNDS + 1)];
        for (int i = 0; i < NK; i++)
            w[i] = Pack.bigEndianToInt(key, 4 * i);
        for (int i = NK; i < w.length; i++) {
            int temp = w[i - 1];
            if (i % NK == 0)
                temp = subWord(rotWord(temp)) ^ (RCON[i / NK - 1] << 24);
            else if (i % NK == 4)
                temp = subWord(temp);
            w[i] = w[i - NK] ^ temp;
        }
        return w;
    }

    private static int rotWord(int word) {
        return (word << 8) | (word >>> 24);
    }

    private static int subWord(int word) {
        return SBOX[word >>> 24] << 24
                | SBOX[(word >>> 16) & 0xFF] << 16
                | SBOX[(word >>> 8) & 0xFF] << 8
                | SBOX[word & 0xFF];
    }

    // state is column-major: s[row + 4 * column]
    private static int[] load(byte[] block) {
        int[] s = new int[BLOCK_SIZE];
        for (int i = 0; i < BLOCK_SIZE; i++)
            s[i] = block[i] & 0xFF;
        return s;
    }

    private static void store(int[] s, byte[] output) {
        for (int i = 0; i < BLOCK_SIZE; i++)
            output[i] = (byte) s[i];
        Arrays.fill(s, 0);
    }

    private void addRoundKey(int[] s, int round) {
        for (int c = 0; c < 4; c++) {
            int w = roundKeys[4 * round + c];
            s[4 * c] ^= w >>> 24;
            s[4 * c + 1] ^= (w >>> 16) & 0xFF;
            s[4 * c + 2] ^= (w >>> 8) & 0xFF;
            s[4 * c + 3] ^= w & 0xFF;
        }
    }

    private static void substitute(int[] s, int[] table) {
        for (int i = 0; i < BLOCK_SIZE; i++)
            s[i] = table[s[i]];
    }

    // row r rotates left by r
    private static void shiftRows(int[] s) {
        int t = s[1];
        s[1] = s[5];
        s[5] = s[9];
        s[9] = s[13];
        s[13] = t;

        t = s[2];
        s[2] = s[10];
        s[10] = t;
        t = s[6];
        s[6] = s[14];
        s[14] = t;

        t = s[15];
        s[15] = s[11];
        s[11] = s[7];
        s[7] = s[3];
        s[3] = t;
    }

    private static void invShiftRows(int[] s) {
        int t = s[13];
        s[13] = s[9];
        s[9] = s[5];
        s[5] = s[1];
        s[1] = t;

        t = s[2];
        s[2] = s[10];
        s[10] = t;
        t = s[6];
        s[6] = s[14];
        s[14] = t;

        t = s[3];
        s[3] = s[7];
        s[7] = s[11];
        s[11] = s[15];
        s[15] = t;
    }

    private static void mixColumns(int[] s, int[][] matrix) {
        int[] column = new int[4];
        for (int c = 0; c < 4; c++) {
            System.arraycopy(s, 4 * c, column, 0, 4);
            for (int r = 0; r < 4; r++) {
                int[] row = matrix[r];
                s[4 * c + r] = mul(row[0], column[0]) ^ mul(row[1], column[1])
                        ^ mul(row[2], column[2]) ^ mul(row[3], column[3]);
            }
        }
        Arrays.fill(column, 0);
    }

    /**
     * Multiplication in GF(2^8) modulo x^8 + x^4 + x^3 + x + 1.
     */
    static int mul(int a, int b) {
        int product = 0;
        while (b != 0) {
            if ((b & 1) != 0)
                product ^= a;
            a = xtime(a);
            b >>>= 1;
        }
        return product;
    }

    private static int xtime(int a) {
        a <<= 1;
        if ((a & 0x100) != 0)
            a ^= 0x11B;
        return a;
    }

    private static int rotl8(int b, int shift) {
        return ((b << shift) | (b >>> (8 - shift))) & 0xFF;
    }
}
