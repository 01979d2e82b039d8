/*
 * Copyright (c) 2017 Sergey Chernov, iCodici S.n.C, All Rights Reserved
 *
 * Written by Sergey Chernov <real.sergeych@gmail.com>, August 2017.
 *
 */

package com.icodici.aead.ghash;

import com.icodici.aead.InvalidBlockSizeException;
import org.spongycastle.util.Pack;

import java.util.Arrays;

/**
 * GHASH universal hash of GCM, keyed with the hash subkey H = E(K, 0^128).
 * <p>
 * Associated data must be fed first, then the ciphertext; each section is absorbed in 16-byte
 * blocks, its last partial block zero padded. {@link #digest()} closes the hash with the block
 * holding both bit lengths. Data may arrive in chunks of any size. Instances are single use and
 * not thread safe.
 */
public final class GHash {

    public static final int BLOCK_SIZE = GF128.SIZE;

    private long hHi;
    private long hLo;
    private final long[] y = new long[2];
    private final byte[] buffer = new byte[BLOCK_SIZE];
    private int buffered = 0;
    private long aadLength = 0;
    private long ciphertextLength = 0;
    private boolean ciphertextStarted = false;
    private boolean finished = false;

    /**
     * @param hashSubkey H, 16 bytes. The array is not retained.
     */
    public GHash(byte[] hashSubkey) {
        if (hashSubkey.length != BLOCK_SIZE)
            throw new InvalidBlockSizeException(BLOCK_SIZE, hashSubkey.length);
        hHi = Pack.bigEndianToLong(hashSubkey, 0);
        hLo = Pack.bigEndianToLong(hashSubkey, 8);
    }

    public void updateAad(byte[] data) {
        updateAad(data, 0, data.length);
    }

    /**
     * Absorb the next chunk of associated data.
     *
     * @throws IllegalStateException if ciphertext was already supplied
     */
    public void updateAad(byte[] data, int offset, int length) {
        checkNotFinished();
        if (ciphertextStarted)
            throw new IllegalStateException("associated data must precede ciphertext");
        absorb(data, offset, length);
        aadLength += length;
    }

    public void updateCiphertext(byte[] data) {
        updateCiphertext(data, 0, data.length);
    }

    /**
     * Absorb the next chunk of ciphertext. The first call closes the associated data section.
     */
    public void updateCiphertext(byte[] data, int offset, int length) {
        checkNotFinished();
        if (!ciphertextStarted) {
            flushPadded();
            ciphertextStarted = true;
        }
        absorb(data, offset, length);
        ciphertextLength += length;
    }

    /**
     * Finish hashing: pad the pending section, absorb the length block and return the raw digest
     * S. The instance can't be updated afterwards and its key material is wiped.
     *
     * @return 16 bytes
     */
    public byte[] digest() {
        checkNotFinished();
        flushPadded();
        byte[] lengths = lengthBlock(aadLength, ciphertextLength);
        absorbBlock(lengths, 0);
        byte[] result = new byte[BLOCK_SIZE];
        Pack.longToBigEndian(y[0], result, 0);
        Pack.longToBigEndian(y[1], result, 8);
        wipe();
        finished = true;
        return result;
    }

    /**
     * The closing block: 64-bit big-endian bit length of the associated data followed by the
     * 64-bit big-endian bit length of the ciphertext.
     *
     * @param aadBytes        associated data length in bytes
     * @param ciphertextBytes ciphertext length in bytes
     */
    public static byte[] lengthBlock(long aadBytes, long ciphertextBytes) {
        byte[] block = new byte[BLOCK_SIZE];
        Pack.longToBigEndian(aadBytes * 8, block, 0);
        Pack.longToBigEndian(ciphertextBytes * 8, block, 8);
        return block;
    }

    /**
     * Zero the hash subkey and intermediate state. Called by {@link #digest()}; use it directly
     * when an operation is abandoned.
     */
    public void wipe() {
        hHi = 0;
        hLo = 0;
        y[0] = 0;
        y[1] = 0;
        Arrays.fill(buffer, (byte) 0);
        buffered = 0;
    }

    private void absorb(byte[] data, int offset, int length) {
        if (offset < 0 || length < 0 || offset + length > data.length)
            throw new IndexOutOfBoundsException("bad offset/length: " + offset + "/" + length);
        int end = offset + length;
        if (buffered > 0) {
            int n = Math.min(BLOCK_SIZE - buffered, length);
            System.arraycopy(data, offset, buffer, buffered, n);
            buffered += n;
            offset += n;
            if (buffered < BLOCK_SIZE)
                return;
            absorbBlock(buffer, 0);
            buffered = 0;
        }
        while (end - offset >= BLOCK_SIZE) {
            absorbBlock(data, offset);
            offset += BLOCK_SIZE;
        }
        if (offset < end) {
            buffered = end - offset;
            System.arraycopy(data, offset, buffer, 0, buffered);
        }
    }

    private void flushPadded() {
        if (buffered > 0) {
            Arrays.fill(buffer, buffered, BLOCK_SIZE, (byte) 0);
            absorbBlock(buffer, 0);
            buffered = 0;
        }
    }

    // Y = (Y xor block) * H
    private void absorbBlock(byte[] block, int offset) {
        y[0] ^= Pack.bigEndianToLong(block, offset);
        y[1] ^= Pack.bigEndianToLong(block, offset + 8);
        GF128.multiply(y, hHi, hLo);
    }

    private void checkNotFinished() {
        if (finished)
            throw new IllegalStateException("GHash digest already taken");
    }
}
