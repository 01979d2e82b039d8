/*
 * Copyright (c) 2017 Sergey Chernov, iCodici S.n.C, All Rights Reserved
 *
 * Written by Sergey Chernov <real.sergeych@gmail.com>, August 2017.
 *
 */

package com.icodici.aead;

import java.security.SecureRandom;
import java.util.Arrays;

/**
 * GCM counter mode (CTR) transformer. The keystream is E(K, cb), E(K, inc32(cb)), ... where
 * {@code inc32} increments the last four bytes of the counter block as a big-endian integer,
 * wrapping modulo 2^32 without touching the nonce part.
 * <p>
 * Encryption and decryption are the same operation. The transformer keeps its position, so
 * successive calls continue one keystream. Not thread safe: use one instance per message.
 */
public class CTRTransformer {
    static private final SecureRandom rng = new SecureRandom();

    private final BlockCipher cipher;
    private final int blockSize;
    private final byte[] counter;
    private final byte[] keystream;
    private int index;

    static public byte[] randomBytes(int length) {
        byte[] bytes = new byte[length];
        rng.nextBytes(bytes);
        return bytes;
    }

    /**
     * Create CTR transformer
     *
     * @param cipher              any block cipher, always used in the encrypt direction
     * @param initialCounterBlock counter block for the first keystream block, copied
     */
    public CTRTransformer(BlockCipher cipher, byte[] initialCounterBlock) {
        this.cipher = cipher;
        blockSize = cipher.getBlockSize();
        if (initialCounterBlock.length != blockSize)
            throw new InvalidBlockSizeException(blockSize, initialCounterBlock.length);
        counter = initialCounterBlock.clone();
        keystream = new byte[blockSize];
        index = blockSize;
    }

    /**
     * Transformer for the message payload under the given nonce. Its first counter block is
     * inc32(J0), J0 being reserved for the tag mask (see {@link #preCounterBlock(Nonce)}).
     */
    public static CTRTransformer forPayload(BlockCipher cipher, Nonce nonce) {
        byte[] block = preCounterBlock(nonce);
        inc32(block);
        return new CTRTransformer(cipher, block);
    }

    /**
     * J0 = nonce || 0x00000001.
     */
    public static byte[] preCounterBlock(Nonce nonce) {
        byte[] block = new byte[AES256.BLOCK_SIZE];
        nonce.copyTo(block, 0);
        block[AES256.BLOCK_SIZE - 1] = 1;
        return block;
    }

    /**
     * Increment the low 32 bits of the block, big-endian, modulo 2^32.
     */
    public static void inc32(byte[] block) {
        int n = block.length - 1;
        int end = block.length - 4;
        while (n >= end && ++block[n] == 0)
            n--;
    }

    /**
     * @return copy of the counter block that will produce the next keystream block
     */
    public byte[] getCounter() {
        return counter.clone();
    }

    private void nextBlock() {
        cipher.encryptBlock(counter, keystream);
        inc32(counter);
        index = 0;
    }

    /**
     * Transform next byte
     *
     * @return transformed byte
     */
    public int transformByte(int source) {
        if (index >= blockSize)
            nextBlock();
        return (source ^ keystream[index++]) & 0xFF;
    }

    /**
     * XOR the next {@code length} keystream bytes with the source range into the destination.
     * Source and destination may overlap exactly (in-place transform).
     */
    public void transform(byte[] source, int offset, int length, byte[] destination,
                          int destinationOffset) {
        if (offset < 0 || length < 0 || offset + length > source.length
                || destinationOffset < 0 || destinationOffset + length > destination.length)
            throw new IndexOutOfBoundsException("bad offset/length: " + offset + "/" + length);
        for (int i = 0; i < length; i++) {
            if (index >= blockSize)
                nextBlock();
            destination[destinationOffset + i] = (byte) (source[offset + i] ^ keystream[index++]);
        }
    }

    /**
     * @return new array with the transformed data, same length as the source
     */
    public byte[] transform(byte[] source) {
        byte[] result = new byte[source.length];
        transform(source, 0, source.length, result, 0);
        return result;
    }

    /**
     * Zero the keystream and the counter once the message is done.
     */
    public void wipe() {
        Arrays.fill(keystream, (byte) 0);
        Arrays.fill(counter, (byte) 0);
        index = blockSize;
    }

    static public void applyXor(byte[] source, int offset, byte[] mask) {
        int end = offset + mask.length;
        if (end > source.length)
            throw new IllegalArgumentException("source is too short for this offset and mask");
        int sourceIndex = offset;
        int maskIndex = 0;
        while (sourceIndex < end)
            source[sourceIndex++] ^= mask[maskIndex++];
    }
}
