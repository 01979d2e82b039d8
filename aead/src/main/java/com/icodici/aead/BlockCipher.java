/*
 * Copyright (c) 2017 Sergey Chernov, iCodici S.n.C, All Rights Reserved
 *
 * Written by Sergey Chernov <real.sergeych@gmail.com>, August 2017.
 *
 */

package com.icodici.aead;

/**
 * Interface to all block ciphers. The key schedule is computed once when the implementation is
 * constructed, so the same instance encrypts and decrypts and could be shared between threads.
 */
public interface BlockCipher {

    /**
     * @return block size in bytes
     */
    int getBlockSize();

    int getKeySize();

    /**
     * Encryption method tag, AES256 for AES 256 (Rijndael 256/128) and so on
     */
    String getTag();

    /**
     * Encrypt a single block into the provided buffer. Source and destination may be the same
     * array.
     *
     * @param block  source block, exactly {@link #getBlockSize()} bytes
     * @param output destination, exactly {@link #getBlockSize()} bytes
     *
     * @throws InvalidBlockSizeException if either buffer has wrong size
     */
    void encryptBlock(byte[] block, byte[] output);

    /**
     * Inverse of {@link #encryptBlock(byte[], byte[])}.
     *
     * @throws InvalidBlockSizeException if either buffer has wrong size
     */
    void decryptBlock(byte[] block, byte[] output);

    /**
     * Encrypt source block and return processed block
     *
     * @param block source block
     *
     * @return new array with the encrypted block
     */
    default byte[] encryptBlock(byte[] block) {
        byte[] result = new byte[getBlockSize()];
        encryptBlock(block, result);
        return result;
    }

    /**
     * Decrypt source block and return processed block
     *
     * @param block source block
     *
     * @return new array with the decrypted block
     */
    default byte[] decryptBlock(byte[] block) {
        byte[] result = new byte[getBlockSize()];
        decryptBlock(block, result);
        return result;
    }
}
