/*
 * Copyright (c) 2017 Sergey Chernov, iCodici S.n.C, All Rights Reserved
 *
 * Written by Sergey Chernov <real.sergeych@gmail.com>, August 2017.
 *
 */

package com.icodici.aead;

import com.icodici.aead.ghash.GHash;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.EOFException;
import java.io.IOException;
import java.io.OutputStream;

/**
 * AES-GCM encrypting stream. Writes the nonce first, then ciphertext as data arrive, and the tag
 * on {@link #end()}, so the output has the same layout as {@link AesGcm#encrypt(byte[], byte[])}
 * and can be read back with {@link AesGcm#decrypt(byte[], byte[])} or {@link DecryptingStream}.
 * <p>
 * Created with {@link AesGcm#encryptStream(OutputStream, byte[])}.
 */
public class EncryptingStream extends OutputStream {

    /**
     * Longest plaintext a single nonce may protect, 2^39 - 256 bits. Past it the 32-bit counter
     * would wrap onto the block that masks the tag.
     */
    public static final long MAX_LENGTH = (1L << 36) - 32;

    private final AesGcm gcm;
    private final Nonce nonce;
    private final OutputStream outputStream;
    private final CTRTransformer transformer;
    private final GHash hash;
    private final long maxLength;
    private long written = 0;
    private boolean done = false;

    EncryptingStream(AesGcm gcm, Nonce nonce, byte @Nullable [] aad, OutputStream outputStream)
            throws IOException {
        this(gcm, nonce, aad, outputStream, MAX_LENGTH);
    }

    EncryptingStream(AesGcm gcm, Nonce nonce, byte @Nullable [] aad, OutputStream outputStream,
                     long maxLength) throws IOException {
        this.gcm = gcm;
        this.maxLength = maxLength;
        this.nonce = nonce;
        this.outputStream = outputStream;
        gcm.registerNonce(nonce);
        hash = gcm.startHash(aad);
        transformer = gcm.payloadTransformer(nonce);
        outputStream.write(nonce.getBytes());
    }

    public Nonce getNonce() {
        return nonce;
    }

    @Override
    public void write(int b) throws IOException {
        write(new byte[]{(byte) b}, 0, 1);
    }

    @Override
    public void write(byte[] b, int off, int len) throws IOException {
        if (done)
            throw new EOFException("can't write past the end()");
        if (len > maxLength - written)
            throw new EncryptionError("stream too long for one nonce, limit is " + maxLength + " bytes");
        written += len;
        byte[] encrypted = new byte[len];
        transformer.transform(b, off, len, encrypted, 0);
        hash.updateCiphertext(encrypted);
        outputStream.write(encrypted);
    }

    /**
     * Finishes encryption and writes down the tag. Further writing will cause {@link
     * EOFException}. Does not close the underlying output stream!
     */
    public void end() throws IOException {
        if (done)
            return;
        done = true;
        transformer.wipe();
        outputStream.write(gcm.finishTag(hash, nonce));
    }

    /**
     * Calls {@link #end()}, if wasn't called before, and closes underlying stream.
     */
    @Override
    public void close() throws IOException {
        if (!done)
            end();
        outputStream.close();
    }
}
