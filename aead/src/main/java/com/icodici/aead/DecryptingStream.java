/*
 * Copyright (c) 2017 Sergey Chernov, iCodici S.n.C, All Rights Reserved
 *
 * Written by Sergey Chernov <real.sergeych@gmail.com>, August 2017.
 *
 */

package com.icodici.aead;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;

/**
 * AES-GCM decrypting stream. GCM can't tell whether a prefix of the ciphertext is genuine until
 * the tag is checked, so the source is read to the end and authenticated in the constructor; the
 * stream serves plaintext only after that.
 * <p>
 * Created with {@link AesGcm#decryptStream(InputStream, byte[])}.
 */
public class DecryptingStream extends InputStream {

    private final InputStream inputStream;
    private final ByteArrayInputStream plaintext;

    /**
     * @throws AuthenticationFailedException if the tag does not match
     * @throws EncryptionError               if the source is too short
     */
    DecryptingStream(AesGcm gcm, InputStream inputStream, byte @Nullable [] aad)
            throws IOException {
        this.inputStream = inputStream;
        plaintext = new ByteArrayInputStream(gcm.decrypt(readAll(inputStream), aad));
    }

    @Override
    public int read() {
        return plaintext.read();
    }

    @Override
    public int read(byte[] b, int off, int len) {
        return plaintext.read(b, off, len);
    }

    @Override
    public int available() {
        return plaintext.available();
    }

    @Override
    public void close() throws IOException {
        inputStream.close();
    }

    private static byte[] readAll(InputStream in) throws IOException {
        ByteArrayOutputStream bos = new ByteArrayOutputStream();
        byte[] buffer = new byte[8192];
        int n;
        while ((n = in.read(buffer)) >= 0)
            bos.write(buffer, 0, n);
        return bos.toByteArray();
    }
}
