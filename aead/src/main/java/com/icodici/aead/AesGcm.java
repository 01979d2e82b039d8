/*
 * Copyright (c) 2017 Sergey Chernov, iCodici S.n.C, All Rights Reserved
 *
 * Written by Sergey Chernov <real.sergeych@gmail.com>, August 2017.
 *
 */

package com.icodici.aead;

import com.icodici.aead.ghash.GHash;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.spongycastle.util.Arrays;

import javax.security.auth.Destroyable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

/**
 * AES-256 in Galois/Counter Mode (NIST SP 800-38D) with 96-bit nonces and 128-bit tags.
 * <p>
 * The key is expanded once, in the constructor; after that the instance holds no mutable state
 * except the optional nonce registry, so it can be shared between threads as long as every call
 * gets its own nonce. A (key, nonce) pair must never seal two different plaintexts: unless the
 * instance is configured with {@link NoncePolicy#TRACK}, it is up to the caller to guarantee
 * that, for example with {@link Nonce#random()} or a message counter.
 * <p>
 * Usage:
 * <pre>
 * AesGcm gcm = new AesGcm(AeadKey.random());
 * Nonce nonce = Nonce.random();
 * Sealed sealed = gcm.seal(nonce, plaintext, header);
 * OpenResult result = gcm.open(nonce, sealed.getCiphertext(), sealed.getTag(), header);
 * if (result.isAuthentic()) ...
 * </pre>
 * For the simpler self-contained format (nonce || ciphertext || tag) use {@link
 * #encrypt(byte[], byte[])} and {@link #decrypt(byte[], byte[])}.
 */
public class AesGcm implements Destroyable {

    public static final int KEY_SIZE = AeadKey.SIZE;
    public static final int NONCE_SIZE = Nonce.SIZE;
    public static final int TAG_SIZE = 16;

    /**
     * Bytes {@link #encrypt(byte[], byte[])} adds to the plaintext.
     */
    public static final int OVERHEAD = NONCE_SIZE + TAG_SIZE;

    private static final Logger log = LoggerFactory.getLogger(AesGcm.class);

    private final AES256 cipher;
    private final AeadConfig config;
    @Nullable
    private final NonceRegistry nonces;

    /**
     * @param key 32 bytes
     *
     * @throws InvalidKeySizeException if the key has other size
     */
    public AesGcm(byte[] key) {
        this(new AeadKey(key));
    }

    public AesGcm(AeadKey key) {
        this(key, AeadConfig.defaults());
    }

    public AesGcm(AeadKey key, AeadConfig config) {
        cipher = new AES256(key);
        this.config = config;
        nonces = config.getNoncePolicy() == NoncePolicy.TRACK
                ? new NonceRegistry(config.getMaxTrackedNonces()) : null;
        log.debug("AES-256-GCM instance created, {}", config);
    }

    public AeadConfig getConfig() {
        return config;
    }

    public Sealed seal(byte[] nonce, byte[] plaintext, byte @Nullable [] aad) {
        return seal(new Nonce(nonce), plaintext, aad);
    }

    /**
     * Encrypt and authenticate.
     *
     * @param nonce     never used before with this key
     * @param plaintext any length, may be empty
     * @param aad       associated data: authenticated, not encrypted; null means none
     *
     * @return ciphertext of the plaintext length and the 16-byte tag
     *
     * @throws NonceReuseException in {@link NoncePolicy#TRACK} mode only
     */
    public Sealed seal(Nonce nonce, byte[] plaintext, byte @Nullable [] aad) {
        checkAlive();
        registerNonce(nonce);
        CTRTransformer transformer = payloadTransformer(nonce);
        byte[] ciphertext;
        try {
            ciphertext = transformer.transform(plaintext);
        } finally {
            transformer.wipe();
        }
        return new Sealed(ciphertext, computeTag(nonce, aad, ciphertext, 0, ciphertext.length));
    }

    /**
     * @throws InvalidNonceSizeException unless nonce is 12 bytes
     * @throws InvalidTagSizeException  unless tag is 16 bytes
     * @see #open(Nonce, byte[], byte[], byte[])
     */
    public OpenResult open(byte[] nonce, byte[] ciphertext, byte[] tag, byte @Nullable [] aad) {
        return open(new Nonce(nonce), ciphertext, tag, aad);
    }

    /**
     * Verify and decrypt. The tag is checked over the whole ciphertext before any decryption
     * takes place; on mismatch the result is rejected and carries no data.
     *
     * @param aad must be the same associated data that was sealed, null means none
     *
     * @throws InvalidTagSizeException unless tag is 16 bytes
     */
    public OpenResult open(Nonce nonce, byte[] ciphertext, byte[] tag, byte @Nullable [] aad) {
        byte[] plaintext = openRange(nonce, ciphertext, 0, ciphertext.length, tag, aad);
        return plaintext == null ? OpenResult.rejected() : OpenResult.authentic(plaintext);
    }

    public byte[] encrypt(byte[] plaintext) {
        return encrypt(plaintext, null);
    }

    /**
     * Seal with a fresh random nonce and pack everything needed for decryption.
     *
     * @return nonce || ciphertext || tag, {@link #OVERHEAD} bytes longer than the plaintext
     */
    public byte[] encrypt(byte[] plaintext, byte @Nullable [] aad) {
        Nonce nonce = Nonce.random();
        Sealed sealed = seal(nonce, plaintext, aad);
        return Arrays.concatenate(nonce.getBytes(), sealed.getCiphertext(), sealed.getTag());
    }

    /**
     * Encrypt UTF-8 encoded text, see {@link #encrypt(byte[], byte[])}.
     */
    public byte[] encrypt(String plaintext, @Nullable String aad) {
        return encrypt(plaintext.getBytes(StandardCharsets.UTF_8), utf8(aad));
    }

    public byte[] decrypt(byte[] packed) throws EncryptionError {
        return decrypt(packed, null);
    }

    /**
     * Decrypt data produced by {@link #encrypt(byte[], byte[])}.
     *
     * @throws EncryptionError                if the data is too short to be a packed message
     * @throws AuthenticationFailedException if the data or the associated data were altered
     */
    public byte[] decrypt(byte[] packed, byte @Nullable [] aad) throws EncryptionError {
        if (packed.length < OVERHEAD)
            throw new EncryptionError("encrypted data too short: " + packed.length + " bytes");
        Nonce nonce = new Nonce(Arrays.copyOfRange(packed, 0, NONCE_SIZE));
        byte[] tag = Arrays.copyOfRange(packed, packed.length - TAG_SIZE, packed.length);
        byte[] plaintext = openRange(nonce, packed, NONCE_SIZE, packed.length - OVERHEAD, tag, aad);
        if (plaintext == null)
            throw new AuthenticationFailedException();
        return plaintext;
    }

    public String decryptString(byte[] packed, @Nullable String aad) throws EncryptionError {
        return new String(decrypt(packed, utf8(aad)), StandardCharsets.UTF_8);
    }

    /**
     * Encrypt on the fly with a random nonce. Call {@link EncryptingStream#end()} or {@link
     * EncryptingStream#close()} to write the tag.
     */
    public EncryptingStream encryptStream(OutputStream out, byte @Nullable [] aad)
            throws IOException {
        return new EncryptingStream(this, Nonce.random(), aad, out);
    }

    /**
     * Read and authenticate a stream written by {@link #encryptStream(OutputStream, byte[])}.
     * The whole input is consumed and verified before the returned stream yields any byte.
     *
     * @throws AuthenticationFailedException if the stream was altered
     */
    public DecryptingStream decryptStream(InputStream in, byte @Nullable [] aad)
            throws IOException {
        return new DecryptingStream(this, in, aad);
    }

    /**
     * Zero the round keys and forget tracked nonces. Further use fails with {@link
     * IllegalStateException}.
     */
    @Override
    public void destroy() {
        cipher.destroy();
        if (nonces != null)
            nonces.clear();
        log.debug("AES-256-GCM instance destroyed");
    }

    @Override
    public boolean isDestroyed() {
        return cipher.isDestroyed();
    }

    private byte @Nullable [] openRange(Nonce nonce, byte[] data, int offset, int length,
                                        byte[] tag, byte @Nullable [] aad) {
        if (tag.length != TAG_SIZE)
            throw new InvalidTagSizeException(TAG_SIZE, tag.length);
        checkAlive();
        byte[] expected = computeTag(nonce, aad, data, offset, length);
        boolean authentic = Arrays.constantTimeAreEqual(expected, tag);
        Arrays.fill(expected, (byte) 0);
        if (!authentic) {
            log.debug("tag mismatch, {} bytes of ciphertext rejected", length);
            return null;
        }
        byte[] plaintext = new byte[length];
        CTRTransformer transformer = payloadTransformer(nonce);
        try {
            transformer.transform(data, offset, length, plaintext, 0);
        } finally {
            transformer.wipe();
        }
        return plaintext;
    }

    private byte[] computeTag(Nonce nonce, byte @Nullable [] aad, byte[] ciphertext, int offset,
                              int length) {
        GHash hash = startHash(aad);
        hash.updateCiphertext(ciphertext, offset, length);
        return finishTag(hash, nonce);
    }

    void registerNonce(Nonce nonce) {
        if (nonces != null)
            nonces.register(nonce);
    }

    @Nullable
    NonceRegistry getNonceRegistry() {
        return nonces;
    }

    CTRTransformer payloadTransformer(Nonce nonce) {
        return CTRTransformer.forPayload(cipher, nonce);
    }

    /**
     * GHASH keyed with H = E(K, 0^128), associated data already absorbed.
     */
    GHash startHash(byte @Nullable [] aad) {
        byte[] h = cipher.encryptBlock(new byte[AES256.BLOCK_SIZE]);
        GHash hash;
        try {
            hash = new GHash(h);
        } finally {
            Arrays.fill(h, (byte) 0);
        }
        if (aad != null)
            hash.updateAad(aad);
        return hash;
    }

    /**
     * tag = GHASH(H, A, C) xor E(K, J0)
     */
    byte[] finishTag(GHash hash, Nonce nonce) {
        byte[] tag = hash.digest();
        byte[] j0 = CTRTransformer.preCounterBlock(nonce);
        byte[] mask = cipher.encryptBlock(j0);
        CTRTransformer.applyXor(tag, 0, mask);
        Arrays.fill(mask, (byte) 0);
        Arrays.fill(j0, (byte) 0);
        return tag;
    }

    private void checkAlive() {
        if (cipher.isDestroyed())
            throw new IllegalStateException("AesGcm key has been destroyed");
    }

    private static byte @Nullable [] utf8(@Nullable String text) {
        return text == null ? null : text.getBytes(StandardCharsets.UTF_8);
    }
}
