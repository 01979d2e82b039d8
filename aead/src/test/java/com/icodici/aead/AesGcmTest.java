/*
 * Copyright (c) 2017 Sergey Chernov, iCodici S.n.C, All Rights Reserved
 *
 * Written by Sergey Chernov <real.sergeych@gmail.com>, August 2017.
 *
 */

package com.icodici.aead;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;
import org.spongycastle.crypto.InvalidCipherTextException;
import org.spongycastle.crypto.engines.AESEngine;
import org.spongycastle.crypto.modes.GCMBlockCipher;
import org.spongycastle.crypto.params.AEADParameters;
import org.spongycastle.crypto.params.KeyParameter;
import org.spongycastle.util.encoders.Hex;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.hamcrest.CoreMatchers.equalTo;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

/**
 * AES-256-GCM against the published GCM test vectors, spongycastle and its own invariants.
 */
public class AesGcmTest {

    private static final byte[] zeroKey = new byte[32];
    private static final byte[] zeroNonce = new byte[12];

    private static final byte[] key15 = Hex.decode("feffe9928665731c6d6a8f9467308308" +
                                                           "feffe9928665731c6d6a8f9467308308");
    private static final byte[] nonce15 = Hex.decode("cafebabefacedbaddecaf888");
    private static final byte[] plaintext15 = Hex.decode(
            "d9313225f88406e5a55909c5aff5269a" +
            "86a7a9531534f7da2e4c303d8a318a72" +
            "1c3c0c95956809532fcf0e2449a6b525" +
            "b16aedf5aa0de657ba637b391aafd255");
    private static final byte[] ciphertext15 = Hex.decode(
            "522dc1f099567d07f47f37a32a84427d" +
            "643a8cdcbfe5c0c97598a2bd2555d1aa" +
            "8cb08e48590dbb3da7b08b1056828838" +
            "c5f61e6393ba7a0abcc9f662898015ad");
    private static final byte[] aad16 = Hex.decode("feedfacedeadbeeffeedfacedeadbeefabaddad2");

    @Rule
    public final ExpectedException exception = ExpectedException.none();

    @Test
    public void testCase13() throws Exception {
        Sealed sealed = new AesGcm(zeroKey).seal(zeroNonce, new byte[0], null);
        assertEquals(0, sealed.getCiphertext().length);
        assertArrayEquals(Hex.decode("530f8afbc74536b9a963b4f1c4cb738b"), sealed.getTag());
    }

    @Test
    public void testCase14() throws Exception {
        AesGcm gcm = new AesGcm(zeroKey);
        Sealed sealed = gcm.seal(zeroNonce, new byte[16], new byte[0]);
        assertArrayEquals(Hex.decode("cea7403d4d606b6e074ec5d3baf39d18"), sealed.getCiphertext());
        assertArrayEquals(Hex.decode("d0d1c8a799996bf0265b98b5d48ab919"), sealed.getTag());
        OpenResult result = gcm.open(zeroNonce, sealed.getCiphertext(), sealed.getTag(), null);
        assertArrayEquals(new byte[16], result.getPlaintextOrThrow());
    }

    @Test
    public void testCase15() throws Exception {
        AesGcm gcm = new AesGcm(key15);
        Sealed sealed = gcm.seal(nonce15, plaintext15, null);
        assertArrayEquals(ciphertext15, sealed.getCiphertext());
        assertArrayEquals(Hex.decode("b094dac5d93471bdec1a502270e3cc6c"), sealed.getTag());
    }

    @Test
    public void testCase16() throws Exception {
        AesGcm gcm = new AesGcm(key15);
        byte[] plaintext = Arrays.copyOf(plaintext15, 60);
        Sealed sealed = gcm.seal(nonce15, plaintext, aad16);
        assertArrayEquals(Arrays.copyOf(ciphertext15, 60), sealed.getCiphertext());
        assertArrayEquals(Hex.decode("76fc6ece0f4e1768cddf8853bb2d551b"), sealed.getTag());
        assertArrayEquals(plaintext, gcm.open(nonce15, sealed.getCiphertext(), sealed.getTag(),
                                              aad16).getPlaintextOrThrow());
    }

    @Test
    public void fullBlocksWithAadMatchSpongyCastle() throws Exception {
        Sealed sealed = new AesGcm(key15).seal(nonce15, plaintext15, aad16);
        assertArrayEquals(referenceSeal(key15, nonce15, plaintext15, aad16), sealed.pack());
    }

    @Test
    public void matchesSpongyCastle() throws Exception {
        Random random = new Random(11);
        for (int i = 0; i < 200; i++) {
            byte[] key = bytes(random, 32);
            byte[] nonce = bytes(random, 12);
            byte[] plaintext = bytes(random, random.nextInt(100));
            byte[] aad = bytes(random, random.nextInt(40));
            Sealed sealed = new AesGcm(key).seal(nonce, plaintext, aad);
            assertArrayEquals(referenceSeal(key, nonce, plaintext, aad), sealed.pack());
        }
    }

    @Test
    public void roundTrip() throws Exception {
        Random random = new Random(12);
        AesGcm gcm = new AesGcm(AeadKey.random());
        for (int size : new int[]{0, 1, 15, 16, 17, 31, 32, 33, 1000, 0x23456}) {
            byte[] plaintext = bytes(random, size);
            byte[] aad = bytes(random, size % 50);
            Nonce nonce = Nonce.random();
            Sealed sealed = gcm.seal(nonce, plaintext, aad);
            assertEquals(size, sealed.getCiphertext().length);
            assertEquals(16, sealed.getTag().length);
            OpenResult result = gcm.open(nonce, sealed.getCiphertext(), sealed.getTag(), aad);
            assertTrue(result.isAuthentic());
            assertArrayEquals(plaintext, result.getPlaintext());
        }
    }

    @Test
    public void deterministic() {
        AesGcm gcm = new AesGcm(key15);
        Sealed a = gcm.seal(nonce15, plaintext15, aad16);
        Sealed b = new AesGcm(key15).seal(nonce15, plaintext15, aad16);
        assertArrayEquals(a.getCiphertext(), b.getCiphertext());
        assertArrayEquals(a.getTag(), b.getTag());
    }

    @Test
    public void nonceChangesEverything() {
        AesGcm gcm = new AesGcm(key15);
        byte[] otherNonce = nonce15.clone();
        otherNonce[11] ^= 1;
        Sealed a = gcm.seal(nonce15, plaintext15, aad16);
        Sealed b = gcm.seal(otherNonce, plaintext15, aad16);
        assertThat(a.getCiphertext(), not(equalTo(b.getCiphertext())));
        assertThat(a.getTag(), not(equalTo(b.getTag())));
    }

    @Test
    public void anyFlippedBitIsDetected() {
        AesGcm gcm = new AesGcm(key15);
        byte[] plaintext = "attack at dawn".getBytes();
        byte[] aad = "hdr".getBytes();
        Sealed sealed = gcm.seal(nonce15, plaintext, aad);
        byte[] ciphertext = sealed.getCiphertext();
        byte[] tag = sealed.getTag();

        for (int bit = 0; bit < ciphertext.length * 8; bit++)
            assertRejected(gcm.open(nonce15, flip(ciphertext, bit), tag, aad));
        for (int bit = 0; bit < tag.length * 8; bit++)
            assertRejected(gcm.open(nonce15, ciphertext, flip(tag, bit), aad));
        for (int bit = 0; bit < aad.length * 8; bit++)
            assertRejected(gcm.open(nonce15, ciphertext, tag, flip(aad, bit)));
        for (int bit = 0; bit < nonce15.length * 8; bit++)
            assertRejected(gcm.open(flip(nonce15, bit), ciphertext, tag, aad));

        assertRejected(gcm.open(nonce15, ciphertext, tag, null));
        assertRejected(new AesGcm(zeroKey).open(nonce15, ciphertext, tag, aad));
        assertTrue(gcm.open(nonce15, ciphertext, tag, aad).isAuthentic());
    }

    @Test
    public void emptyAadEqualsNoAad() {
        AesGcm gcm = new AesGcm(key15);
        assertArrayEquals(gcm.seal(nonce15, plaintext15, null).getTag(),
                          gcm.seal(nonce15, plaintext15, new byte[0]).getTag());
    }

    @Test
    public void rejectedResultHasNoPlaintext() throws Exception {
        AesGcm gcm = new AesGcm(key15);
        Sealed sealed = gcm.seal(nonce15, plaintext15, null);
        OpenResult result = gcm.open(nonce15, sealed.getCiphertext(), new byte[16], null);
        assertFalse(result.isAuthentic());
        assertThat(result.getPlaintext(), nullValue());
        exception.expect(AuthenticationFailedException.class);
        result.getPlaintextOrThrow();
    }

    @Test
    public void wrongKeySize() {
        exception.expect(InvalidKeySizeException.class);
        new AesGcm(new byte[16]);
    }

    @Test
    public void wrongNonceSize() {
        AesGcm gcm = new AesGcm(key15);
        try {
            gcm.seal(new byte[16], plaintext15, null);
            fail("16-byte nonce accepted");
        } catch (InvalidNonceSizeException e) {
            assertEquals(12, e.getExpectedSize());
            assertEquals(16, e.getActualSize());
        }
        exception.expect(InvalidNonceSizeException.class);
        gcm.open(new byte[8], ciphertext15, new byte[16], null);
    }

    @Test
    public void wrongTagSize() {
        AesGcm gcm = new AesGcm(key15);
        Sealed sealed = gcm.seal(nonce15, plaintext15, null);
        exception.expect(InvalidTagSizeException.class);
        gcm.open(nonce15, sealed.getCiphertext(), Arrays.copyOf(sealed.getTag(), 12), null);
    }

    @Test
    public void sharedBetweenThreads() throws Exception {
        AesGcm gcm = new AesGcm(AeadKey.random());
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<Boolean>> results = new ArrayList<>();
            for (int t = 0; t < 16; t++) {
                final int seed = t;
                results.add(pool.submit((Callable<Boolean>) () -> {
                    Random random = new Random(seed);
                    for (int i = 0; i < 50; i++) {
                        byte[] plaintext = bytes(random, random.nextInt(200));
                        Nonce nonce = Nonce.random();
                        Sealed sealed = gcm.seal(nonce, plaintext, null);
                        byte[] opened = gcm.open(nonce, sealed.getCiphertext(), sealed.getTag(),
                                                 null).getPlaintextOrThrow();
                        if (!Arrays.equals(plaintext, opened))
                            return false;
                    }
                    return true;
                }));
            }
            for (Future<Boolean> f : results)
                assertTrue(f.get());
        } finally {
            pool.shutdown();
        }
    }

    @Test
    public void destroy() {
        AesGcm gcm = new AesGcm(key15);
        gcm.destroy();
        assertTrue(gcm.isDestroyed());
        exception.expect(IllegalStateException.class);
        gcm.seal(nonce15, plaintext15, null);
    }

    static byte[] referenceSeal(byte[] key, byte[] nonce, byte[] plaintext, byte[] aad)
            throws InvalidCipherTextException {
        GCMBlockCipher gcm = new GCMBlockCipher(new AESEngine());
        gcm.init(true, new AEADParameters(new KeyParameter(key), 128, nonce, aad));
        byte[] out = new byte[gcm.getOutputSize(plaintext.length)];
        int length = gcm.processBytes(plaintext, 0, plaintext.length, out, 0);
        gcm.doFinal(out, length);
        return out;
    }

    private static void assertRejected(OpenResult result) {
        assertFalse(result.isAuthentic());
        assertThat(result.getPlaintext(), nullValue());
    }

    private static byte[] flip(byte[] source, int bit) {
        byte[] result = source.clone();
        result[bit / 8] ^= (byte) (0x80 >>> (bit % 8));
        return result;
    }

    private static byte[] bytes(Random random, int length) {
        byte[] result = new byte[length];
        random.nextBytes(result);
        return result;
    }
}
