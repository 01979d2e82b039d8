/*
 * Copyright (c) 2017 Sergey Chernov, iCodici S.n.C, All Rights Reserved
 *
 * Written by Sergey Chernov <real.sergeych@gmail.com>, August 2017.
 *
 */

package com.icodici.aead;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * {@link AesGcm} settings. Usually loaded from YAML:
 * <pre>
 * nonce_policy: track        # or caller
 * max_tracked_nonces: 100000
 * </pre>
 * Missing keys take defaults, unknown keys are an error.
 */
public final class AeadConfig {

    public static final String RESOURCE = "aead.yml";
    public static final int DEFAULT_MAX_TRACKED_NONCES = 1 << 20;

    private static final Logger log = LoggerFactory.getLogger(AeadConfig.class);

    private static final AeadConfig DEFAULTS = new AeadConfig(NoncePolicy.CALLER,
                                                              DEFAULT_MAX_TRACKED_NONCES);

    private final NoncePolicy noncePolicy;
    private final int maxTrackedNonces;

    public AeadConfig(NoncePolicy noncePolicy, int maxTrackedNonces) {
        if (maxTrackedNonces <= 0)
            throw new IllegalArgumentException("max_tracked_nonces must be positive: " + maxTrackedNonces);
        this.noncePolicy = noncePolicy;
        this.maxTrackedNonces = maxTrackedNonces;
    }

    /**
     * Caller-managed nonces, see {@link NoncePolicy#CALLER}.
     */
    public static AeadConfig defaults() {
        return DEFAULTS;
    }

    /**
     * Load {@value #RESOURCE} from the classpath, or return {@link #defaults()} if there is none.
     */
    public static AeadConfig load() {
        try (InputStream in = AeadConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in == null) {
                log.debug("no {} on the classpath, using defaults", RESOURCE);
                return defaults();
            }
            log.debug("loading {} from the classpath", RESOURCE);
            return fromYaml(in);
        } catch (IOException e) {
            throw new IllegalStateException("failed to read " + RESOURCE, e);
        }
    }

    public static AeadConfig fromFile(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            log.debug("loading configuration from {}", path);
            return fromYaml(in);
        }
    }

    /**
     * Parse YAML document. An empty document yields {@link #defaults()}.
     *
     * @throws IllegalArgumentException if the document is not a mapping or has bad values
     */
    public static AeadConfig fromYaml(InputStream in) {
        Object root = new Yaml().load(in);
        if (root == null)
            return defaults();
        if (!(root instanceof Map))
            throw new IllegalArgumentException("configuration must be a YAML mapping");
        return fromMap((Map<?, ?>) root);
    }

    public static AeadConfig fromMap(Map<?, ?> settings) {
        NoncePolicy policy = DEFAULTS.noncePolicy;
        int maxTracked = DEFAULTS.maxTrackedNonces;
        for (Map.Entry<?, ?> e : settings.entrySet()) {
            if (!(e.getKey() instanceof String))
                throw new IllegalArgumentException("configuration key must be a string: " + e.getKey());
            Object value = e.getValue();
            switch ((String) e.getKey()) {
                case "nonce_policy":
                    if (value == null)
                        throw new IllegalArgumentException("nonce_policy must not be empty");
                    policy = NoncePolicy.fromName(value.toString());
                    break;
                case "max_tracked_nonces":
                    if (!(value instanceof Integer || value instanceof Long))
                        throw new IllegalArgumentException("max_tracked_nonces must be an integer: " + value);
                    long n = ((Number) value).longValue();
                    if (n > Integer.MAX_VALUE || n < Integer.MIN_VALUE)
                        throw new IllegalArgumentException("max_tracked_nonces is out of range: " + n);
                    maxTracked = (int) n;
                    break;
                default:
                    throw new IllegalArgumentException("unknown configuration key: " + e.getKey());
            }
        }
        return new AeadConfig(policy, maxTracked);
    }

    public NoncePolicy getNoncePolicy() {
        return noncePolicy;
    }

    public int getMaxTrackedNonces() {
        return maxTrackedNonces;
    }

    public AeadConfig withNoncePolicy(NoncePolicy policy) {
        return new AeadConfig(policy, maxTrackedNonces);
    }

    public AeadConfig withMaxTrackedNonces(int maxTrackedNonces) {
        return new AeadConfig(noncePolicy, maxTrackedNonces);
    }

    @Override
    public String toString() {
        return "AeadConfig(nonce_policy=" + noncePolicy.name().toLowerCase()
                + ", max_tracked_nonces=" + maxTrackedNonces + ")";
    }
}
