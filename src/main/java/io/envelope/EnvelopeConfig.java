/*
 * Copyright 2022 Neil Madden.
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may not use this file except
 * in compliance with the License. You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software distributed under the License
 * is distributed on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express
 * or implied. See the License for the specific language governing permissions and limitations under
 * the License.
 *
 */

package io.envelope;

import static io.envelope.Utils.require;
import static java.util.Objects.requireNonNull;

import java.util.Properties;

/**
 * Tunable parameters shared by both envelope codecs. Instances are immutable and validated when built.
 * <ul>
 *     <li>{@code pbkdf2Iterations}: PBKDF2 work factor, at least {@value #MIN_PBKDF2_ITERATIONS}. Raise it as
 *     hardware improves; the value is not stored in the envelope, so the opener must use the same setting.</li>
 *     <li>{@code keySizeBytes}: AES key size, 16, 24 or 32 bytes. The CBC variant derives an HMAC key of the same
 *     size.</li>
 *     <li>{@code chunkSizeBytes}: amount of data processed per step when streaming. Must be a positive multiple
 *     of the AES block size.</li>
 *     <li>{@code maxPlaintextBytes}: largest plaintext that may be sealed. Opening holds the plaintext in memory
 *     until it has been verified, so this bounds the memory used by an open call and is capped at
 *     {@value #MAX_PLAINTEXT_BYTES} bytes.</li>
 * </ul>
 */
public final class EnvelopeConfig {
    public static final int MIN_PBKDF2_ITERATIONS = 310_000;
    public static final int DEFAULT_KEY_SIZE_BYTES = 32;
    public static final int DEFAULT_CHUNK_SIZE_BYTES = 1024 * 1024;
    static final int MAX_CHUNK_SIZE_BYTES = 64 * 1024 * 1024;
    public static final int MAX_PLAINTEXT_BYTES = Integer.MAX_VALUE - 64;

    static final String ITERATIONS_PROPERTY = "envelope.pbkdf2.iterations";
    static final String KEY_SIZE_PROPERTY = "envelope.key.size";
    static final String CHUNK_SIZE_PROPERTY = "envelope.chunk.size";
    static final String MAX_PLAINTEXT_PROPERTY = "envelope.max.plaintext.size";

    private static final EnvelopeConfig DEFAULTS = builder().build();

    private final int pbkdf2Iterations;
    private final int keySizeBytes;
    private final int chunkSizeBytes;
    private final int maxPlaintextBytes;

    private EnvelopeConfig(Builder builder) {
        this.pbkdf2Iterations = builder.pbkdf2Iterations;
        this.keySizeBytes = builder.keySizeBytes;
        this.chunkSizeBytes = builder.chunkSizeBytes;
        this.maxPlaintextBytes = builder.maxPlaintextBytes;
    }

    public static EnvelopeConfig defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads a configuration from the given properties. Missing keys fall back to the defaults.
     *
     * @param properties the properties to read.
     * @return the validated configuration.
     * @throws IllegalArgumentException if a value is not a number or fails validation.
     */
    public static EnvelopeConfig fromProperties(Properties properties) {
        requireNonNull(properties, "properties");
        return builder()
                .pbkdf2Iterations(intProperty(properties, ITERATIONS_PROPERTY, MIN_PBKDF2_ITERATIONS))
                .keySizeBytes(intProperty(properties, KEY_SIZE_PROPERTY, DEFAULT_KEY_SIZE_BYTES))
                .chunkSizeBytes(intProperty(properties, CHUNK_SIZE_PROPERTY, DEFAULT_CHUNK_SIZE_BYTES))
                .maxPlaintextBytes(intProperty(properties, MAX_PLAINTEXT_PROPERTY, MAX_PLAINTEXT_BYTES))
                .build();
    }

    private static int intProperty(Properties properties, String name, int defaultValue) {
        var value = properties.getProperty(name);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + name + ": " + value, e);
        }
    }

    public int pbkdf2Iterations() {
        return pbkdf2Iterations;
    }

    public int keySizeBytes() {
        return keySizeBytes;
    }

    public int chunkSizeBytes() {
        return chunkSizeBytes;
    }

    public int maxPlaintextBytes() {
        return maxPlaintextBytes;
    }

    @Override
    public String toString() {
        return "EnvelopeConfig{" +
                "pbkdf2Iterations=" + pbkdf2Iterations +
                ", keySizeBytes=" + keySizeBytes +
                ", chunkSizeBytes=" + chunkSizeBytes +
                ", maxPlaintextBytes=" + maxPlaintextBytes +
                '}';
    }

    public static final class Builder {
        private int pbkdf2Iterations = MIN_PBKDF2_ITERATIONS;
        private int keySizeBytes = DEFAULT_KEY_SIZE_BYTES;
        private int chunkSizeBytes = DEFAULT_CHUNK_SIZE_BYTES;
        private int maxPlaintextBytes = MAX_PLAINTEXT_BYTES;

        private Builder() {}

        public Builder pbkdf2Iterations(int iterations) {
            this.pbkdf2Iterations = iterations;
            return this;
        }

        public Builder keySizeBytes(int keySizeBytes) {
            this.keySizeBytes = keySizeBytes;
            return this;
        }

        public Builder chunkSizeBytes(int chunkSizeBytes) {
            this.chunkSizeBytes = chunkSizeBytes;
            return this;
        }

        public Builder maxPlaintextBytes(int maxPlaintextBytes) {
            this.maxPlaintextBytes = maxPlaintextBytes;
            return this;
        }

        public EnvelopeConfig build() {
            require(pbkdf2Iterations >= MIN_PBKDF2_ITERATIONS,
                    "PBKDF2 iterations must be at least " + MIN_PBKDF2_ITERATIONS);
            require(keySizeBytes == 16 || keySizeBytes == 24 || keySizeBytes == 32,
                    "Key size must be 16, 24 or 32 bytes");
            require(chunkSizeBytes > 0 && chunkSizeBytes <= MAX_CHUNK_SIZE_BYTES,
                    "Chunk size must be between 1 and " + MAX_CHUNK_SIZE_BYTES + " bytes");
            require(chunkSizeBytes % Crypto.AES_BLOCK_SIZE == 0,
                    "Chunk size must be a multiple of " + Crypto.AES_BLOCK_SIZE);
            require(maxPlaintextBytes > 0 && maxPlaintextBytes <= MAX_PLAINTEXT_BYTES,
                    "Maximum plaintext size must be between 1 and " + MAX_PLAINTEXT_BYTES + " bytes");
            return new EnvelopeConfig(this);
        }
    }
}
