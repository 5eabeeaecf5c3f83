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

import static java.util.Objects.requireNonNull;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.channels.SeekableByteChannel;
import java.util.EnumMap;
import java.util.Map;

/**
 * Seals data into password-protected envelopes and opens them again.
 * <p>
 * Sealing always uses the version this cipher was built with. Opening reads the version byte first and hands the
 * envelope to the matching codec, so a single cipher opens envelopes of every known version. An unknown version
 * byte is rejected with {@link UnsupportedVersionException} before anything else is read or any key is derived.
 * <p>
 * Both sides must use the same {@link EnvelopeConfig}: the PBKDF2 iteration count and key size are not recorded in
 * the envelope. Instances are immutable and safe to share between threads; each call works with its own keys and
 * cipher state.
 * <pre>{@code
 *   var cipher = EnvelopeCipher.aead();
 *   var envelope = cipher.seal(Credentials.of(password), data);
 *   byte[] plaintext = cipher.open(Credentials.of(password), envelope.toByteArray());
 * }</pre>
 */
public final class EnvelopeCipher {
    private static final RedactingLogger logger = RedactingLogger.getLogger(EnvelopeCipher.class);

    private final EnvelopeConfig config;
    private final EnvelopeVersion sealingVersion;
    private final Map<EnvelopeVersion, EnvelopeCodec> codecs;

    private EnvelopeCipher(EnvelopeConfig config, EnvelopeVersion sealingVersion) {
        this.config = requireNonNull(config, "config");
        this.sealingVersion = requireNonNull(sealingVersion, "version");
        this.codecs = new EnumMap<>(EnvelopeVersion.class);
        register(new CbcHmacCodec(config));
        register(new AeadCodec(config));
    }

    private void register(EnvelopeCodec codec) {
        codecs.put(codec.version(), codec);
    }

    /**
     * An AES-CBC + HMAC-SHA-512 cipher with the default configuration.
     */
    public static EnvelopeCipher cbcHmac() {
        return builder().version(EnvelopeVersion.CBC_HMAC_SHA512).build();
    }

    /**
     * An AES-GCM cipher with the default configuration.
     */
    public static EnvelopeCipher aead() {
        return builder().version(EnvelopeVersion.AES_GCM).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public EnvelopeConfig config() {
        return config;
    }

    public EnvelopeVersion sealingVersion() {
        return sealingVersion;
    }

    /**
     * Seals an in-memory plaintext.
     *
     * @param credentials the password(s) to seal under.
     * @param plaintext the data to encrypt.
     * @return the sealed envelope.
     * @throws IllegalArgumentException if the plaintext is larger than {@link EnvelopeConfig#maxPlaintextBytes()}.
     */
    public Envelope seal(Credentials credentials, byte[] plaintext) {
        requireNonNull(plaintext, "plaintext");
        Utils.require(plaintext.length <= config.maxPlaintextBytes(),
                "Plaintext exceeds the maximum envelope size of " + config.maxPlaintextBytes() + " bytes");
        var out = new ByteArrayOutputStream(
                (int) Math.min((long) plaintext.length + sealingVersion.minimumLength(), Integer.MAX_VALUE - 8));
        try {
            seal(credentials, new ByteArrayInputStream(plaintext), out);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return new Envelope(sealingVersion, out.toByteArray());
    }

    /**
     * Seals everything readable from the input stream, writing the envelope to the output stream. The input is
     * processed in chunks of {@link EnvelopeConfig#chunkSizeBytes()}, so memory use does not depend on its size.
     * Neither stream is closed. If this fails part way through, whatever was written is not a valid envelope.
     *
     * @param credentials the password(s) to seal under.
     * @param in the plaintext.
     * @param out where to write the envelope.
     * @return the number of envelope bytes written.
     * @throws IOException if reading or writing fails, or the input is larger than
     * {@link EnvelopeConfig#maxPlaintextBytes()}.
     */
    public long seal(Credentials credentials, InputStream in, OutputStream out) throws IOException {
        requireNonNull(credentials, "credentials");
        requireNonNull(out, "out");
        return codecs.get(sealingVersion).seal(credentials, in, out);
    }

    /**
     * Opens an in-memory envelope.
     *
     * @param credentials the password(s) the envelope was sealed under.
     * @param envelope the envelope bytes.
     * @return the plaintext.
     * @throws UnsupportedVersionException if the version byte is not recognised.
     * @throws IntegrityException if the envelope does not verify.
     */
    public byte[] open(Credentials credentials, byte[] envelope) throws EnvelopeException {
        requireNonNull(envelope, "envelope");
        var out = new ByteArrayOutputStream(envelope.length);
        try {
            open(credentials, EnvelopeSource.of(envelope), out);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return out.toByteArray();
    }

    public byte[] open(Credentials credentials, Envelope envelope) throws EnvelopeException {
        return open(credentials, requireNonNull(envelope, "envelope").bytes());
    }

    /**
     * Opens an envelope read from a channel, writing the plaintext to the output stream. The channel must support
     * repositioning, because the tag sits at the end of the envelope and is read before the ciphertext. Each byte
     * of ciphertext is read exactly once, and the plaintext is held in memory until the envelope verifies, so
     * nothing is written to the output stream for an envelope that fails. The channel is not closed.
     *
     * @param credentials the password(s) the envelope was sealed under.
     * @param envelope the envelope, from position 0 to the end of the channel.
     * @param out where to write the plaintext.
     * @return the number of plaintext bytes written.
     * @throws IOException if reading or writing fails.
     * @throws UnsupportedVersionException if the version byte is not recognised.
     * @throws IntegrityException if the envelope does not verify.
     */
    public long open(Credentials credentials, SeekableByteChannel envelope, OutputStream out)
            throws IOException, EnvelopeException {
        return open(credentials, EnvelopeSource.of(envelope), out);
    }

    private long open(Credentials credentials, EnvelopeSource source, OutputStream out)
            throws IOException, EnvelopeException {
        requireNonNull(credentials, "credentials");
        requireNonNull(out, "out");
        if (source.size() < 1) {
            logger.debug("Envelope is empty");
            throw new IntegrityException();
        }
        var id = source.read(0, 1)[0];
        var version = EnvelopeVersion.fromId(id).orElseThrow(() -> {
            logger.debug("Rejecting envelope with unknown version byte {}", id & 0xFF);
            return new UnsupportedVersionException(id);
        });
        if (source.size() < version.minimumLength()) {
            logger.debug("Envelope is too short for {}: {} bytes", version, source.size());
            throw new IntegrityException();
        }
        return codecs.get(version).open(credentials, source, out);
    }

    public static final class Builder {
        private EnvelopeConfig config = EnvelopeConfig.defaults();
        private EnvelopeVersion version = EnvelopeVersion.AES_GCM;

        private Builder() {}

        public Builder config(EnvelopeConfig config) {
            this.config = requireNonNull(config, "config");
            return this;
        }

        /**
         * Sets the envelope version used for sealing. Defaults to {@link EnvelopeVersion#AES_GCM}.
         */
        public Builder version(EnvelopeVersion version) {
            this.version = requireNonNull(version, "version");
            return this;
        }

        public EnvelopeCipher build() {
            return new EnvelopeCipher(config, version);
        }
    }
}
