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

import java.util.Arrays;

/**
 * An immutable, sealed envelope held in memory. The binary layout is:
 * <pre>{@code
 *   version (1) ‖ salt (16) ‖ iv/nonce (16 or 12) ‖ ciphertext (variable) ‖ tag (64 or 16)
 * }</pre>
 * There are no length prefixes or delimiters; the ciphertext length is whatever remains once the fixed-size fields
 * have been accounted for. All accessors return copies.
 * <p>
 * Parsing an envelope only checks its structure. Its contents are authenticated when it is opened with
 * {@link EnvelopeCipher#open(Credentials, Envelope)}.
 */
public final class Envelope {
    public static final int SALT_LENGTH = 16;

    private final EnvelopeVersion version;
    private final byte[] bytes;

    Envelope(EnvelopeVersion version, byte[] bytes) {
        this.version = requireNonNull(version);
        this.bytes = requireNonNull(bytes);
    }

    /**
     * Parses an envelope from its binary form. The version byte is checked before anything else.
     *
     * @param data the envelope bytes. The array is copied.
     * @return the parsed envelope.
     * @throws UnsupportedVersionException if the version byte is not recognised.
     * @throws IntegrityException if the data is too short to be an envelope of that version.
     */
    public static Envelope parse(byte[] data) throws EnvelopeException {
        requireNonNull(data, "data");
        if (data.length == 0) {
            throw new IntegrityException();
        }
        var version = EnvelopeVersion.fromId(data[0])
                .orElseThrow(() -> new UnsupportedVersionException(data[0]));
        if (data.length < version.minimumLength()) {
            throw new IntegrityException();
        }
        return new Envelope(version, data.clone());
    }

    public EnvelopeVersion version() {
        return version;
    }

    public byte[] salt() {
        return Arrays.copyOfRange(bytes, 1, 1 + SALT_LENGTH);
    }

    public byte[] iv() {
        return Arrays.copyOfRange(bytes, 1 + SALT_LENGTH, version.headerLength());
    }

    public byte[] ciphertext() {
        return Arrays.copyOfRange(bytes, version.headerLength(), bytes.length - version.tagLength());
    }

    public byte[] tag() {
        return Arrays.copyOfRange(bytes, bytes.length - version.tagLength(), bytes.length);
    }

    public int length() {
        return bytes.length;
    }

    public byte[] toByteArray() {
        return bytes.clone();
    }

    byte[] bytes() {
        return bytes;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) { return true; }
        if (!(other instanceof Envelope)) { return false; }
        Envelope that = (Envelope) other;
        return version == that.version && Arrays.equals(bytes, that.bytes);
    }

    @Override
    public int hashCode() {
        return 31 * version.hashCode() + Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return "Envelope{" +
                "version=" + version +
                ", length=" + bytes.length +
                '}';
    }
}
