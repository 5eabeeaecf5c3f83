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

import java.util.Optional;

/**
 * The envelope formats understood by this library, identified by the first byte of every envelope. The layout of
 * each is {@code version ‖ salt ‖ iv ‖ ciphertext ‖ tag} with all fields except the ciphertext of fixed size.
 */
public enum EnvelopeVersion {
    /**
     * AES in CBC mode with PKCS#7 padding, authenticated with HMAC-SHA-512 over the IV and ciphertext
     * (encrypt-then-MAC). 16-byte IV, 64-byte tag.
     */
    CBC_HMAC_SHA512(0x01, 16, MacAccumulator.TAG_SIZE, Crypto.AES_BLOCK_SIZE),
    /**
     * AES-GCM with a 12-byte nonce and a 16-byte tag. The version, salt and nonce are bound as associated data.
     */
    AES_GCM(0x02, 12, 16, 0);

    private final byte id;
    private final int ivLength;
    private final int tagLength;
    private final int minCiphertextLength;

    EnvelopeVersion(int id, int ivLength, int tagLength, int minCiphertextLength) {
        this.id = (byte) id;
        this.ivLength = ivLength;
        this.tagLength = tagLength;
        this.minCiphertextLength = minCiphertextLength;
    }

    public byte id() {
        return id;
    }

    public int ivLength() {
        return ivLength;
    }

    public int tagLength() {
        return tagLength;
    }

    /**
     * The length of the version byte, salt and IV/nonce together.
     */
    public int headerLength() {
        return 1 + Envelope.SALT_LENGTH + ivLength;
    }

    /**
     * The smallest number of bytes a well-formed envelope of this version can have.
     */
    public int minimumLength() {
        return headerLength() + minCiphertextLength + tagLength;
    }

    public static Optional<EnvelopeVersion> fromId(byte id) {
        for (var version : values()) {
            if (version.id == id) {
                return Optional.of(version);
            }
        }
        return Optional.empty();
    }
}
