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

import java.security.InvalidKeyException;

import javax.crypto.Mac;
import javax.crypto.SecretKey;

/**
 * Computes an HMAC-SHA-512 tag incrementally over data that arrives in pieces. The order of the pieces is part of
 * what is authenticated: the CBC codec feeds the IV first and then each ciphertext chunk in the order it was
 * produced. An accumulator computes a single tag and cannot be reused.
 */
final class MacAccumulator {
    static final int TAG_SIZE = 64;

    private final Mac mac;
    private boolean finished = false;

    MacAccumulator(SecretKey macKey) {
        this.mac = Crypto.mac(Crypto.HMAC_SHA512);
        try {
            mac.init(requireNonNull(macKey, "macKey"));
        } catch (InvalidKeyException e) {
            throw new IllegalArgumentException(e);
        }
    }

    MacAccumulator update(byte[] data) {
        return update(data, 0, data.length);
    }

    MacAccumulator update(byte[] data, int offset, int length) {
        checkNotFinished();
        mac.update(data, offset, length);
        return this;
    }

    /**
     * Completes the computation and returns the 64-byte tag.
     */
    byte[] finish() {
        checkNotFinished();
        finished = true;
        return mac.doFinal();
    }

    /**
     * Completes the computation and compares the result against the expected tag in constant time.
     *
     * @param expectedTag the tag read from the envelope.
     * @return whether the tags match.
     */
    boolean verify(byte[] expectedTag) {
        var computed = finish();
        try {
            return Crypto.constantTimeEquals(computed, requireNonNull(expectedTag, "expectedTag"));
        } finally {
            Utils.wipe(computed);
        }
    }

    private void checkNotFinished() {
        if (finished) {
            throw new IllegalStateException("MAC has already been finished");
        }
    }
}
