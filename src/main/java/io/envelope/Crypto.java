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

import java.security.NoSuchAlgorithmException;

import javax.crypto.Cipher;
import javax.crypto.Mac;
import javax.crypto.NoSuchPaddingException;

import software.pando.crypto.nacl.Bytes;

final class Crypto {
    static final String AES = "AES";
    static final String AES_CBC = "AES/CBC/NoPadding";
    static final String AES_GCM = "AES/GCM/NoPadding";
    static final String HMAC_SHA512 = "HmacSHA512";
    static final int AES_BLOCK_SIZE = 16;

    static Cipher cipher(String transformation) {
        try {
            return Cipher.getInstance(transformation);
        } catch (NoSuchAlgorithmException | NoSuchPaddingException e) {
            throw new AssertionError("JVM doesn't support " + transformation, e);
        }
    }

    static Mac mac(String algorithm) {
        try {
            return Mac.getInstance(algorithm);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        }
    }

    static byte[] randomBytes(int numBytes) {
        return Bytes.secureRandom(numBytes);
    }

    /**
     * Compares two byte arrays in time that depends only on their lengths, never on the position of the first
     * differing byte.
     */
    static boolean constantTimeEquals(byte[] a, byte[] b) {
        return a.length == b.length && Bytes.equal(a, b);
    }

    private Crypto() {}
}
