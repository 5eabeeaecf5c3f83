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

import java.security.NoSuchAlgorithmException;
import java.security.spec.InvalidKeySpecException;

import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.PBEKeySpec;

/**
 * Stretches a low-entropy password and a random salt into key material using PBKDF2 with HMAC-SHA-256. The
 * output is deterministic for a given password, salt, length and iteration count. Derived keys are never cached
 * or logged; the caller owns the returned key and must destroy it.
 */
final class KeyDerivation {
    static final String ALGORITHM = "PBKDF2WithHmacSHA256";
    static final int MIN_SALT_LENGTH = 16;

    private final int iterations;

    KeyDerivation(int iterations) {
        require(iterations > 0, "Iteration count must be positive");
        this.iterations = iterations;
    }

    /**
     * Derives {@code outputLength} bytes of key material.
     *
     * @param password the password. It is not modified.
     * @param salt a random salt of at least {@value #MIN_SALT_LENGTH} bytes.
     * @param outputLength the number of bytes to derive.
     * @param algorithm the JCA algorithm name to label the resulting key with.
     * @return the derived key.
     * @throws IllegalArgumentException if the salt is too short, the password is empty or the output length is
     * not positive.
     */
    DestroyableSecretKey derive(char[] password, byte[] salt, int outputLength, String algorithm) {
        require(requireNonNull(password, "password").length > 0, "Password must not be empty");
        require(requireNonNull(salt, "salt").length >= MIN_SALT_LENGTH,
                "Salt must be at least " + MIN_SALT_LENGTH + " bytes");
        require(outputLength > 0, "Output length must be positive");

        var spec = new PBEKeySpec(password, salt, iterations, outputLength * 8);
        byte[] keyBytes = null;
        try {
            var factory = SecretKeyFactory.getInstance(ALGORITHM);
            keyBytes = factory.generateSecret(spec).getEncoded();
            return new DestroyableSecretKey(algorithm, keyBytes);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("JVM doesn't support " + ALGORITHM, e);
        } catch (InvalidKeySpecException e) {
            throw new IllegalArgumentException(e);
        } finally {
            spec.clearPassword();
            Utils.wipe(keyBytes);
        }
    }
}
