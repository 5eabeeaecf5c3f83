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

import static java.util.Objects.checkFromIndexSize;
import static java.util.Objects.requireNonNull;

import java.util.Arrays;

import javax.crypto.SecretKey;

/**
 * Key material derived for a single seal or open call. Unlike {@link javax.crypto.spec.SecretKeySpec}, the
 * {@link #destroy()} method scrubs the key bytes from memory, so every codec destroys its keys once the call
 * completes.
 */
final class DestroyableSecretKey implements SecretKey {

    private final String algorithm;
    private final byte[] keyMaterial;
    private volatile boolean destroyed = false;

    DestroyableSecretKey(String algorithm, byte[] keyMaterial, int offset, int length) {
        this.algorithm = requireNonNull(algorithm, "algorithm");
        checkFromIndexSize(offset, length, requireNonNull(keyMaterial, "keyMaterial").length);
        this.keyMaterial = Arrays.copyOfRange(keyMaterial, offset, offset + length);
    }

    DestroyableSecretKey(String algorithm, byte[] keyMaterial) {
        this(algorithm, keyMaterial, 0, requireNonNull(keyMaterial).length);
    }

    /**
     * Splits this key into two independent keys of the given algorithms. The first key takes the leading
     * {@code firstLength} bytes and the second key the remainder. This key is destroyed afterwards.
     */
    DestroyableSecretKey[] split(String firstAlgorithm, int firstLength, String secondAlgorithm) {
        checkDestroyed();
        Utils.require(firstLength > 0 && firstLength < keyMaterial.length, "Invalid split point");
        try {
            return new DestroyableSecretKey[] {
                    new DestroyableSecretKey(firstAlgorithm, keyMaterial, 0, firstLength),
                    new DestroyableSecretKey(secondAlgorithm, keyMaterial, firstLength,
                            keyMaterial.length - firstLength)
            };
        } finally {
            destroy();
        }
    }

    @Override
    public String getAlgorithm() {
        return algorithm;
    }

    @Override
    public String getFormat() {
        return "RAW";
    }

    @Override
    public byte[] getEncoded() {
        checkDestroyed();
        return keyMaterial.clone();
    }

    @Override
    public void destroy() {
        destroyed = true;
        Utils.wipe(keyMaterial);
    }

    @Override
    public boolean isDestroyed() {
        return destroyed;
    }

    @Override
    public boolean equals(Object other) {
        checkDestroyed();
        if (this == other) { return true; }
        if (!(other instanceof DestroyableSecretKey)) { return false; }
        DestroyableSecretKey that = (DestroyableSecretKey) other;
        return algorithm.equals(that.algorithm) && Crypto.constantTimeEquals(keyMaterial, that.keyMaterial);
    }

    @Override
    public int hashCode() {
        // Must not depend on the key bytes.
        return algorithm.hashCode() * 31 + keyMaterial.length;
    }

    @Override
    public String toString() {
        return "DestroyableSecretKey{" +
                "algorithm='" + algorithm + '\'' +
                ", bits=" + keyMaterial.length * 8 +
                ", destroyed=" + destroyed +
                '}';
    }

    private void checkDestroyed() {
        if (destroyed) {
            throw new IllegalStateException("Key material has been destroyed");
        }
    }
}
