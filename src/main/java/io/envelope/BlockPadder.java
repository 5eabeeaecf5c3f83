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

import java.util.Arrays;
import java.util.Optional;

/**
 * PKCS#7 padding. Between 1 and {@code blockSize} bytes are always added, each holding the number of bytes
 * added, so padding can be removed unambiguously.
 */
final class BlockPadder {

    static byte[] pad(byte[] unpadded, int blockSize) {
        return pad(unpadded, 0, unpadded.length, blockSize);
    }

    static byte[] pad(byte[] data, int offset, int length, int blockSize) {
        require(blockSize > 0 && blockSize < 256, "Block size must be between 1 and 255");
        int padLen = blockSize - (length % blockSize);
        var padded = Arrays.copyOfRange(data, offset, offset + length + padLen);
        Arrays.fill(padded, length, padded.length, (byte) padLen);
        return padded;
    }

    /**
     * Removes padding. Every byte of the final block is examined whatever its value, so the running time does not
     * reveal how many padding bytes were wrong.
     *
     * @param padded the padded data, a positive multiple of the block size.
     * @param blockSize the block size.
     * @return the unpadded data, or an empty result if the padding is invalid.
     */
    static Optional<byte[]> unpad(byte[] padded, int blockSize) {
        require(blockSize > 0 && blockSize < 256, "Block size must be between 1 and 255");
        int paddedLen = padded.length;
        if (paddedLen == 0 || paddedLen % blockSize != 0) {
            return Optional.empty();
        }

        int padLen = padded[paddedLen - 1] & 0xFF;
        // bad is non-zero if padLen is 0 or larger than the block size
        int bad = ((padLen - 1) | (blockSize - padLen)) >>> 31;
        for (int i = 1; i <= blockSize; ++i) {
            int b = padded[paddedLen - i] & 0xFF;
            // inPadding is all ones for the last padLen bytes, zero otherwise
            int inPadding = (i - padLen - 1) >> 31;
            bad |= (b ^ padLen) & inPadding;
        }

        return bad != 0 ? Optional.empty() : Optional.of(Arrays.copyOf(padded, paddedLen - padLen));
    }

    private BlockPadder() {}
}
