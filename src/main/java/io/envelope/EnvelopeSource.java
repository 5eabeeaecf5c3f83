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

import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.SeekableByteChannel;

/**
 * Random-access view of a sealed envelope. The codecs read the header and tag by position and then walk the
 * ciphertext once, in order.
 */
abstract class EnvelopeSource {

    abstract long size() throws IOException;

    /**
     * Fills {@code dst} from the given absolute position.
     *
     * @throws EOFException if the source ends first.
     */
    abstract void readFully(long position, ByteBuffer dst) throws IOException;

    byte[] read(long position, int length) throws IOException {
        var bytes = new byte[length];
        readFully(position, ByteBuffer.wrap(bytes));
        return bytes;
    }

    /**
     * Reads {@code length} bytes starting at {@code position} in sequential chunks of at most {@code chunkSize}
     * bytes, passing each one to the consumer in order. The chunk buffer is reused between calls.
     */
    void forEachChunk(long position, long length, int chunkSize, ChunkConsumer consumer) throws IOException {
        require(chunkSize > 0, "Chunk size must be positive");
        var buffer = new byte[(int) Math.min(chunkSize, Math.max(length, 1))];
        long remaining = length;
        long offset = position;
        try {
            while (remaining > 0) {
                int n = (int) Math.min(buffer.length, remaining);
                readFully(offset, ByteBuffer.wrap(buffer, 0, n));
                consumer.accept(buffer, n);
                offset += n;
                remaining -= n;
            }
        } finally {
            Utils.wipe(buffer);
        }
    }

    @FunctionalInterface
    interface ChunkConsumer {
        void accept(byte[] chunk, int length) throws IOException;
    }

    static EnvelopeSource of(byte[] data) {
        return new ByteArraySource(requireNonNull(data, "data"));
    }

    static EnvelopeSource of(SeekableByteChannel channel) {
        return new ChannelSource(requireNonNull(channel, "channel"));
    }

    private static final class ByteArraySource extends EnvelopeSource {
        private final byte[] data;

        ByteArraySource(byte[] data) {
            this.data = data;
        }

        @Override
        long size() {
            return data.length;
        }

        @Override
        void readFully(long position, ByteBuffer dst) throws IOException {
            if (position < 0 || position + dst.remaining() > data.length) {
                throw new EOFException();
            }
            dst.put(data, (int) position, dst.remaining());
        }
    }

    private static final class ChannelSource extends EnvelopeSource {
        private final SeekableByteChannel channel;

        ChannelSource(SeekableByteChannel channel) {
            this.channel = channel;
        }

        @Override
        long size() throws IOException {
            return channel.size();
        }

        @Override
        void readFully(long position, ByteBuffer dst) throws IOException {
            channel.position(position);
            while (dst.hasRemaining()) {
                if (channel.read(dst) < 0) {
                    throw new EOFException();
                }
            }
        }
    }
}
