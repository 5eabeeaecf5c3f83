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

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * One envelope format. A codec is stateless: every call derives its own keys, creates its own cipher and MAC
 * instances and destroys the keys before returning, so a single codec may serve concurrent calls.
 */
interface EnvelopeCodec {

    /**
     * The version byte this codec writes and reads.
     */
    EnvelopeVersion version();

    /**
     * Seals the input stream with a fresh random salt and IV/nonce.
     *
     * @return the number of envelope bytes written.
     */
    default long seal(Credentials credentials, InputStream in, OutputStream out) throws IOException {
        return seal(credentials, Crypto.randomBytes(Envelope.SALT_LENGTH),
                Crypto.randomBytes(version().ivLength()), in, out);
    }

    /**
     * Seals the input stream using the given salt and IV/nonce, which must never have been used before. Reads the
     * input in chunks until end of stream and writes the complete envelope to the output. Neither stream is
     * closed.
     *
     * @return the number of envelope bytes written.
     */
    long seal(Credentials credentials, byte[] salt, byte[] iv, InputStream in, OutputStream out) throws IOException;

    /**
     * Verifies and decrypts an envelope whose version byte has already been checked. Nothing is written to the
     * output unless the whole envelope verifies.
     *
     * @return the number of plaintext bytes written.
     * @throws IntegrityException if verification fails for any reason.
     */
    long open(Credentials credentials, EnvelopeSource source, OutputStream out)
            throws IOException, EnvelopeException;
}
