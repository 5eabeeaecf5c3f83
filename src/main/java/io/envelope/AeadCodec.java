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

import static io.envelope.Crypto.AES;
import static io.envelope.Utils.concat;
import static io.envelope.Utils.require;
import static java.util.Objects.requireNonNull;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.security.GeneralSecurityException;
import java.security.InvalidAlgorithmParameterException;
import java.security.InvalidKeyException;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;

/**
 * AES-GCM envelopes. A single key is derived from the encryption password and a fresh salt, so every envelope is
 * sealed under its own key and a random 12-byte nonce is never repeated under the same key. The version byte,
 * salt and nonce are authenticated as associated data. Verification happens inside the cipher as part of
 * decryption, and the plaintext is held back until it has succeeded.
 */
final class AeadCodec implements EnvelopeCodec {
    private static final RedactingLogger logger = RedactingLogger.getLogger(AeadCodec.class);

    private final KeyDerivation keyDerivation;
    private final int keySize;
    private final int chunkSize;
    private final long maxPlaintextLength;

    AeadCodec(EnvelopeConfig config) {
        requireNonNull(config, "config");
        this.keyDerivation = new KeyDerivation(config.pbkdf2Iterations());
        this.keySize = config.keySizeBytes();
        this.chunkSize = config.chunkSizeBytes();
        this.maxPlaintextLength = config.maxPlaintextBytes();
    }

    @Override
    public EnvelopeVersion version() {
        return EnvelopeVersion.AES_GCM;
    }

    @Override
    public long seal(Credentials credentials, byte[] salt, byte[] nonce, InputStream in, OutputStream out)
            throws IOException {
        require(requireNonNull(salt, "salt").length == Envelope.SALT_LENGTH, "Invalid salt length");
        require(requireNonNull(nonce, "nonce").length == version().ivLength(), "Invalid nonce length");
        requireNonNull(in, "in");

        var header = concat(new byte[] { version().id() }, salt, nonce);
        var key = deriveKey(credentials, salt);
        var buffer = new byte[chunkSize];
        try {
            var cipher = initCipher(Cipher.ENCRYPT_MODE, key, nonce, header);
            var output = new CountingOutputStream(out);
            output.write(header);

            long plaintextLength = 0;
            int n;
            while ((n = in.readNBytes(buffer, 0, chunkSize)) > 0) {
                if (plaintextLength + n > maxPlaintextLength) {
                    throw new IOException("Plaintext exceeds the maximum envelope size of " + maxPlaintextLength
                            + " bytes");
                }
                var ciphertext = cipher.update(buffer, 0, n);
                if (ciphertext != null) {
                    output.write(ciphertext);
                }
                plaintextLength += n;
                logger.trace("Encrypted chunk, {} bytes so far", plaintextLength);
            }
            // Remaining ciphertext followed by the tag
            output.write(cipher.doFinal());
            output.flush();

            logger.debug("Sealed {} plaintext bytes into a {} byte envelope", plaintextLength,
                    output.numBytesWritten());
            return output.numBytesWritten();

        } catch (GeneralSecurityException e) {
            throw new IllegalStateException(e);
        } finally {
            Utils.wipe(buffer);
            key.destroy();
        }
    }

    @Override
    public long open(Credentials credentials, EnvelopeSource source, OutputStream out)
            throws IOException, EnvelopeException {
        requireNonNull(out, "out");
        var version = version();
        int headerLength = version.headerLength();
        long ciphertextLength = source.size() - headerLength - version.tagLength();
        if (ciphertextLength < 0 || ciphertextLength > maxPlaintextLength) {
            logger.debug("Envelope has an invalid ciphertext length: {}", ciphertextLength);
            throw new IntegrityException();
        }

        var salt = source.read(1, Envelope.SALT_LENGTH);
        var nonce = source.read(1 + Envelope.SALT_LENGTH, version.ivLength());
        var header = concat(new byte[] { version.id() }, salt, nonce);

        var key = deriveKey(credentials, salt);
        var plaintext = new ByteArrayOutputStream();
        try {
            var cipher = initCipher(Cipher.DECRYPT_MODE, key, nonce, header);
            source.forEachChunk(headerLength, ciphertextLength + version.tagLength(), chunkSize,
                    (chunk, length) -> {
                        var decrypted = cipher.update(chunk, 0, length);
                        if (decrypted != null) {
                            plaintext.write(decrypted, 0, decrypted.length);
                        }
                    });
            var last = cipher.doFinal();
            plaintext.write(last, 0, last.length);
        } catch (AEADBadTagException e) {
            logger.debug("Envelope verification failed: GCM tag mismatch");
            throw new IntegrityException();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException(e);
        } finally {
            key.destroy();
        }

        plaintext.writeTo(out);
        out.flush();
        logger.debug("Opened {} byte envelope into {} plaintext bytes", source.size(), plaintext.size());
        return plaintext.size();
    }

    private DestroyableSecretKey deriveKey(Credentials credentials, byte[] salt) {
        requireNonNull(credentials, "credentials");
        return keyDerivation.derive(credentials.encryptionPassword(), salt, keySize, AES);
    }

    private static Cipher initCipher(int mode, SecretKey key, byte[] nonce, byte[] associatedData) {
        var cipher = Crypto.cipher(Crypto.AES_GCM);
        try {
            cipher.init(mode, key, new GCMParameterSpec(EnvelopeVersion.AES_GCM.tagLength() * 8, nonce));
            cipher.updateAAD(associatedData);
            return cipher;
        } catch (InvalidKeyException | InvalidAlgorithmParameterException e) {
            throw new IllegalArgumentException(e);
        }
    }
}
