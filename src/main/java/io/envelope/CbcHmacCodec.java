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
import static io.envelope.Crypto.AES_BLOCK_SIZE;
import static io.envelope.Crypto.HMAC_SHA512;
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

import javax.crypto.BadPaddingException;
import javax.crypto.Cipher;
import javax.crypto.IllegalBlockSizeException;
import javax.crypto.SecretKey;
import javax.crypto.spec.IvParameterSpec;

/**
 * AES in CBC mode combined with HMAC-SHA-512 in an encrypt-then-MAC construction.
 * <p>
 * The encryption and MAC keys are always independent. When the credentials carry a single password, one PBKDF2
 * derivation produces both keys back to back. When they carry two passwords, each key is derived from its own
 * password with a salt extended by a distinct label byte, so the keys differ even if the passwords do not.
 * <p>
 * The tag covers the IV followed by the ciphertext in the order it was produced. On opening, the ciphertext is
 * read once, and each chunk is fed to the MAC and decrypted from the same buffer. The plaintext is held back until
 * the tag has been checked in constant time and the padding removed, so nothing is released for an envelope that
 * fails either check. A padding failure is reported exactly like a tag mismatch.
 */
final class CbcHmacCodec implements EnvelopeCodec {
    private static final RedactingLogger logger = RedactingLogger.getLogger(CbcHmacCodec.class);

    private static final byte ENCRYPTION_KEY_LABEL = 0x01;
    private static final byte MAC_KEY_LABEL = 0x02;

    private final KeyDerivation keyDerivation;
    private final int keySize;
    private final int chunkSize;
    private final long maxPlaintextLength;

    CbcHmacCodec(EnvelopeConfig config) {
        requireNonNull(config, "config");
        this.keyDerivation = new KeyDerivation(config.pbkdf2Iterations());
        this.keySize = config.keySizeBytes();
        this.chunkSize = config.chunkSizeBytes();
        this.maxPlaintextLength = config.maxPlaintextBytes();
    }

    @Override
    public EnvelopeVersion version() {
        return EnvelopeVersion.CBC_HMAC_SHA512;
    }

    @Override
    public long seal(Credentials credentials, byte[] salt, byte[] iv, InputStream in, OutputStream out)
            throws IOException {
        require(requireNonNull(salt, "salt").length == Envelope.SALT_LENGTH, "Invalid salt length");
        require(requireNonNull(iv, "iv").length == version().ivLength(), "Invalid IV length");
        requireNonNull(in, "in");

        var keys = deriveKeys(credentials, salt);
        var buffer = new byte[chunkSize];
        try {
            var cipher = initCipher(Cipher.ENCRYPT_MODE, keys[0], iv);
            var mac = new MacAccumulator(keys[1]).update(iv);
            var output = new CountingOutputStream(out);
            output.write(concat(new byte[] { version().id() }, salt, iv));

            long plaintextLength = 0;
            int n;
            while ((n = in.readNBytes(buffer, 0, chunkSize)) == chunkSize) {
                checkPlaintextLength(plaintextLength + n);
                var ciphertext = cipher.update(buffer, 0, n);
                mac.update(ciphertext);
                output.write(ciphertext);
                plaintextLength += n;
                logger.trace("Encrypted chunk, {} bytes so far", plaintextLength);
            }

            // The final chunk is short, possibly empty, and always gains between 1 and 16 bytes of padding.
            plaintextLength += n;
            checkPlaintextLength(plaintextLength);
            var lastBlocks = BlockPadder.pad(buffer, 0, n, AES_BLOCK_SIZE);
            try {
                var ciphertext = cipher.doFinal(lastBlocks);
                mac.update(ciphertext);
                output.write(ciphertext);
            } finally {
                Utils.wipe(lastBlocks);
            }

            output.write(mac.finish());
            output.flush();
            logger.debug("Sealed {} plaintext bytes into a {} byte envelope", plaintextLength,
                    output.numBytesWritten());
            return output.numBytesWritten();

        } catch (GeneralSecurityException e) {
            throw new IllegalStateException(e);
        } finally {
            Utils.wipe(buffer);
            Utils.destroy(keys);
        }
    }

    @Override
    public long open(Credentials credentials, EnvelopeSource source, OutputStream out)
            throws IOException, EnvelopeException {
        requireNonNull(out, "out");
        var version = version();
        int headerLength = version.headerLength();
        long ciphertextLength = source.size() - headerLength - version.tagLength();
        if (ciphertextLength < AES_BLOCK_SIZE || ciphertextLength % AES_BLOCK_SIZE != 0
                || ciphertextLength > maxPlaintextLength + AES_BLOCK_SIZE) {
            logger.debug("Envelope has an invalid ciphertext length: {}", ciphertextLength);
            throw new IntegrityException();
        }

        var salt = source.read(1, Envelope.SALT_LENGTH);
        var iv = source.read(1 + Envelope.SALT_LENGTH, version.ivLength());
        var tag = source.read(headerLength + ciphertextLength, version.tagLength());

        var keys = deriveKeys(credentials, salt);
        var plaintext = new ByteArrayOutputStream();
        byte[] padded = null;
        try {
            // The ciphertext is read exactly once. Each chunk is authenticated and decrypted from the same buffer.
            var mac = new MacAccumulator(keys[1]).update(iv);
            var cipher = initCipher(Cipher.DECRYPT_MODE, keys[0], iv);
            source.forEachChunk(headerLength, ciphertextLength, chunkSize, (chunk, length) -> {
                mac.update(chunk, 0, length);
                var decrypted = cipher.update(chunk, 0, length);
                if (decrypted != null) {
                    plaintext.write(decrypted, 0, decrypted.length);
                    Utils.wipe(decrypted);
                }
            });
            var last = cipher.doFinal();
            plaintext.write(last, 0, last.length);

            if (!mac.verify(tag)) {
                logger.debug("Envelope verification failed: tag mismatch");
                throw new IntegrityException();
            }

            padded = plaintext.toByteArray();
            var unpadded = BlockPadder.unpad(padded, AES_BLOCK_SIZE).orElseThrow(() -> {
                logger.debug("Envelope verification failed after tag check");
                return new IntegrityException();
            });
            try {
                out.write(unpadded);
                out.flush();
            } finally {
                Utils.wipe(unpadded);
            }

            logger.debug("Opened {} byte envelope into {} plaintext bytes", source.size(), unpadded.length);
            return unpadded.length;
        } catch (IllegalBlockSizeException | BadPaddingException e) {
            throw new IllegalStateException(e);
        } finally {
            Utils.wipe(padded);
            Utils.destroy(keys);
        }
    }

    private void checkPlaintextLength(long length) throws IOException {
        if (length > maxPlaintextLength) {
            throw new IOException("Plaintext exceeds the maximum envelope size of " + maxPlaintextLength + " bytes");
        }
    }

    private static Cipher initCipher(int mode, SecretKey key, byte[] iv) {
        var cipher = Crypto.cipher(Crypto.AES_CBC);
        try {
            cipher.init(mode, key, new IvParameterSpec(iv));
            return cipher;
        } catch (InvalidKeyException | InvalidAlgorithmParameterException e) {
            throw new IllegalArgumentException(e);
        }
    }

    /**
     * Returns the encryption key followed by the MAC key.
     */
    DestroyableSecretKey[] deriveKeys(Credentials credentials, byte[] salt) {
        requireNonNull(credentials, "credentials");
        var authenticationPassword = credentials.authenticationPassword();
        if (authenticationPassword.isEmpty()) {
            return keyDerivation.derive(credentials.encryptionPassword(), salt, 2 * keySize, AES)
                    .split(AES, keySize, HMAC_SHA512);
        }

        var encKey = keyDerivation.derive(credentials.encryptionPassword(),
                concat(salt, new byte[] { ENCRYPTION_KEY_LABEL }), keySize, AES);
        try {
            var macKey = keyDerivation.derive(authenticationPassword.get(),
                    concat(salt, new byte[] { MAC_KEY_LABEL }), keySize, HMAC_SHA512);
            return new DestroyableSecretKey[] { encKey, macKey };
        } catch (RuntimeException e) {
            encKey.destroy();
            throw e;
        }
    }
}
