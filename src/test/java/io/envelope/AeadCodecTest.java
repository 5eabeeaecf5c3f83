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

import static io.envelope.Utils.concat;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.security.GeneralSecurityException;
import java.util.Random;

import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;

import org.testng.annotations.Test;

public class AeadCodecTest {
    private static final String PASSWORD = "open sesame";
    private static final Credentials CREDENTIALS = Credentials.of(PASSWORD.toCharArray());
    private static final int MIB = 1024 * 1024;

    private final AeadCodec codec = new AeadCodec(EnvelopeConfig.defaults());

    @Test
    public void shouldSealTenMebibytesWithoutPadding() throws Exception {
        var plaintext = new byte[10 * MIB];
        new Random(42).nextBytes(plaintext);

        var envelope = seal(codec, CREDENTIALS, plaintext);

        assertThat(envelope).hasSize(1 + 16 + 12 + 10 * MIB + 16);
        var parsed = Envelope.parse(envelope);
        assertThat(parsed.version()).isEqualTo(EnvelopeVersion.AES_GCM);
        assertThat(parsed.iv()).hasSize(12);
        assertThat(parsed.ciphertext()).hasSize(10 * MIB);
        assertThat(parsed.tag()).hasSize(16);
        assertThat(open(codec, CREDENTIALS, envelope)).isEqualTo(plaintext);
    }

    @Test
    public void shouldSealEmptyPlaintextAsHeaderAndTag() throws Exception {
        var envelope = seal(codec, CREDENTIALS, new byte[0]);

        assertThat(envelope).hasSize(1 + 16 + 12 + 16);
        assertThat(envelope[0]).isEqualTo((byte) 0x02);
        assertThat(open(codec, CREDENTIALS, envelope)).isEmpty();
    }

    @Test
    public void shouldRoundTripWithSmallChunks() throws Exception {
        var smallChunks = new AeadCodec(EnvelopeConfig.builder().chunkSizeBytes(32).build());
        var plaintext = Crypto.randomBytes(1001);

        var envelope = seal(smallChunks, CREDENTIALS, plaintext);

        assertThat(envelope).hasSize(1 + 16 + 12 + 1001 + 16);
        assertThat(open(smallChunks, CREDENTIALS, envelope)).isEqualTo(plaintext);
        assertThat(open(codec, CREDENTIALS, envelope)).isEqualTo(plaintext);
    }

    @Test
    public void shouldAuthenticateHeaderAsAssociatedData() throws Exception {
        var salt = Crypto.randomBytes(16);
        var nonce = Crypto.randomBytes(12);
        var payload = "payload".getBytes(UTF_8);
        var out = new ByteArrayOutputStream();
        codec.seal(CREDENTIALS, salt, nonce, new ByteArrayInputStream(payload), out);

        var key = new KeyDerivation(EnvelopeConfig.MIN_PBKDF2_ITERATIONS)
                .derive(PASSWORD.toCharArray(), salt, 32, "AES");
        var header = concat(new byte[] { 0x02 }, salt, nonce);
        assertThat(out.toByteArray()).isEqualTo(concat(header, gcm(key, nonce, header, payload)));

        // Same key and nonce, but authenticated under a different version byte.
        var otherHeader = concat(new byte[] { 0x03 }, salt, nonce);
        var forged = concat(header, gcm(key, nonce, otherHeader, payload));

        var plaintext = new ByteArrayOutputStream();
        assertThatThrownBy(() -> codec.open(CREDENTIALS, EnvelopeSource.of(forged), plaintext))
                .isInstanceOf(IntegrityException.class);
        assertThat(plaintext.size()).isZero();
    }

    @Test
    public void shouldNotReleasePlaintextWhenTagIsWrong() throws Exception {
        var envelope = seal(codec, CREDENTIALS, Crypto.randomBytes(4096));
        envelope[envelope.length - 1] ^= 0x01;

        var out = new ByteArrayOutputStream();
        assertThatThrownBy(() -> codec.open(CREDENTIALS, EnvelopeSource.of(envelope), out))
                .isInstanceOf(IntegrityException.class)
                .hasMessage(IntegrityException.MESSAGE);
        assertThat(out.size()).isZero();
    }

    @Test
    public void shouldIgnoreAuthenticationPassword() throws Exception {
        var plaintext = "only one key".getBytes(UTF_8);

        var envelope = seal(codec, Credentials.of("pw".toCharArray(), "unused".toCharArray()), plaintext);

        assertThat(open(codec, Credentials.of("pw".toCharArray()), envelope)).isEqualTo(plaintext);
    }

    @Test
    public void shouldRejectTruncatedEnvelope() {
        var envelope = new byte[1 + 16 + 12 + 15];
        envelope[0] = 0x02;

        assertThatThrownBy(() -> open(codec, CREDENTIALS, envelope)).isInstanceOf(IntegrityException.class);
    }

    private static byte[] seal(EnvelopeCodec codec, Credentials credentials, byte[] plaintext) throws IOException {
        var out = new ByteArrayOutputStream();
        codec.seal(credentials, new ByteArrayInputStream(plaintext), out);
        return out.toByteArray();
    }

    private static byte[] open(EnvelopeCodec codec, Credentials credentials, byte[] envelope) throws Exception {
        var out = new ByteArrayOutputStream();
        var written = codec.open(credentials, EnvelopeSource.of(envelope), out);
        assertThat(written).isEqualTo(out.size());
        return out.toByteArray();
    }

    private static byte[] gcm(SecretKey key, byte[] nonce, byte[] associatedData, byte[] plaintext)
            throws GeneralSecurityException {
        var cipher = Cipher.getInstance("AES/GCM/NoPadding");
        cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(128, nonce));
        cipher.updateAAD(associatedData);
        return cipher.doFinal(plaintext);
    }
}
