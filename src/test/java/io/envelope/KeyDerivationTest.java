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

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.HexFormat;

import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

public class KeyDerivationTest {
    private static final char[] PASSWORD = "correct horse battery staple".toCharArray();

    // Low iteration count so the tests stay fast; the configured minimum is enforced by EnvelopeConfig.
    private final KeyDerivation kdf = new KeyDerivation(1000);

    @Test
    public void shouldMatchKnownPbkdf2HmacSha256Output() {
        var kdf = new KeyDerivation(4096);
        var salt = "saltSALTsaltSALTsaltSALTsaltSALTsalt".getBytes(UTF_8);

        var key = kdf.derive("passwordPASSWORDpassword".toCharArray(), salt, 40, "AES");

        assertThat(HexFormat.of().formatHex(key.getEncoded()))
                .isEqualTo("348c89dbcbd32b2f32d814b8116e84cf2b17347ebc1800181c4e2a1fb8dd53e1c635518c7dac47e9");
    }

    @Test
    public void shouldBeDeterministic() {
        var salt = Crypto.randomBytes(16);

        var first = kdf.derive(PASSWORD, salt, 32, "AES");
        var second = kdf.derive(PASSWORD, salt, 32, "AES");

        assertThat(first).isEqualTo(second);
        assertThat(first.getAlgorithm()).isEqualTo("AES");
        assertThat(first.getEncoded()).hasSize(32);
    }

    @Test
    public void shouldDependOnSaltAndPassword() {
        var salt = Crypto.randomBytes(16);
        var otherSalt = Crypto.randomBytes(16);

        var key = kdf.derive(PASSWORD, salt, 32, "AES");

        assertThat(kdf.derive(PASSWORD, otherSalt, 32, "AES")).isNotEqualTo(key);
        assertThat(kdf.derive("Tr0ub4dor&3".toCharArray(), salt, 32, "AES")).isNotEqualTo(key);
    }

    @Test
    public void shouldDependOnIterationCount() {
        var salt = Crypto.randomBytes(16);

        var key = kdf.derive(PASSWORD, salt, 32, "AES");

        assertThat(new KeyDerivation(1001).derive(PASSWORD, salt, 32, "AES")).isNotEqualTo(key);
    }

    @Test
    public void shouldNotModifyPassword() {
        var password = PASSWORD.clone();

        kdf.derive(password, Crypto.randomBytes(16), 16, "AES");

        assertThat(password).isEqualTo(PASSWORD);
    }

    @DataProvider
    public Object[][] outputLengths() {
        return new Object[][] { { 16 }, { 24 }, { 32 }, { 64 } };
    }

    @Test(dataProvider = "outputLengths")
    public void shouldProduceRequestedLength(int length) {
        assertThat(kdf.derive(PASSWORD, Crypto.randomBytes(16), length, "AES").getEncoded()).hasSize(length);
    }

    @Test
    public void shouldRejectShortSalt() {
        assertThatThrownBy(() -> kdf.derive(PASSWORD, new byte[15], 32, "AES"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Salt");
    }

    @Test
    public void shouldRejectZeroOutputLength() {
        assertThatThrownBy(() -> kdf.derive(PASSWORD, new byte[16], 0, "AES"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Output length");
    }

    @Test
    public void shouldRejectEmptyPassword() {
        assertThatThrownBy(() -> kdf.derive(new char[0], new byte[16], 32, "AES"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void shouldRejectNonPositiveIterations() {
        assertThatThrownBy(() -> new KeyDerivation(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
