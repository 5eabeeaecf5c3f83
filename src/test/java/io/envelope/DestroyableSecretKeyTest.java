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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Arrays;

import org.testng.annotations.Test;

public class DestroyableSecretKeyTest {

    @Test
    public void shouldWipeKeyMaterialWhenDestroyed() {
        var key = new DestroyableSecretKey("AES", Crypto.randomBytes(32));

        key.destroy();

        assertThat(key.isDestroyed()).isTrue();
        assertThatThrownBy(key::getEncoded).isInstanceOf(IllegalStateException.class);
    }

    @Test
    public void shouldCopyInputArray() {
        var material = Crypto.randomBytes(16);
        var expected = material.clone();
        var key = new DestroyableSecretKey("AES", material);

        Utils.wipe(material);

        assertThat(key.getEncoded()).isEqualTo(expected);
    }

    @Test
    public void shouldSplitIntoIndependentKeysAndDestroyOriginal() {
        var material = Crypto.randomBytes(64);
        var key = new DestroyableSecretKey("AES", material);

        var parts = key.split("AES", 32, "HmacSHA512");

        assertThat(key.isDestroyed()).isTrue();
        assertThat(parts[0].getAlgorithm()).isEqualTo("AES");
        assertThat(parts[0].getEncoded()).containsExactly(Arrays.copyOfRange(material, 0, 32));
        assertThat(parts[1].getAlgorithm()).isEqualTo("HmacSHA512");
        assertThat(parts[1].getEncoded()).containsExactly(Arrays.copyOfRange(material, 32, 64));
    }

    @Test
    public void shouldNotRevealKeyInToString() {
        var key = new DestroyableSecretKey("AES", Crypto.randomBytes(16));

        assertThat(key.toString()).isEqualTo("DestroyableSecretKey{algorithm='AES', bits=128, destroyed=false}");
    }

    @Test
    public void shouldCompareByAlgorithmAndMaterial() {
        var material = Crypto.randomBytes(32);

        assertThat(new DestroyableSecretKey("AES", material))
                .isEqualTo(new DestroyableSecretKey("AES", material))
                .isNotEqualTo(new DestroyableSecretKey("HmacSHA512", material))
                .hasSameHashCodeAs(new DestroyableSecretKey("AES", Crypto.randomBytes(32)));
    }
}
