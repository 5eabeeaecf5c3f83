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

import java.util.Arrays;
import java.util.HexFormat;

import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

public class MacAccumulatorTest {

    private DestroyableSecretKey key;

    @BeforeMethod
    public void generateKey() {
        key = new DestroyableSecretKey(Crypto.HMAC_SHA512, Crypto.randomBytes(32));
    }

    @Test
    public void shouldMatchRfc4231TestCase2() {
        var jefe = new DestroyableSecretKey(Crypto.HMAC_SHA512, "Jefe".getBytes(UTF_8));

        var tag = new MacAccumulator(jefe)
                .update("what do ya ".getBytes(UTF_8))
                .update("want for nothing?".getBytes(UTF_8))
                .finish();

        assertThat(HexFormat.of().formatHex(tag)).isEqualTo(
                "164b7a7bfcf819e2e395fbe73b56e0a387bd64222e831fd610270cd7ea250554" +
                "9758bf75c05a994a6d034f65f8f0e6fdcaeab1a34d4a6b4b636e070a38bce737");
    }

    @Test
    public void shouldProduce64ByteTag() {
        assertThat(new MacAccumulator(key).update(new byte[10]).finish()).hasSize(MacAccumulator.TAG_SIZE);
    }

    @Test
    public void shouldBeIndependentOfChunkBoundaries() {
        var data = Crypto.randomBytes(100);

        var whole = new MacAccumulator(key).update(data).finish();
        var pieces = new MacAccumulator(key)
                .update(data, 0, 7)
                .update(data, 7, 50)
                .update(data, 57, 43)
                .finish();

        assertThat(pieces).isEqualTo(whole);
    }

    @Test
    public void shouldDependOnOrderOfUpdates() {
        var a = "first".getBytes(UTF_8);
        var b = "second".getBytes(UTF_8);

        var ab = new MacAccumulator(key).update(a).update(b).finish();
        var ba = new MacAccumulator(key).update(b).update(a).finish();

        assertThat(ab).isNotEqualTo(ba);
    }

    @Test
    public void shouldVerifyMatchingTag() {
        var tag = new MacAccumulator(key).update(new byte[] { 1, 2, 3 }).finish();

        assertThat(new MacAccumulator(key).update(new byte[] { 1, 2, 3 }).verify(tag)).isTrue();
    }

    @Test
    public void shouldRejectModifiedTag() {
        var tag = new MacAccumulator(key).update(new byte[] { 1, 2, 3 }).finish();
        tag[tag.length - 1] ^= 0x01;

        assertThat(new MacAccumulator(key).update(new byte[] { 1, 2, 3 }).verify(tag)).isFalse();
    }

    @Test
    public void shouldRejectTruncatedTag() {
        var tag = new MacAccumulator(key).update(new byte[] { 1, 2, 3 }).finish();
        var truncated = Arrays.copyOf(tag, 32);

        assertThat(new MacAccumulator(key).update(new byte[] { 1, 2, 3 }).verify(truncated)).isFalse();
    }

    @Test
    public void shouldNotAllowReuseAfterFinish() {
        var mac = new MacAccumulator(key).update(new byte[1]);
        mac.finish();

        assertThatThrownBy(() -> mac.update(new byte[1])).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(mac::finish).isInstanceOf(IllegalStateException.class);
    }
}
