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

/**
 * Thrown when the first byte of an envelope does not name a known {@link EnvelopeVersion}. Nothing after the
 * version byte has been read when this is raised.
 */
public final class UnsupportedVersionException extends EnvelopeException {
    private static final long serialVersionUID = 1L;

    private final int version;

    UnsupportedVersionException(int version) {
        super(String.format("Unsupported envelope version: 0x%02x", version & 0xFF));
        this.version = version & 0xFF;
    }

    /**
     * The unrecognised version byte, as an unsigned value.
     */
    public int getVersion() {
        return version;
    }
}
