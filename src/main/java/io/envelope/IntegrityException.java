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
 * Indicates that an envelope failed verification. The envelope was tampered with, truncated, or sealed under
 * different credentials. Every such failure, including malformed padding behind a valid tag, is reported with the
 * same message and no cause so that callers cannot tell them apart.
 */
public final class IntegrityException extends EnvelopeException {
    private static final long serialVersionUID = 1L;

    static final String MESSAGE = "Envelope authentication failed";

    IntegrityException() {
        super(MESSAGE);
    }
}
