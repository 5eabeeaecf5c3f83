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

import java.util.Optional;

import javax.security.auth.Destroyable;

/**
 * The password (or pair of passwords) used to seal and open envelopes. With two passwords, the CBC+HMAC
 * construction derives its encryption key from the first and its authentication key from the second, so that
 * each can be changed without affecting the other. AEAD envelopes only use the encryption password.
 * <p>
 * The password arrays are copied on construction, so callers may wipe their own arrays immediately. Call
 * {@link #destroy()} to wipe the copies once they are no longer needed.
 */
public final class Credentials implements Destroyable {
    private final char[] encryptionPassword;
    private final char[] authenticationPassword;
    private volatile boolean destroyed = false;

    private Credentials(char[] encryptionPassword, char[] authenticationPassword) {
        this.encryptionPassword = encryptionPassword;
        this.authenticationPassword = authenticationPassword;
    }

    /**
     * Creates credentials from a single password. CBC+HMAC envelopes split one derivation into two keys.
     *
     * @param password the password, which must not be empty.
     * @return the credentials.
     */
    public static Credentials of(char[] password) {
        require(requireNonNull(password, "password").length > 0, "Password must not be empty");
        return new Credentials(password.clone(), null);
    }

    /**
     * Creates credentials with independent encryption and authentication passwords.
     *
     * @param encryptionPassword the password for the cipher key.
     * @param authenticationPassword the password for the MAC key.
     * @return the credentials.
     */
    public static Credentials of(char[] encryptionPassword, char[] authenticationPassword) {
        require(requireNonNull(encryptionPassword, "encryptionPassword").length > 0,
                "Encryption password must not be empty");
        require(requireNonNull(authenticationPassword, "authenticationPassword").length > 0,
                "Authentication password must not be empty");
        return new Credentials(encryptionPassword.clone(), authenticationPassword.clone());
    }

    char[] encryptionPassword() {
        checkDestroyed();
        return encryptionPassword;
    }

    Optional<char[]> authenticationPassword() {
        checkDestroyed();
        return Optional.ofNullable(authenticationPassword);
    }

    public boolean hasSeparateAuthenticationPassword() {
        return authenticationPassword != null;
    }

    @Override
    public void destroy() {
        destroyed = true;
        Utils.wipe(encryptionPassword);
        Utils.wipe(authenticationPassword);
    }

    @Override
    public boolean isDestroyed() {
        return destroyed;
    }

    @Override
    public String toString() {
        return "Credentials{separateAuthenticationPassword=" + hasSeparateAuthenticationPassword() +
                ", destroyed=" + destroyed + '}';
    }

    private void checkDestroyed() {
        if (destroyed) {
            throw new IllegalStateException("Credentials have been destroyed");
        }
    }
}
