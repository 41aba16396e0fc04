/*
 * Copyright (c) 2026, ReplFixture.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.replfixture.client;

import javax.annotation.Nonnull;
import java.util.Objects;

import static java.util.Objects.requireNonNull;

/**
 * Credentials used to authenticate the administrative connections of the
 * fixture.
 */
public final class AuthOptions {

    /**
     * The default authentication mechanism.
     */
    public static final String DEFAULT_AUTHENTICATION_MECHANISM = "SCRAM-SHA-1";

    private final String authenticationDatabase;
    private final String username;
    private final String password;
    private final String authenticationMechanism;

    private AuthOptions(String authenticationDatabase, String username, String password,
                        String authenticationMechanism) {
        this.authenticationDatabase = authenticationDatabase;
        this.username = username;
        this.password = password;
        this.authenticationMechanism = authenticationMechanism;
    }

    @Nonnull
    public static AuthOptionsBuilder newBuilder() {
        return new AuthOptionsBuilder();
    }

    @Nonnull
    public String getAuthenticationDatabase() {
        return authenticationDatabase;
    }

    @Nonnull
    public String getUsername() {
        return username;
    }

    @Nonnull
    public String getPassword() {
        return password;
    }

    @Nonnull
    public String getAuthenticationMechanism() {
        return authenticationMechanism;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }

        AuthOptions that = (AuthOptions) o;
        return authenticationDatabase.equals(that.authenticationDatabase) && username.equals(that.username)
               && password.equals(that.password) && authenticationMechanism.equals(that.authenticationMechanism);
    }

    @Override
    public int hashCode() {
        return Objects.hash(authenticationDatabase, username, password, authenticationMechanism);
    }

    @Override
    public String toString() {
        return "AuthOptions{" + "authenticationDatabase='" + authenticationDatabase + '\'' + ", username='" + username
               + '\'' + ", authenticationMechanism='" + authenticationMechanism + '\'' + '}';
    }

    public static final class AuthOptionsBuilder {

        private String authenticationDatabase = "admin";
        private String username;
        private String password;
        private String authenticationMechanism = DEFAULT_AUTHENTICATION_MECHANISM;

        private AuthOptionsBuilder() {
        }

        @Nonnull
        public AuthOptionsBuilder setAuthenticationDatabase(@Nonnull String authenticationDatabase) {
            this.authenticationDatabase = requireNonNull(authenticationDatabase);
            return this;
        }

        @Nonnull
        public AuthOptionsBuilder setUsername(@Nonnull String username) {
            this.username = requireNonNull(username);
            return this;
        }

        @Nonnull
        public AuthOptionsBuilder setPassword(@Nonnull String password) {
            this.password = requireNonNull(password);
            return this;
        }

        @Nonnull
        public AuthOptionsBuilder setAuthenticationMechanism(@Nonnull String authenticationMechanism) {
            this.authenticationMechanism = requireNonNull(authenticationMechanism);
            return this;
        }

        @Nonnull
        public AuthOptions build() {
            if (username == null || password == null) {
                throw new IllegalArgumentException("username and password must be set!");
            }

            return new AuthOptions(authenticationDatabase, username, password, authenticationMechanism);
        }

    }

}
