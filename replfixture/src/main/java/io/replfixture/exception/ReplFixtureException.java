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

package io.replfixture.exception;

/**
 * Base exception of the failures raised while a replica set fixture is
 * brought up, observed or torn down.
 */
public class ReplFixtureException
        extends RuntimeException {

    private static final long serialVersionUID = -2784925611390327648L;

    public ReplFixtureException(String message) {
        super(message);
    }

    public ReplFixtureException(String message, Throwable cause) {
        super(message, cause);
    }

}
