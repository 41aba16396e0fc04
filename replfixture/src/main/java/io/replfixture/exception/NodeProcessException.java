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
 * Thrown by a {@link io.replfixture.node.Node} when its server process
 * cannot be started, reached or stopped.
 */
public class NodeProcessException
        extends ReplFixtureException {

    private static final long serialVersionUID = 8841270516003317419L;

    public NodeProcessException(String message) {
        super(message);
    }

    public NodeProcessException(String message, Throwable cause) {
        super(message, cause);
    }

}
