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
 * Thrown by a {@link io.replfixture.client.ClusterClient} when the server
 * rejects a command with an error code.
 * <p>
 * Replica set initiate and reconfigure commands are never retried on this
 * exception, unless it is a {@link NodeNotFoundException}.
 */
public class CommandFailedException
        extends ReplFixtureException {

    /**
     * The server error code reported when a heartbeat times out during the
     * quorum check of an initiate or reconfigure command.
     */
    public static final int NODE_NOT_FOUND_CODE = 74;

    private static final long serialVersionUID = 6195308114765014389L;

    private final int code;

    public CommandFailedException(int code, String message) {
        super(message);
        this.code = code;
    }

    /**
     * Creates the exception type matching the given server error code.
     *
     * @param code
     *         the server error code
     * @param message
     *         the server error message
     *
     * @return a {@link NodeNotFoundException} for
     *         {@link #NODE_NOT_FOUND_CODE}, a plain
     *         {@link CommandFailedException} otherwise
     */
    public static CommandFailedException of(int code, String message) {
        if (code == NODE_NOT_FOUND_CODE) {
            return new NodeNotFoundException(message);
        }

        return new CommandFailedException(code, message);
    }

    /**
     * Returns the server error code of the failed command.
     *
     * @return the server error code of the failed command
     */
    public int getCode() {
        return code;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{code=" + code + ", message=" + getMessage() + "}";
    }

}
