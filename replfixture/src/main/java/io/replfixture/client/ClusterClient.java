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

import io.replfixture.exception.CommandFailedException;
import io.replfixture.exception.ConnectionLostException;

import javax.annotation.Nonnull;
import java.util.Map;

/**
 * A network client to the command interface of a single replica set
 * member.
 * <p>
 * Command and response documents are represented as ordered maps. The
 * first key of a command document is the command name.
 * <p>
 * Implementations report rejected commands with
 * {@link CommandFailedException} (see
 * {@link CommandFailedException#of(int, String)} for mapping server error
 * codes) and lost connections with {@link ConnectionLostException}.
 *
 * @see io.replfixture.node.Node#client(ReadPreference)
 */
public interface ClusterClient {

    /**
     * Runs the given command on the "admin" database of the node.
     *
     * @param command
     *         the command document
     *
     * @return the response document of the command
     *
     * @throws CommandFailedException
     *         if the node rejects the command
     * @throws ConnectionLostException
     *         if the connection to the node is lost
     */
    @Nonnull
    Map<String, Object> runAdminCommand(@Nonnull Map<String, Object> command);

    /**
     * Returns the number of documents in the given collection.
     *
     * @param database
     *         the database name
     * @param collection
     *         the collection name
     *
     * @return the number of documents in the given collection
     *
     * @throws CommandFailedException
     *         if the node rejects the query
     * @throws ConnectionLostException
     *         if the connection to the node is lost
     */
    long count(@Nonnull String database, @Nonnull String collection);

    /**
     * Authenticates the connection with the given credentials.
     *
     * @param authOptions
     *         the credentials
     *
     * @throws CommandFailedException
     *         if authentication fails
     */
    void authenticate(@Nonnull AuthOptions authOptions);

}
