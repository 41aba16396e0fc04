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

package io.replfixture.impl.monitor;

import io.replfixture.client.ClusterClient;
import io.replfixture.client.ReadPreference;
import io.replfixture.exception.ReadinessTimeoutException;
import io.replfixture.node.Node;
import io.replfixture.runtime.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static io.replfixture.impl.util.PollingUtils.isTrue;
import static io.replfixture.impl.util.PollingUtils.sleep;
import static java.util.Objects.requireNonNull;

/**
 * Polls the nodes of a replica set until they report the roles they are
 * expected to have right after setup: the first node as primary and all
 * other nodes as secondaries.
 * <p>
 * Waits are unbounded unless a timeout is given. The clock and the sleeper
 * are injected so that tests can run the polling loops on simulated time.
 */
public class ReadinessMonitor {

    public static final String IS_MASTER_COMMAND = "isMaster";

    public static final String IS_MASTER_FIELD = "ismaster";

    public static final String SECONDARY_FIELD = "secondary";

    private static final Logger LOGGER = LoggerFactory.getLogger(ReadinessMonitor.class);

    private final String localIdentity;
    private final Clock clock;
    private final Sleeper sleeper;
    private final long pollIntervalMillis;

    public ReadinessMonitor(@Nonnull String localIdentity, @Nonnull Clock clock, @Nonnull Sleeper sleeper,
                            long pollIntervalMillis) {
        this.localIdentity = requireNonNull(localIdentity);
        this.clock = requireNonNull(clock);
        this.sleeper = requireNonNull(sleeper);
        if (pollIntervalMillis < 1) {
            throw new IllegalArgumentException("poll interval millis must be positive: " + pollIntervalMillis);
        }
        this.pollIntervalMillis = pollIntervalMillis;
    }

    /**
     * Returns the single field "isMaster" command document.
     */
    @Nonnull
    public static Map<String, Object> isMasterCommand() {
        Map<String, Object> command = new LinkedHashMap<>();
        command.put(IS_MASTER_COMMAND, 1);
        return command;
    }

    /**
     * Blocks until the given node reports itself as primary.
     *
     * @param node
     *         the node expected to be primary
     * @param timeout
     *         the time budget, or null to wait without a bound
     *
     * @throws ReadinessTimeoutException
     *         if the timeout is given and elapses first
     */
    public void awaitLeader(@Nonnull Node node, @Nullable Duration timeout) {
        requireNonNull(node);
        awaitRole(node, ReadPreference.PRIMARY, IS_MASTER_FIELD, "primary", clock.millis(), timeout);
    }

    /**
     * Blocks until each of the given nodes reports itself as secondary. The
     * nodes are checked one after another in list order and the timeout,
     * if given, covers the whole list.
     *
     * @param nodes
     *         the nodes expected to be secondaries
     * @param timeout
     *         the time budget, or null to wait without a bound
     *
     * @throws ReadinessTimeoutException
     *         if the timeout is given and elapses first
     */
    public void awaitFollowers(@Nonnull List<Node> nodes, @Nullable Duration timeout) {
        requireNonNull(nodes);
        long start = clock.millis();
        for (Node node : nodes) {
            awaitRole(node, ReadPreference.SECONDARY, SECONDARY_FIELD, "secondary", start, timeout);
        }
    }

    private void awaitRole(Node node, ReadPreference readPreference, String roleField, String roleName, long start,
                           Duration timeout) {
        // secondaries are queried with a secondary read preference so the check does not need a primary
        ClusterClient client = node.client(readPreference);
        LOGGER.info("{} Waiting for {} on port {} to become available.", localIdentity, roleName, node.getPort());
        while (true) {
            Map<String, Object> response = client.runAdminCommand(isMasterCommand());
            if (isTrue(response.get(roleField))) {
                break;
            }

            long elapsed = clock.millis() - start;
            if (timeout != null && elapsed >= timeout.toMillis()) {
                String message = localIdentity + " Timed out after " + elapsed + " millis while waiting for "
                                 + roleName + " on port " + node.getPort();
                LOGGER.error(message);
                throw new ReadinessTimeoutException(message);
            }

            LOGGER.debug("{} Node on port {} is not {} yet: {}", localIdentity, node.getPort(), roleName, response);
            sleep(sleeper, pollIntervalMillis);
        }

        LOGGER.info("{} {} on port {} is now available.", localIdentity, capitalize(roleName), node.getPort());
    }

    private static String capitalize(String s) {
        return Character.toUpperCase(s.charAt(0)) + s.substring(1);
    }

}
