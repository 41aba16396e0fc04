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

package io.replfixture.impl.resolver;

import io.replfixture.client.ClusterClient;
import io.replfixture.client.ReadPreference;
import io.replfixture.exception.ConnectionLostException;
import io.replfixture.exception.LeaderDiscoveryTimeoutException;
import io.replfixture.node.Node;
import io.replfixture.runtime.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static io.replfixture.impl.monitor.ReadinessMonitor.IS_MASTER_FIELD;
import static io.replfixture.impl.monitor.ReadinessMonitor.isMasterCommand;
import static io.replfixture.impl.util.PollingUtils.isTrue;
import static io.replfixture.impl.util.PollingUtils.sleep;
import static java.util.Objects.requireNonNull;
import static java.util.concurrent.TimeUnit.SECONDS;
import static java.util.stream.Collectors.joining;
import static java.util.stream.Collectors.toList;

/**
 * Derives the addresses of a replica set and finds its current primary.
 */
public class ConnectionResolver {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConnectionResolver.class);

    private final String replicaSetName;
    private final Clock clock;
    private final Sleeper sleeper;
    private final long pollIntervalMillis;

    public ConnectionResolver(@Nonnull String replicaSetName, @Nonnull Clock clock, @Nonnull Sleeper sleeper,
                              long pollIntervalMillis) {
        this.replicaSetName = requireNonNull(replicaSetName);
        this.clock = requireNonNull(clock);
        this.sleeper = requireNonNull(sleeper);
        this.pollIntervalMillis = pollIntervalMillis;
    }

    /**
     * Returns "name/host1,host2,..." with the hidden member last.
     */
    @Nonnull
    public String internalAddress(@Nonnull List<Node> nodes, @Nullable Node hiddenSyncMember) {
        return replicaSetName + "/" + joinAddresses(nodes, hiddenSyncMember);
    }

    /**
     * Returns a replica set connection string if requested, otherwise the
     * direct connection URL of the first node so that a failover surfaces as
     * an error on the client side.
     */
    @Nonnull
    public String driverUrl(@Nonnull List<Node> nodes, @Nullable Node hiddenSyncMember,
                            boolean useReplicaSetConnectionString) {
        if (useReplicaSetConnectionString) {
            return "mongodb://" + joinAddresses(nodes, hiddenSyncMember) + "/?replicaSet=" + replicaSetName;
        }

        return nodes.get(0).getDriverUrl();
    }

    private static String joinAddresses(List<Node> nodes, Node hiddenSyncMember) {
        List<Node> all = new ArrayList<>(nodes);
        if (hiddenSyncMember != null) {
            all.add(hiddenSyncMember);
        }

        return all.stream().map(Node::getInternalAddress).collect(joining(","));
    }

    /**
     * Returns the current primary.
     * <p>
     * If only the first node is electable, it is returned without contacting
     * any node. Otherwise the running nodes are asked in rounds until one
     * of them reports itself as primary. Lost connections are ignored since
     * the node may have stepped down in the meantime, and the node is asked
     * again in the next round.
     *
     * @param nodes
     *         the regular nodes of the replica set
     * @param allNodesElectable
     *         whether every regular node can become primary
     * @param timeoutSeconds
     *         the time budget in seconds
     *
     * @return the current primary
     *
     * @throws LeaderDiscoveryTimeoutException
     *         if no node reports itself as primary in time
     */
    @Nonnull
    public Node getLeader(@Nonnull List<Node> nodes, boolean allNodesElectable, long timeoutSeconds) {
        if (!allNodesElectable) {
            return nodes.get(0);
        }

        long start = clock.millis();
        long timeoutMillis = SECONDS.toMillis(timeoutSeconds);
        Map<Integer, ClusterClient> clients = new HashMap<>();
        while (true) {
            for (Node node : nodes) {
                checkLeaderDiscoveryTimeout(start, timeoutMillis);
                if (!node.isRunning()) {
                    continue;
                }

                boolean isMaster;
                try {
                    ClusterClient client = clients.computeIfAbsent(node.getPort(),
                                                                   port -> node.client(ReadPreference.PRIMARY));
                    isMaster = isTrue(client.runAdminCommand(isMasterCommand()).get(IS_MASTER_FIELD));
                } catch (ConnectionLostException e) {
                    LOGGER.debug("Lost connection to node on port {} of replica set '{}': {}", node.getPort(),
                                 replicaSetName, e.getMessage());
                    continue;
                }

                if (isMaster) {
                    LOGGER.info("The node on port {} is primary of replica set '{}'", node.getPort(), replicaSetName);
                    return node;
                }
            }

            sleep(sleeper, pollIntervalMillis);
        }
    }

    private void checkLeaderDiscoveryTimeout(long start, long timeoutMillis) {
        long elapsed = clock.millis() - start;
        if (elapsed >= timeoutMillis) {
            LeaderDiscoveryTimeoutException e = new LeaderDiscoveryTimeoutException(replicaSetName, elapsed);
            LOGGER.error(e.getMessage());
            throw e;
        }
    }

    /**
     * Returns the regular nodes other than the given primary.
     */
    @Nonnull
    public List<Node> getFollowers(@Nonnull List<Node> nodes, @Nonnull Node leader) {
        return nodes.stream().filter(node -> node.getPort() != leader.getPort()).collect(toList());
    }

}
