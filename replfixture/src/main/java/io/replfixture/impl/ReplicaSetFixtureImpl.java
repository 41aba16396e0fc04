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

package io.replfixture.impl;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Timer;
import io.replfixture.ReplicaSetConfig;
import io.replfixture.ReplicaSetFixture;
import io.replfixture.ReplicaSetFixtureStatus;
import io.replfixture.client.AuthOptions;
import io.replfixture.client.ClusterClient;
import io.replfixture.client.ReadPreference;
import io.replfixture.exception.LeaderDiscoveryTimeoutException;
import io.replfixture.exception.NodeProcessException;
import io.replfixture.impl.initiate.ReplicaSetInitiator;
import io.replfixture.impl.metrics.MetricsContext;
import io.replfixture.impl.monitor.ReadinessMonitor;
import io.replfixture.impl.resolver.ConnectionResolver;
import io.replfixture.impl.topology.TopologyBuilder;
import io.replfixture.model.MemberDescriptor;
import io.replfixture.model.ReplicaSetSpec;
import io.replfixture.node.Node;
import io.replfixture.node.NodeFactory;
import io.replfixture.node.NodeOptions;
import io.replfixture.runtime.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static io.replfixture.ReplicaSetFixtureStatus.READY;
import static io.replfixture.ReplicaSetFixtureStatus.TORN_DOWN;
import static io.replfixture.ReplicaSetFixtureStatus.UNCONFIGURED;
import static io.replfixture.impl.metrics.MetricsContext.COMMAND_RETRIES_METRIC;
import static io.replfixture.impl.metrics.MetricsContext.LEADER_DISCOVERY_TIMEOUTS_METRIC;
import static io.replfixture.impl.metrics.MetricsContext.SETUP_TIME_METRIC;
import static io.replfixture.impl.metrics.MetricsContext.STATUS_METRIC;
import static io.replfixture.node.NodeOptions.DBPATH_OPTION;
import static io.replfixture.node.NodeOptions.REPL_SET_OPTION;
import static io.replfixture.node.NodeOptions.SET_PARAMETERS_OPTION;
import static java.util.Objects.requireNonNull;
import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static java.util.stream.Collectors.toList;

/**
 * Implementation of {@link ReplicaSetFixture}.
 * <p>
 * Owns the nodes of the replica set and the replica set config sent to
 * them. Nodes are indexed by their member ids, which never change during
 * the lifetime of the fixture.
 */
public class ReplicaSetFixtureImpl implements ReplicaSetFixture {

    public static final String FORCE_SYNC_SOURCE_FAILPOINT = "failpoint.forceSyncSourceCandidate";

    public static final String REFRESH_SESSION_CACHE_COMMAND = "refreshLogicalSessionCacheNow";

    public static final String INITIAL_SYNC_NODE_NAME = "initsync";

    private static final Logger LOGGER = LoggerFactory.getLogger(ReplicaSetFixtureImpl.class);

    private final ReplicaSetConfig config;
    private final NodeFactory nodeFactory;
    private final MetricsContext metricsContext;
    private final String localIdentity;
    private final Path dbpathPrefix;
    private final Map<String, Object> serverOptions;
    private final Map<String, Object> setParameters;
    private final ReadinessMonitor readinessMonitor;
    private final ConnectionResolver connectionResolver;
    private final ReplicaSetInitiator initiator;
    private final Counter leaderDiscoveryTimeoutCounter;
    private final Timer setupTimer;
    private final List<Node> nodes = new ArrayList<>();
    private Node hiddenSyncMember;
    private ReplicaSetSpec spec;
    private String replicaSetName;
    private volatile ReplicaSetFixtureStatus status = UNCONFIGURED;

    ReplicaSetFixtureImpl(ReplicaSetConfig config, NodeFactory nodeFactory, Sleeper sleeper,
                          MetricsContext metricsContext) {
        this.config = requireNonNull(config);
        this.nodeFactory = requireNonNull(nodeFactory);
        this.metricsContext = requireNonNull(metricsContext);
        this.localIdentity = "ReplicaSet[" + config.getReplicaSetName() + "]";

        Map<String, Object> serverOptions = new LinkedHashMap<>(config.getNodeOptions());
        Object dbpath = serverOptions.remove(DBPATH_OPTION);
        this.dbpathPrefix = Paths.get(dbpath != null ? dbpath.toString() : config.getDbpathPrefix());
        this.setParameters = toSetParameters(serverOptions.remove(SET_PARAMETERS_OPTION));
        serverOptions.remove(REPL_SET_OPTION);
        this.serverOptions = serverOptions;

        this.readinessMonitor = new ReadinessMonitor(localIdentity, metricsContext.clock(), sleeper,
                                                     config.getPollIntervalMillis());
        this.connectionResolver = new ConnectionResolver(config.getReplicaSetName(), metricsContext.clock(),
                                                         sleeper, config.getPollIntervalMillis());
        this.initiator = new ReplicaSetInitiator(localIdentity, config, readinessMonitor, sleeper,
                                                 metricsContext.registerCounter(COMMAND_RETRIES_METRIC));
        this.leaderDiscoveryTimeoutCounter = metricsContext.registerCounter(LEADER_DISCOVERY_TIMEOUTS_METRIC);
        this.setupTimer = metricsContext.registerTimer(SETUP_TIME_METRIC);
        metricsContext.registerGauge(STATUS_METRIC, () -> status.ordinal());
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> toSetParameters(Object value) {
        if (value == null) {
            return Collections.emptyMap();
        } else if (!(value instanceof Map)) {
            throw new IllegalArgumentException(SET_PARAMETERS_OPTION + " node option must be a map: " + value);
        }

        return new LinkedHashMap<>((Map<String, Object>) value);
    }

    @Override
    public void setup() {
        if (status == TORN_DOWN) {
            throw new IllegalStateException(localIdentity + " cannot be set up after teardown!");
        }

        long start = metricsContext.nowMs();
        replicaSetName = config.getReplicaSetName();

        if (nodes.isEmpty()) {
            for (int i = 0; i < config.getNodeCount(); i++) {
                nodes.add(createNode(i, getNodeName(i)));
            }
        }

        for (Node node : nodes) {
            startNode(node);
        }

        if (config.isStartInitialSyncNode()) {
            if (hiddenSyncMember == null) {
                hiddenSyncMember = createNode(nodes.size(), INITIAL_SYNC_NODE_NAME);
            }
            startNode(hiddenSyncMember);
            hiddenSyncMember.awaitReady();
        }

        // only the first node is needed here since it is initiated as a single member replica set
        Node primary = nodes.get(0);
        primary.awaitReady();

        List<String> hosts = nodes.stream().map(Node::getInternalAddress).collect(toList());
        List<MemberDescriptor> members = TopologyBuilder.buildMembers(hosts, config.isAllNodesElectable(),
                config.isVotingSecondaries(), hiddenSyncMember != null ? hiddenSyncMember.getInternalAddress() : null);

        ClusterClient client = authenticate(primary.client(ReadPreference.PRIMARY));
        if (spec == null) {
            spec = new ReplicaSetSpec(replicaSetName);
        }

        initiator.initiate(spec, members, client, primary, nodes.subList(1, nodes.size()), hiddenSyncMember,
                           this::setStatus);

        setupTimer.record(metricsContext.elapsedDurationMs(start), MILLISECONDS);
    }

    private Node createNode(int index, String name) {
        NodeOptions.NodeOptionsBuilder options = NodeOptions.newBuilder().setIndex(index).setName(name)
                                                            .setReplicaSetName(replicaSetName)
                                                            .setDbpath(dbpathPrefix.resolve("node" + index))
                                                            .setPreserveDbpath(config.isPreserveDbpath())
                                                            .setServerOptions(serverOptions)
                                                            .setSetParameters(setParameters);

        if (config.isLinearChain() && index > 0 && index < config.getNodeCount()) {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("hostAndPort", nodes.get(index - 1).getInternalAddress());
            Map<String, Object> failpoint = new LinkedHashMap<>();
            failpoint.put("mode", "alwaysOn");
            failpoint.put("data", data);
            options.putSetParameter(FORCE_SYNC_SOURCE_FAILPOINT, failpoint);
        }

        Node node = nodeFactory.createNode(options.build());
        LOGGER.info("{} Created {} node on port {}.", localIdentity, name, node.getPort());
        return node;
    }

    private String getNodeName(int index) {
        if (config.isAllNodesElectable()) {
            return "node" + index;
        } else if (index == 0) {
            return "primary";
        }

        return "secondary" + (config.getNodeCount() > 2 ? String.valueOf(index - 1) : "");
    }

    private void startNode(Node node) {
        if (!node.isRunning()) {
            LOGGER.info("{} Starting {}.", localIdentity, node.getOptions().getName());
            node.start();
        }
    }

    private ClusterClient authenticate(ClusterClient client) {
        AuthOptions authOptions = config.getAuthOptions();
        if (authOptions != null) {
            client.authenticate(authOptions);
        }

        return client;
    }

    private void setStatus(ReplicaSetFixtureStatus newStatus) {
        ReplicaSetFixtureStatus oldStatus = status;
        if (newStatus.ordinal() < oldStatus.ordinal()) {
            // status only moves forward, e.g. a repeated setup() does not undo READY
            LOGGER.debug("{} Ignored status change to {} since status is {}.", localIdentity, newStatus, oldStatus);
            return;
        }

        status = newStatus;
        if (oldStatus != newStatus) {
            LOGGER.info("{} Status is set to {} from {}.", localIdentity, newStatus, oldStatus);
        }
    }

    @Override
    public void awaitReady() {
        if (status == TORN_DOWN) {
            throw new IllegalStateException(localIdentity + " is already torn down!");
        } else if (replicaSetName == null || nodes.isEmpty()) {
            throw new IllegalStateException("Must call setup() before calling awaitReady()");
        }

        Long timeoutSecs = config.getReadinessTimeoutSecs();
        Duration timeout = timeoutSecs != null ? Duration.ofSeconds(timeoutSecs) : null;

        Node primary = nodes.get(0);
        readinessMonitor.awaitLeader(primary, timeout);
        List<Node> secondaries = new ArrayList<>(nodes.subList(1, nodes.size()));
        if (hiddenSyncMember != null) {
            secondaries.add(hiddenSyncMember);
        }
        readinessMonitor.awaitFollowers(secondaries, timeout);

        // the sessions collection is set up now so that tests do not trigger it
        ClusterClient client = authenticate(primary.client(ReadPreference.PRIMARY));
        Map<String, Object> command = new LinkedHashMap<>();
        command.put(REFRESH_SESSION_CACHE_COMMAND, 1);
        client.runAdminCommand(command);

        setStatus(READY);
    }

    @Override
    public boolean teardown() {
        boolean runningAtStart = isRunning();
        boolean success = true;

        if (!runningAtStart) {
            LOGGER.info("{} Replica set was expected to be running in teardown(), but wasn't.", localIdentity);
        } else {
            LOGGER.info("{} Stopping all members of the replica set...", localIdentity);
        }

        if (spec != null) {
            spec.freeze();
        }

        if (hiddenSyncMember != null) {
            success = stopNode(hiddenSyncMember) && success;
        }

        // secondaries are stopped first to reduce noise in the logs
        for (int i = nodes.size() - 1; i >= 0; i--) {
            success = stopNode(nodes.get(i)) && success;
        }

        if (runningAtStart) {
            if (success) {
                LOGGER.info("{} Successfully stopped all members of the replica set.", localIdentity);
            } else {
                LOGGER.error("{} Failed to stop some members of the replica set.", localIdentity);
            }
        }

        setStatus(TORN_DOWN);
        return success;
    }

    private boolean stopNode(Node node) {
        try {
            boolean stopped = node.stop();
            if (!stopped) {
                LOGGER.error("{} {} on port {} did not stop cleanly.", localIdentity, node.getOptions().getName(),
                             node.getPort());
            }

            return stopped;
        } catch (NodeProcessException e) {
            LOGGER.error(localIdentity + " Could not stop " + node.getOptions().getName() + " on port "
                         + node.getPort(), e);
            return false;
        }
    }

    @Override
    public boolean isRunning() {
        if (nodes.isEmpty() && hiddenSyncMember == null) {
            return false;
        }

        boolean running = !nodes.isEmpty() && nodes.stream().allMatch(Node::isRunning);
        if (hiddenSyncMember != null) {
            running = hiddenSyncMember.isRunning() || running;
        }

        return running;
    }

    @Nonnull
    @Override
    public Node getLeader() {
        return getLeader(config.getLeaderDiscoveryTimeoutSecs());
    }

    @Nonnull
    @Override
    public Node getLeader(long timeoutSeconds) {
        checkSetup("getLeader()");
        try {
            return connectionResolver.getLeader(nodes, config.isAllNodesElectable(), timeoutSeconds);
        } catch (LeaderDiscoveryTimeoutException e) {
            leaderDiscoveryTimeoutCounter.increment();
            throw e;
        }
    }

    @Nonnull
    @Override
    public List<Node> getFollowers() {
        return connectionResolver.getFollowers(nodes, getLeader());
    }

    @Nullable
    @Override
    public Node getHiddenSyncMember() {
        return hiddenSyncMember;
    }

    @Nonnull
    @Override
    public List<Node> getNodes() {
        return Collections.unmodifiableList(new ArrayList<>(nodes));
    }

    @Nonnull
    @Override
    public String getInternalAddress() {
        checkSetup("getInternalAddress()");
        return connectionResolver.internalAddress(nodes, hiddenSyncMember);
    }

    @Nonnull
    @Override
    public String getDriverUrl() {
        checkSetup("getDriverUrl()");
        return connectionResolver.driverUrl(nodes, hiddenSyncMember, config.isUseReplicaSetConnectionString());
    }

    private void checkSetup(String methodName) {
        if (replicaSetName == null || nodes.isEmpty()) {
            throw new IllegalStateException("Must call setup() before calling " + methodName);
        }
    }

    @Nonnull
    @Override
    public ReplicaSetFixtureStatus getStatus() {
        return status;
    }

    @Nonnull
    @Override
    public ReplicaSetConfig getConfig() {
        return config;
    }

    // for testing
    ReplicaSetSpec getSpec() {
        return spec;
    }

    @Override
    public String toString() {
        return localIdentity + "{status=" + status + ", nodes=" + nodes.size() + ", hiddenSyncMember="
               + (hiddenSyncMember != null) + '}';
    }

}
