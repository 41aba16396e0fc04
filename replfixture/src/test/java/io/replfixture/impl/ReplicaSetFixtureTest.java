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

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.replfixture.ReplicaSetConfig;
import io.replfixture.ReplicaSetFixture;
import io.replfixture.client.AuthOptions;
import io.replfixture.exception.CommandFailedException;
import io.replfixture.exception.LeaderDiscoveryTimeoutException;
import io.replfixture.exception.NodeNotFoundException;
import io.replfixture.exception.NodeProcessException;
import io.replfixture.impl.local.LocalClusterClient;
import io.replfixture.impl.local.LocalNode;
import io.replfixture.impl.local.LocalNodeFactory;
import io.replfixture.impl.local.ManualClock;
import io.replfixture.impl.monitor.ReadinessMonitor;
import io.replfixture.node.Node;
import io.replfixture.test.util.BaseTest;
import org.junit.Before;
import org.junit.Test;

import java.nio.file.Paths;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

import static io.replfixture.ReplicaSetFixtureStatus.FULLY_CONFIGURED;
import static io.replfixture.ReplicaSetFixtureStatus.READY;
import static io.replfixture.ReplicaSetFixtureStatus.TORN_DOWN;
import static io.replfixture.ReplicaSetFixtureStatus.UNCONFIGURED;
import static io.replfixture.impl.ReplicaSetFixtureImpl.FORCE_SYNC_SOURCE_FAILPOINT;
import static io.replfixture.impl.ReplicaSetFixtureImpl.REFRESH_SESSION_CACHE_COMMAND;
import static io.replfixture.impl.initiate.ReplicaSetInitiator.REPL_SET_INITIATE_COMMAND;
import static io.replfixture.impl.initiate.ReplicaSetInitiator.REPL_SET_RECONFIG_COMMAND;
import static io.replfixture.impl.metrics.MetricsContext.COMMAND_RETRIES_METRIC;
import static io.replfixture.impl.metrics.MetricsContext.LEADER_DISCOVERY_TIMEOUTS_METRIC;
import static io.replfixture.impl.metrics.MetricsContext.SETUP_TIME_METRIC;
import static io.replfixture.impl.metrics.MetricsContext.STATUS_METRIC;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.Assert.fail;

public class ReplicaSetFixtureTest
        extends BaseTest {

    private ManualClock clock;
    private LocalNodeFactory factory;
    private MeterRegistry meterRegistry;

    @Before
    public void init() {
        clock = new ManualClock();
        factory = new LocalNodeFactory();
        meterRegistry = new SimpleMeterRegistry();
    }

    private ReplicaSetFixture newFixture(ReplicaSetConfig config) {
        return ReplicaSetFixture.newBuilder().setConfig(config).setNodeFactory(factory).setClock(clock)
                                .setSleeper(clock.sleeper()).setMeterRegistry(meterRegistry).build();
    }

    private ReplicaSetFixture newFixture(ReplicaSetConfig config, Consumer<LocalNode> nodeInitializer) {
        factory.setNodeInitializer(nodeInitializer);
        return newFixture(config);
    }

    private static ReplicaSetConfig.ReplicaSetConfigBuilder configBuilder(int nodeCount) {
        return ReplicaSetConfig.newBuilder().setNodeCount(nodeCount);
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> membersOf(Map<String, Object> document) {
        return (List<Map<String, Object>>) document.get("members");
    }

    @Test
    public void when_threeNonElectableNodes_then_fixtureBecomesReady() {
        ReplicaSetFixture fixture = newFixture(configBuilder(3).build());

        fixture.setup();
        fixture.awaitReady();

        List<LocalNode> nodes = factory.getCreatedNodes();
        assertThat(nodes).hasSize(3);
        LocalNode node0 = nodes.get(0);
        assertThat(node0.getRole()).isEqualTo(LocalNode.Role.PRIMARY);
        assertThat(nodes.get(1).getRole()).isEqualTo(LocalNode.Role.SECONDARY);
        assertThat(nodes.get(2).getRole()).isEqualTo(LocalNode.Role.SECONDARY);

        List<Map<String, Object>> members = membersOf(node0.getCommandArguments(REPL_SET_RECONFIG_COMMAND).get(0));
        assertThat(members.get(1)).containsEntry("priority", 0).containsEntry("votes", 0);
        assertThat(members.get(2)).containsEntry("priority", 0).containsEntry("votes", 0);

        int isMasterCount = node0.getCommandCount(ReadinessMonitor.IS_MASTER_COMMAND);
        assertThat(fixture.getLeader()).isSameAs(node0);
        assertThat(node0.getCommandCount(ReadinessMonitor.IS_MASTER_COMMAND)).isEqualTo(isMasterCount);
        assertThat(fixture.getFollowers()).containsExactly(nodes.get(1), nodes.get(2));

        assertThat(fixture.getInternalAddress()).isEqualTo("rs/localhost:20000,localhost:20001,localhost:20002");
        assertThat(fixture.getDriverUrl()).isEqualTo(node0.getDriverUrl());
        assertThat(node0.getCommandCount(REFRESH_SESSION_CACHE_COMMAND)).isEqualTo(1);
        assertThat(fixture.getStatus()).isEqualTo(READY);

        assertThat(fixture.teardown()).isTrue();
        assertThat(factory.getStopOrder()).containsExactly("secondary1", "secondary0", "primary");
        assertThat(fixture.isRunning()).isFalse();
        assertThat(fixture.getStatus()).isEqualTo(TORN_DOWN);
    }

    @Test
    public void when_setupCalledTwice_then_nodesAndConfigAreReused() {
        ReplicaSetFixture fixture = newFixture(configBuilder(3).build());

        fixture.setup();
        fixture.setup();

        assertThat(factory.getCreatedNodes()).hasSize(3);
        LocalNode node0 = factory.getNode(0);
        assertThat(node0.getCommandCount(REPL_SET_INITIATE_COMMAND)).isEqualTo(1);
        assertThat(node0.getCommandCount(REPL_SET_RECONFIG_COMMAND)).isEqualTo(1);
        assertThat(node0.getStartCount()).isEqualTo(1);
        assertThat(fixture.getStatus()).isEqualTo(FULLY_CONFIGURED);
    }

    @Test
    public void when_setupCalledAgainAfterReady_then_statusStaysReady() {
        ReplicaSetFixture fixture = newFixture(configBuilder(3).build());
        fixture.setup();
        fixture.awaitReady();

        fixture.setup();

        assertThat(fixture.getStatus()).isEqualTo(READY);
        assertThat(factory.getNode(0).getCommandCount(REPL_SET_INITIATE_COMMAND)).isEqualTo(1);
        assertThat(meterRegistry.get(STATUS_METRIC).gauge().value()).isEqualTo(READY.ordinal());
    }

    @Test
    public void when_nodeStoppedBeforeSecondSetup_then_itIsRestarted() {
        ReplicaSetFixture fixture = newFixture(configBuilder(2).build());
        fixture.setup();
        LocalNode node1 = factory.getNode(1);
        node1.stop();

        fixture.setup();

        assertThat(node1.isRunning()).isTrue();
        assertThat(node1.getStartCount()).isEqualTo(2);
        assertThat(factory.getCreatedNodes()).hasSize(2);
    }

    @Test
    public void when_twoNodes_then_secondaryHasNoSuffix() {
        ReplicaSetFixture fixture = newFixture(configBuilder(2).build());

        fixture.setup();

        assertThat(fixture.getNodes()).extracting(node -> node.getOptions().getName())
                                      .containsExactly("primary", "secondary");
    }

    @Test
    public void when_allNodesElectable_then_nodesAreNamedByIndex() {
        ReplicaSetFixture fixture = newFixture(configBuilder(3).setAllNodesElectable(true).build());

        fixture.setup();

        assertThat(fixture.getNodes()).extracting(node -> node.getOptions().getName())
                                      .containsExactly("node0", "node1", "node2");
        assertThat(fixture.getDriverUrl()).isEqualTo(
                "mongodb://localhost:20000,localhost:20001,localhost:20002/?replicaSet=rs");
    }

    @Test
    public void test_nodeOptions() {
        Map<String, Object> setParameters = new LinkedHashMap<>();
        setParameters.put("enableTestCommands", 1);
        Map<String, Object> nodeOptions = new LinkedHashMap<>();
        nodeOptions.put("oplogSize", 511);
        nodeOptions.put("setParameters", setParameters);
        ReplicaSetConfig config = configBuilder(2).setReplicaSetName("shard0").setDbpathPrefix("/tmp/fixture")
                                                  .setPreserveDbpath(true).setNodeOptions(nodeOptions).build();
        ReplicaSetFixture fixture = newFixture(config);

        fixture.setup();

        Node node1 = fixture.getNodes().get(1);
        assertThat(node1.getOptions().getDbpath()).isEqualTo(Paths.get("/tmp/fixture", "node1"));
        assertThat(node1.getOptions().isPreserveDbpath()).isTrue();
        assertThat(node1.getOptions().getReplicaSetName()).isEqualTo("shard0");
        assertThat(node1.getOptions().getServerOptions()).containsEntry("oplogSize", 511)
                                                         .containsEntry("replSet", "shard0")
                                                         .doesNotContainKey("setParameters");
        assertThat(node1.getOptions().getSetParameters()).containsEntry("enableTestCommands", 1);
        assertThat(fixture.getInternalAddress()).startsWith("shard0/");
    }

    @Test
    public void when_dbpathNodeOptionGiven_then_itOverridesPrefix() {
        ReplicaSetConfig config = configBuilder(2).setNodeOptions(Collections.singletonMap("dbpath", "/data/rs1"))
                                                  .build();
        ReplicaSetFixture fixture = newFixture(config);

        fixture.setup();

        assertThat(fixture.getNodes().get(0).getOptions().getDbpath()).isEqualTo(Paths.get("/data/rs1", "node0"));
    }

    @Test
    @SuppressWarnings("unchecked")
    public void when_linearChain_then_eachNodeSyncsFromPredecessor() {
        ReplicaSetFixture fixture = newFixture(configBuilder(3).setLinearChain(true).build());

        fixture.setup();

        List<Node> nodes = fixture.getNodes();
        assertThat(nodes.get(0).getOptions().getSetParameters()).doesNotContainKey(FORCE_SYNC_SOURCE_FAILPOINT);
        for (int i = 1; i < nodes.size(); i++) {
            Map<String, Object> failpoint = (Map<String, Object>) nodes.get(i).getOptions().getSetParameters()
                                                                       .get(FORCE_SYNC_SOURCE_FAILPOINT);
            assertThat(failpoint).containsEntry("mode", "alwaysOn");
            assertThat((Map<String, Object>) failpoint.get("data")).containsEntry("hostAndPort",
                    nodes.get(i - 1).getInternalAddress());
        }
    }

    @Test
    public void when_initialSyncNodeRequested_then_hiddenMemberJoinsAndStopsFirst() {
        ReplicaSetFixture fixture = newFixture(configBuilder(2).setStartInitialSyncNode(true).build());

        fixture.setup();
        fixture.awaitReady();

        Node hidden = fixture.getHiddenSyncMember();
        assertThat(hidden).isNotNull();
        assertThat(hidden.getIndex()).isEqualTo(2);
        assertThat(hidden.getOptions().getName()).isEqualTo("initsync");
        assertThat(((LocalNode) hidden).getRole()).isEqualTo(LocalNode.Role.SECONDARY);
        assertThat(fixture.getNodes()).hasSize(2);
        assertThat(fixture.getInternalAddress()).isEqualTo("rs/localhost:20000,localhost:20001,localhost:20002");

        LocalNode node0 = factory.getNode(0);
        assertThat(membersOf(node0.getCommandArguments(REPL_SET_INITIATE_COMMAND).get(0))).hasSize(1);
        assertThat(membersOf(node0.getCommandArguments(REPL_SET_RECONFIG_COMMAND).get(0))).hasSize(3);

        assertThat(fixture.teardown()).isTrue();
        assertThat(factory.getStopOrder()).containsExactly("initsync", "secondary", "primary");
    }

    @Test
    public void when_singleNodeWithInitialSyncNode_then_hiddenMemberBecomesFollower() {
        ReplicaSetFixture fixture = newFixture(configBuilder(1).setStartInitialSyncNode(true)
                                                               .setReadinessTimeoutSecs(5).build());

        fixture.setup();
        fixture.awaitReady();

        LocalNode hidden = (LocalNode) fixture.getHiddenSyncMember();
        assertThat(hidden).isNotNull();
        assertThat(hidden.getRole()).isEqualTo(LocalNode.Role.SECONDARY);
        LocalNode node0 = factory.getNode(0);
        assertThat(node0.getCommandCount(REPL_SET_RECONFIG_COMMAND)).isEqualTo(1);
        assertThat(membersOf(node0.getCommandArguments(REPL_SET_RECONFIG_COMMAND).get(0))).hasSize(2);
        assertThat(fixture.getStatus()).isEqualTo(READY);

        assertThat(fixture.teardown()).isTrue();
        assertThat(factory.getStopOrder()).containsExactly("initsync", "primary");
    }

    @Test
    public void when_secondFollowerFailsToStop_then_teardownStopsOthersAndFails() {
        ReplicaSetFixture fixture = newFixture(configBuilder(4).build());
        fixture.setup();
        factory.getNode(2).setStopResult(false);

        boolean success = fixture.teardown();

        assertThat(success).isFalse();
        assertThat(factory.getStopOrder()).containsExactly("secondary2", "secondary1", "secondary0", "primary");
        assertThat(factory.getCreatedNodes()).noneMatch(LocalNode::isRunning);
        assertThat(fixture.getStatus()).isEqualTo(TORN_DOWN);
    }

    @Test
    public void when_stopThrows_then_teardownStopsOthersAndFails() {
        ReplicaSetFixture fixture = newFixture(configBuilder(3).build());
        fixture.setup();
        factory.getNode(2).setStopFailure(new NodeProcessException("kill failed"));

        boolean success = fixture.teardown();

        assertThat(success).isFalse();
        assertThat(factory.getStopOrder()).containsExactly("secondary1", "secondary0", "primary");
    }

    @Test
    public void when_nothingRunning_then_teardownSucceeds() {
        ReplicaSetFixture fixture = newFixture(configBuilder(2).build());

        assertThat(fixture.teardown()).isTrue();
        assertThat(fixture.getStatus()).isEqualTo(TORN_DOWN);
    }

    @Test
    public void when_tornDown_then_specIsFrozen() {
        ReplicaSetFixtureImpl fixture = (ReplicaSetFixtureImpl) newFixture(configBuilder(2).build());
        fixture.setup();

        fixture.teardown();

        assertThat(fixture.getSpec().isFrozen()).isTrue();
    }

    @Test
    public void test_isRunning() {
        ReplicaSetFixture fixture = newFixture(configBuilder(2).setStartInitialSyncNode(true).build());
        assertThat(fixture.isRunning()).isFalse();

        fixture.setup();
        assertThat(fixture.isRunning()).isTrue();

        factory.getNode(1).stop();
        assertThat(fixture.isRunning()).isTrue();

        fixture.getHiddenSyncMember().stop();
        assertThat(fixture.isRunning()).isFalse();
    }

    @Test
    public void when_regularNodeStopped_then_notRunning() {
        ReplicaSetFixture fixture = newFixture(configBuilder(2).build());
        fixture.setup();

        factory.getNode(0).stop();

        assertThat(fixture.isRunning()).isFalse();
    }

    @Test(expected = IllegalStateException.class)
    public void when_internalAddressBeforeSetup_then_fails() {
        newFixture(configBuilder(2).build()).getInternalAddress();
    }

    @Test(expected = IllegalStateException.class)
    public void when_driverUrlBeforeSetup_then_fails() {
        newFixture(configBuilder(2).build()).getDriverUrl();
    }

    @Test(expected = IllegalStateException.class)
    public void when_awaitReadyBeforeSetup_then_fails() {
        newFixture(configBuilder(2).build()).awaitReady();
    }

    @Test(expected = IllegalStateException.class)
    public void when_setupAfterTeardown_then_fails() {
        ReplicaSetFixture fixture = newFixture(configBuilder(2).build());
        fixture.setup();
        fixture.teardown();

        fixture.setup();
    }

    @Test(expected = IllegalStateException.class)
    public void when_builtTwice_then_fails() {
        ReplicaSetFixture.ReplicaSetFixtureBuilder builder = ReplicaSetFixture.newBuilder().setNodeFactory(factory);
        builder.build();
        builder.build();
    }

    @Test(expected = IllegalStateException.class)
    public void when_nodeFactoryMissing_then_buildFails() {
        ReplicaSetFixture.newBuilder().build();
    }

    @Test
    public void when_credentialsConfigured_then_clientsAreAuthenticated() {
        AuthOptions authOptions = AuthOptions.newBuilder().setUsername("admin").setPassword("secret").build();
        ReplicaSetFixture fixture = newFixture(configBuilder(2).setAuthOptions(authOptions).build(),
                                               node -> node.setAuthRequired(true));

        fixture.setup();
        fixture.awaitReady();

        LocalNode node0 = factory.getNode(0);
        assertThat(node0.getAuthenticationCount()).isEqualTo(2);
        assertThat(node0.getCommandCount(REFRESH_SESSION_CACHE_COMMAND)).isEqualTo(1);
    }

    @Test
    public void when_credentialsMissing_then_setupFailsOnAuthRequiredNode() {
        ReplicaSetFixture fixture = newFixture(configBuilder(2).build(), node -> node.setAuthRequired(true));

        try {
            fixture.setup();
            fail();
        } catch (CommandFailedException e) {
            assertThat(e.getCode()).isEqualTo(LocalClusterClient.UNAUTHORIZED_CODE);
        }
    }

    @Test
    public void when_existingConfig_then_setupSkipsBootstrap() {
        ReplicaSetFixture fixture = newFixture(configBuilder(2).build(), node -> {
            node.setReplicaSetConfig(Collections.singletonMap("_id", "rs"));
            node.setRole(node.getIndex() == 0 ? LocalNode.Role.PRIMARY : LocalNode.Role.SECONDARY);
        });

        fixture.setup();
        fixture.awaitReady();

        assertThat(factory.getNode(0).getCommandCount(REPL_SET_INITIATE_COMMAND)).isEqualTo(0);
        assertThat(fixture.getStatus()).isEqualTo(READY);
    }

    @Test
    public void when_nodeFailsToStart_then_setupFails() {
        NodeProcessException error = new NodeProcessException("port in use");
        ReplicaSetFixture fixture = newFixture(configBuilder(2).build(), node -> {
            if (node.getIndex() == 1) {
                node.setStartFailure(error);
            }
        });

        try {
            fixture.setup();
            fail();
        } catch (NodeProcessException e) {
            assertThat(e).isSameAs(error);
        }

        assertThat(fixture.getStatus()).isEqualTo(UNCONFIGURED);
    }

    @Test
    public void when_allNodesElectable_then_leaderIsDiscoveredAfterFailover() {
        ReplicaSetFixture fixture = newFixture(configBuilder(3).setAllNodesElectable(true).build());
        fixture.setup();
        fixture.awaitReady();
        List<LocalNode> nodes = factory.getCreatedNodes();

        nodes.get(0).setRole(LocalNode.Role.SECONDARY);
        nodes.get(2).setRole(LocalNode.Role.PRIMARY);

        assertThat(fixture.getLeader()).isSameAs(nodes.get(2));
        assertThat(fixture.getFollowers()).containsExactly(nodes.get(0), nodes.get(1));
    }

    @Test
    public void when_noPrimary_then_leaderDiscoveryTimeoutIsCounted() {
        ReplicaSetFixture fixture = newFixture(configBuilder(3).setAllNodesElectable(true).build());
        fixture.setup();
        factory.getNode(0).setRole(LocalNode.Role.SECONDARY);

        try {
            fixture.getLeader(1);
            fail();
        } catch (LeaderDiscoveryTimeoutException e) {
            assertThat(e.getReplicaSetName()).isEqualTo("rs");
        }

        assertThat(meterRegistry.get(LEADER_DISCOVERY_TIMEOUTS_METRIC).counter().count()).isEqualTo(1);
    }

    @Test
    public void test_metrics() {
        ReplicaSetFixture fixture = newFixture(configBuilder(3).build(), node -> {
            if (node.getIndex() == 0) {
                node.failNext(REPL_SET_RECONFIG_COMMAND, new NodeNotFoundException("heartbeat timed out"), 1);
            }
        });
        assertThat(meterRegistry.get(STATUS_METRIC).tag("replicaSet", "rs").gauge().value())
                .isEqualTo(UNCONFIGURED.ordinal());

        fixture.setup();
        fixture.awaitReady();

        assertThat(meterRegistry.get(STATUS_METRIC).gauge().value()).isEqualTo(READY.ordinal());
        assertThat(meterRegistry.get(COMMAND_RETRIES_METRIC).counter().count()).isEqualTo(1);
        assertThat(meterRegistry.get(SETUP_TIME_METRIC).timer().count()).isEqualTo(1);
        assertThat(clock.getSleeps()).containsExactly(5000L);
    }

}
