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

package io.replfixture.impl.initiate;

import io.micrometer.core.instrument.Counter;
import io.replfixture.ReplicaSetConfig;
import io.replfixture.ReplicaSetFixtureStatus;
import io.replfixture.client.ClusterClient;
import io.replfixture.exception.CommandFailedException;
import io.replfixture.exception.NodeNotFoundException;
import io.replfixture.impl.monitor.ReadinessMonitor;
import io.replfixture.model.MemberDescriptor;
import io.replfixture.model.ReplicaSetSpec;
import io.replfixture.node.Node;
import io.replfixture.runtime.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

import static io.replfixture.ReplicaSetFixtureStatus.FULLY_CONFIGURED;
import static io.replfixture.ReplicaSetFixtureStatus.SINGLE_MEMBER_INITIATED;
import static io.replfixture.impl.util.PollingUtils.getNested;
import static io.replfixture.impl.util.PollingUtils.sleep;
import static io.replfixture.model.ReplicaSetSpec.ELECTION_TIMEOUT_MILLIS_SETTING;
import static java.util.Objects.requireNonNull;

/**
 * Bootstraps a replica set in two phases.
 * <p>
 * The first node is initiated as a single member replica set so that it
 * is elected quickly. Then the replica set is reconfigured with the full
 * member list. Both commands can fail with {@link NodeNotFoundException}
 * when a heartbeat times out during the quorum check, so they are retried
 * a bounded number of times. Any other failure is propagated immediately.
 */
public class ReplicaSetInitiator {

    public static final String REPL_SET_INITIATE_COMMAND = "replSetInitiate";

    public static final String REPL_SET_RECONFIG_COMMAND = "replSetReconfig";

    public static final String SERVER_STATUS_COMMAND = "serverStatus";

    public static final String GET_CMD_LINE_OPTS_COMMAND = "getCmdLineOpts";

    public static final String LOCAL_DATABASE = "local";

    public static final String REPLICA_SET_CONFIG_COLLECTION = "system.replset";

    /**
     * Election timeout used when secondaries vote and no timeout is
     * configured, to prevent spurious elections during tests.
     */
    public static final long VOTING_SECONDARIES_ELECTION_TIMEOUT_MILLIS = TimeUnit.HOURS.toMillis(24);

    private static final Logger LOGGER = LoggerFactory.getLogger(ReplicaSetInitiator.class);

    private final String localIdentity;
    private final ReplicaSetConfig config;
    private final ReadinessMonitor readinessMonitor;
    private final Sleeper sleeper;
    private final Counter retryCounter;

    public ReplicaSetInitiator(@Nonnull String localIdentity, @Nonnull ReplicaSetConfig config,
                               @Nonnull ReadinessMonitor readinessMonitor, @Nonnull Sleeper sleeper,
                               @Nonnull Counter retryCounter) {
        this.localIdentity = requireNonNull(localIdentity);
        this.config = requireNonNull(config);
        this.readinessMonitor = requireNonNull(readinessMonitor);
        this.sleeper = requireNonNull(sleeper);
        this.retryCounter = requireNonNull(retryCounter);
    }

    /**
     * Bootstraps the replica set unless the first node already has a
     * replica set configuration.
     *
     * @param spec
     *         the replica set config to fill in and send
     * @param members
     *         the full member list, the hidden member included
     * @param client
     *         client of the first node, already authenticated if needed
     * @param primary
     *         the first node
     * @param otherNodes
     *         the regular nodes other than the first node
     * @param hiddenSyncMember
     *         the hidden initial sync member, or null
     * @param statusListener
     *         notified after each completed phase
     *
     * @return true if the bootstrap ran, false if it is skipped because of
     *         an existing configuration
     *
     * @throws NodeNotFoundException
     *         if a quorum check keeps failing after all attempts
     * @throws CommandFailedException
     *         if a command is rejected
     */
    public boolean initiate(@Nonnull ReplicaSetSpec spec, @Nonnull List<MemberDescriptor> members,
                            @Nonnull ClusterClient client, @Nonnull Node primary, @Nonnull List<Node> otherNodes,
                            @Nullable Node hiddenSyncMember,
                            @Nonnull Consumer<ReplicaSetFixtureStatus> statusListener) {
        if (client.count(LOCAL_DATABASE, REPLICA_SET_CONFIG_COLLECTION) > 0) {
            LOGGER.info("{} Skipping replica set initiation since there is an existing configuration.",
                        localIdentity);
            statusListener.accept(FULLY_CONFIGURED);
            return false;
        }

        Duration readinessTimeout = getReadinessTimeout();

        prepareInitialSpec(spec, client);
        spec.setMembers(Collections.singletonList(members.get(0)));
        runWithRetry(client, REPL_SET_INITIATE_COMMAND, spec);
        readinessMonitor.awaitLeader(primary, readinessTimeout);
        statusListener.accept(SINGLE_MEMBER_INITIATED);

        // the hidden member joins only through the reconfig, even in a single node replica set
        if (members.size() > 1) {
            for (Node node : otherNodes) {
                node.awaitReady();
            }

            spec.setVersion(2);
            spec.setMembers(members);
            runWithRetry(client, REPL_SET_RECONFIG_COMMAND, spec);

            List<Node> followers = new ArrayList<>(otherNodes);
            if (hiddenSyncMember != null) {
                followers.add(hiddenSyncMember);
            }
            readinessMonitor.awaitFollowers(followers, readinessTimeout);
        }

        statusListener.accept(FULLY_CONFIGURED);
        return true;
    }

    private Duration getReadinessTimeout() {
        Long timeoutSecs = config.getReadinessTimeoutSecs();
        return timeoutSecs != null ? Duration.ofSeconds(timeoutSecs) : null;
    }

    private void prepareInitialSpec(ReplicaSetSpec spec, ClusterClient client) {
        Boolean writeConcernMajorityJournalDefault = config.getWriteConcernMajorityJournalDefault();
        if (writeConcernMajorityJournalDefault != null) {
            spec.setWriteConcernMajorityJournalDefault(writeConcernMajorityJournalDefault);
        } else if (!isDurableStorage(client)) {
            spec.setWriteConcernMajorityJournalDefault(false);
        }

        if (config.isConfigServer()) {
            spec.setConfigServer(true);
        }

        if (!config.getSettings().isEmpty()) {
            spec.putSettings(config.getSettings());
        }

        if (config.isVotingSecondaries()) {
            spec.putSettingIfAbsent(ELECTION_TIMEOUT_MILLIS_SETTING, VOTING_SECONDARIES_ELECTION_TIMEOUT_MILLIS);
        }
    }

    /**
     * Majority writes are acknowledged from the journal only if the storage
     * engine is persistent and journaling is not disabled.
     */
    private boolean isDurableStorage(ClusterClient client) {
        Map<String, Object> serverStatus = client.runAdminCommand(singleFieldCommand(SERVER_STATUS_COMMAND));
        Map<String, Object> cmdLineOpts = client.runAdminCommand(singleFieldCommand(GET_CMD_LINE_OPTS_COMMAND));
        Object persistent = getNested(serverStatus, "storageEngine", "persistent");
        Object journalEnabled = getNested(cmdLineOpts, "parsed", "storage", "journal", "enabled");

        return !Boolean.FALSE.equals(persistent) && !Boolean.FALSE.equals(journalEnabled);
    }

    private void runWithRetry(ClusterClient client, String commandName, ReplicaSetSpec spec) {
        Map<String, Object> command = new LinkedHashMap<>();
        command.put(commandName, spec.toDocument());
        LOGGER.info("{} Issuing {} command: {}", localIdentity, commandName, command);

        int attempts = config.getInitiateAttempts();
        for (int attempt = 1; ; attempt++) {
            try {
                client.runAdminCommand(command);
                return;
            } catch (NodeNotFoundException e) {
                retryCounter.increment();
                LOGGER.error("{} {} failed attempt {} of {} with error: {}", localIdentity, commandName, attempt,
                             attempts, e.getMessage());
                if (attempt >= attempts) {
                    throw e;
                }

                sleep(sleeper, config.getInitiateRetryDelayMillis());
            }
        }
    }

    private static Map<String, Object> singleFieldCommand(String commandName) {
        Map<String, Object> command = new LinkedHashMap<>();
        command.put(commandName, 1);
        return command;
    }

}
