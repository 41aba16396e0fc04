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

package io.replfixture.impl.local;

import io.replfixture.client.ClusterClient;
import io.replfixture.client.ReadPreference;
import io.replfixture.exception.CommandFailedException;
import io.replfixture.exception.NodeProcessException;
import io.replfixture.node.Node;
import io.replfixture.node.NodeOptions;

import javax.annotation.Nonnull;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static java.util.stream.Collectors.toList;

/**
 * An in-memory node. Its role changes only when it receives replica set
 * commands, or when a test changes it explicitly.
 */
public final class LocalNode implements Node {

    public enum Role {
        NONE, PRIMARY, SECONDARY
    }

    private final LocalNodeFactory factory;
    private final NodeOptions options;
    private final int port;
    private final List<Map<String, Object>> receivedCommands = new ArrayList<>();
    private final List<ReadPreference> clientReadPreferences = new ArrayList<>();
    private final Map<String, Deque<CommandFailedException>> faults = new HashMap<>();
    private boolean running;
    private int startCount;
    private int stopCount;
    private boolean stopResult = true;
    private NodeProcessException stopFailure;
    private NodeProcessException startFailure;
    private boolean connectionLost;
    private Role role = Role.NONE;
    private Map<String, Object> replicaSetConfig;
    private int pollsBeforeRole;
    private boolean persistentStorage = true;
    private Boolean journalEnabled;
    private boolean authRequired;
    private int authenticationCount;

    LocalNode(LocalNodeFactory factory, NodeOptions options, int port) {
        this.factory = factory;
        this.options = options;
        this.port = port;
    }

    @Override
    public int getIndex() {
        return options.getIndex();
    }

    @Override
    public int getPort() {
        return port;
    }

    @Nonnull
    @Override
    public String getInternalAddress() {
        return "localhost:" + port;
    }

    @Nonnull
    @Override
    public String getDriverUrl() {
        return "mongodb://localhost:" + port;
    }

    @Nonnull
    @Override
    public NodeOptions getOptions() {
        return options;
    }

    @Override
    public void start() {
        if (startFailure != null) {
            throw startFailure;
        }

        running = true;
        startCount++;
    }

    @Override
    public void awaitReady() {
        if (!running) {
            throw new NodeProcessException(this + " is not running");
        }
    }

    @Override
    public boolean stop() {
        stopCount++;
        if (!running) {
            return true;
        }

        running = false;
        factory.onStop(this);
        if (stopFailure != null) {
            throw stopFailure;
        }

        return stopResult;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Nonnull
    @Override
    public ClusterClient client(@Nonnull ReadPreference readPreference) {
        clientReadPreferences.add(readPreference);
        return new LocalClusterClient(factory, this);
    }

    public LocalNodeFactory getFactory() {
        return factory;
    }

    public int getStartCount() {
        return startCount;
    }

    public int getStopCount() {
        return stopCount;
    }

    public void setStopResult(boolean stopResult) {
        this.stopResult = stopResult;
    }

    public void setStopFailure(NodeProcessException stopFailure) {
        this.stopFailure = stopFailure;
    }

    public void setStartFailure(NodeProcessException startFailure) {
        this.startFailure = startFailure;
    }

    public void setRunning(boolean running) {
        this.running = running;
    }

    public boolean isConnectionLost() {
        return connectionLost;
    }

    public void setConnectionLost(boolean connectionLost) {
        this.connectionLost = connectionLost;
    }

    public Role getRole() {
        return role;
    }

    public void setRole(Role role) {
        this.role = role;
    }

    public Map<String, Object> getReplicaSetConfig() {
        return replicaSetConfig;
    }

    public void setReplicaSetConfig(Map<String, Object> replicaSetConfig) {
        this.replicaSetConfig = replicaSetConfig;
    }

    /**
     * Makes the node report no role to the given number of "isMaster"
     * commands before it reports its actual role.
     */
    public void setPollsBeforeRole(int pollsBeforeRole) {
        this.pollsBeforeRole = pollsBeforeRole;
    }

    boolean consumePollBeforeRole() {
        if (pollsBeforeRole > 0) {
            pollsBeforeRole--;
            return true;
        }

        return false;
    }

    public boolean isPersistentStorage() {
        return persistentStorage;
    }

    public void setPersistentStorage(boolean persistentStorage) {
        this.persistentStorage = persistentStorage;
    }

    public Boolean getJournalEnabled() {
        return journalEnabled;
    }

    public void setJournalEnabled(Boolean journalEnabled) {
        this.journalEnabled = journalEnabled;
    }

    public boolean isAuthRequired() {
        return authRequired;
    }

    public void setAuthRequired(boolean authRequired) {
        this.authRequired = authRequired;
    }

    public int getAuthenticationCount() {
        return authenticationCount;
    }

    void onAuthenticated() {
        authenticationCount++;
    }

    /**
     * Makes the next given number of commands with the given name fail with
     * the given error.
     */
    public void failNext(String commandName, CommandFailedException error, int times) {
        Deque<CommandFailedException> queue = faults.computeIfAbsent(commandName, name -> new ArrayDeque<>());
        for (int i = 0; i < times; i++) {
            queue.add(error);
        }
    }

    CommandFailedException pollFault(String commandName) {
        Deque<CommandFailedException> queue = faults.get(commandName);
        return queue != null ? queue.poll() : null;
    }

    void onCommand(Map<String, Object> command) {
        receivedCommands.add(command);
    }

    public List<Map<String, Object>> getReceivedCommands() {
        return new ArrayList<>(receivedCommands);
    }

    /**
     * Returns the arguments of the received commands with the given name.
     */
    @SuppressWarnings("unchecked")
    public List<Map<String, Object>> getCommandArguments(String commandName) {
        return receivedCommands.stream().filter(command -> command.containsKey(commandName))
                               .map(command -> (Map<String, Object>) command.get(commandName)).collect(toList());
    }

    public int getCommandCount(String commandName) {
        return (int) receivedCommands.stream().filter(command -> command.containsKey(commandName)).count();
    }

    public List<ReadPreference> getClientReadPreferences() {
        return new ArrayList<>(clientReadPreferences);
    }

    @Override
    public String toString() {
        return "LocalNode{" + "name=" + options.getName() + ", port=" + port + ", running=" + running + ", role="
               + role + '}';
    }

}
