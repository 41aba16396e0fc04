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

package io.replfixture;

import io.replfixture.ReplicaSetConfig.ReplicaSetConfigBuilder;
import io.replfixture.client.AuthOptions;
import io.replfixture.client.AuthOptions.AuthOptionsBuilder;
import org.yaml.snakeyaml.Yaml;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.Map;

import static io.replfixture.YamlReplicaSetConfigFields.ALL_NODES_ELECTABLE_FIELD_NAME;
import static io.replfixture.YamlReplicaSetConfigFields.AUTH_AUTHENTICATION_DATABASE_FIELD_NAME;
import static io.replfixture.YamlReplicaSetConfigFields.AUTH_FIELD_NAME;
import static io.replfixture.YamlReplicaSetConfigFields.AUTH_MECHANISM_FIELD_NAME;
import static io.replfixture.YamlReplicaSetConfigFields.AUTH_PASSWORD_FIELD_NAME;
import static io.replfixture.YamlReplicaSetConfigFields.AUTH_USERNAME_FIELD_NAME;
import static io.replfixture.YamlReplicaSetConfigFields.CONFIG_SERVER_FIELD_NAME;
import static io.replfixture.YamlReplicaSetConfigFields.DBPATH_PREFIX_FIELD_NAME;
import static io.replfixture.YamlReplicaSetConfigFields.INITIATE_ATTEMPTS_FIELD_NAME;
import static io.replfixture.YamlReplicaSetConfigFields.INITIATE_RETRY_DELAY_MILLIS_FIELD_NAME;
import static io.replfixture.YamlReplicaSetConfigFields.LEADER_DISCOVERY_TIMEOUT_SECS_FIELD_NAME;
import static io.replfixture.YamlReplicaSetConfigFields.LINEAR_CHAIN_FIELD_NAME;
import static io.replfixture.YamlReplicaSetConfigFields.NODE_COUNT_FIELD_NAME;
import static io.replfixture.YamlReplicaSetConfigFields.NODE_OPTIONS_FIELD_NAME;
import static io.replfixture.YamlReplicaSetConfigFields.POLL_INTERVAL_MILLIS_FIELD_NAME;
import static io.replfixture.YamlReplicaSetConfigFields.PRESERVE_DBPATH_FIELD_NAME;
import static io.replfixture.YamlReplicaSetConfigFields.READINESS_TIMEOUT_SECS_FIELD_NAME;
import static io.replfixture.YamlReplicaSetConfigFields.REPLICA_SET_CONFIG_CONTAINER_NAME;
import static io.replfixture.YamlReplicaSetConfigFields.REPLICA_SET_NAME_FIELD_NAME;
import static io.replfixture.YamlReplicaSetConfigFields.SETTINGS_FIELD_NAME;
import static io.replfixture.YamlReplicaSetConfigFields.START_INITIAL_SYNC_NODE_FIELD_NAME;
import static io.replfixture.YamlReplicaSetConfigFields.USE_REPLICA_SET_CONNECTION_STRING_FIELD_NAME;
import static io.replfixture.YamlReplicaSetConfigFields.VOTING_SECONDARIES_FIELD_NAME;
import static io.replfixture.YamlReplicaSetConfigFields.WRITE_CONCERN_MAJORITY_JOURNAL_DEFAULT_FIELD_NAME;
import static java.util.Objects.requireNonNull;

/**
 * {@link ReplicaSetConfig} parser for YAML files.
 */
public final class YamlReplicaSetConfigParser {

    /*
        A sample YAML string is below:
        ---
        replica-set:
         replica-set-name: shard0
         node-count: 3
         all-nodes-electable: true
         start-initial-sync-node: true
         settings:
          electionTimeoutMillis: 5000
         node-options:
          oplogSize: 511
         auth:
          username: admin
          password: secret
         initiate-attempts: 5
         readiness-timeout-secs: 300

     */
    private YamlReplicaSetConfigParser() {
    }

    /**
     * Loads a parameter map from the yaml object with the given string and
     * populates a {@link ReplicaSetConfig} object from the returned parameter
     * map.
     *
     * @return the created ReplicaSetConfig object
     *
     * @throws NullPointerException
     *         if no yaml object or string passed, or no ReplicaSetConfig
     *         present in the string
     * @throws ClassCastException
     *         if a configuration value has wrong type
     * @see ReplicaSetConfig
     */
    public static ReplicaSetConfig parseString(Yaml yaml, String string) {
        requireNonNull(yaml, "No yaml object!");
        requireNonNull(string, "No yaml string!");

        return parse(yaml.load(string));
    }

    /**
     * Loads a parameter map from the yaml object with the given reader and
     * populates a {@link ReplicaSetConfig} object from the returned parameter
     * map.
     *
     * @return the created ReplicaSetConfig object
     *
     * @throws NullPointerException
     *         if no yaml object or reader passed, or no ReplicaSetConfig
     *         present in the reader
     * @throws ClassCastException
     *         if a configuration value has wrong type
     * @see ReplicaSetConfig
     */
    public static ReplicaSetConfig parseReader(Yaml yaml, Reader reader) {
        requireNonNull(yaml, "No yaml object!");
        requireNonNull(reader, "No reader!");

        Map<String, Object> parameters = yaml.load(reader);
        return parse(parameters);
    }

    /**
     * Loads a parameter map from the yaml object with the given file and
     * populates a {@link ReplicaSetConfig} object from the returned parameter
     * map.
     *
     * @return the created ReplicaSetConfig object
     *
     * @throws IOException
     *         if an error occurs during reading the file
     * @see #parseFile(Yaml, File)
     */
    public static ReplicaSetConfig parseFile(Yaml yaml, String filePath)
            throws IOException {
        return parseFile(yaml, new File(filePath));
    }

    /**
     * Loads a parameter map from the yaml object with the given file and
     * populates a {@link ReplicaSetConfig} object from the returned parameter
     * map.
     *
     * @return the created ReplicaSetConfig object
     *
     * @throws IOException
     *         if an error occurs during reading the file
     * @throws NullPointerException
     *         if no yaml object or file passed, or no ReplicaSetConfig
     *         present in the file
     * @throws ClassCastException
     *         if a configuration value has wrong type
     * @see ReplicaSetConfig
     */
    public static ReplicaSetConfig parseFile(Yaml yaml, File file)
            throws IOException {
        requireNonNull(yaml, "No yaml object!");
        requireNonNull(file, "No file!");

        try (Reader reader = new InputStreamReader(new FileInputStream(file), StandardCharsets.UTF_8)) {
            return parseReader(yaml, reader);
        }
    }

    /**
     * Loads a parameter map from the yaml object with the given stream and
     * populates a {@link ReplicaSetConfig} object from the returned parameter
     * map.
     *
     * @return the created ReplicaSetConfig object
     *
     * @throws NullPointerException
     *         if no yaml object or input stream passed, or no
     *         ReplicaSetConfig present in the stream
     * @throws ClassCastException
     *         if a configuration value has wrong type
     * @see ReplicaSetConfig
     */
    public static ReplicaSetConfig parseInputStream(Yaml yaml, InputStream inputStream) {
        requireNonNull(yaml, "No yaml object!");
        requireNonNull(inputStream, "No input stream!");

        return parse(yaml.load(inputStream));
    }

    @SuppressWarnings({"checkstyle:npathcomplexity", "checkstyle:cyclomaticcomplexity", "unchecked"})
    private static ReplicaSetConfig parse(Map<String, Object> map) {
        requireNonNull(map, "ReplicaSetConfig not provided!");
        Map<String, Object> params = (Map<String, Object>) map.get(REPLICA_SET_CONFIG_CONTAINER_NAME);
        requireNonNull(params, "ReplicaSetConfig not provided!");

        ReplicaSetConfigBuilder builder = ReplicaSetConfig.newBuilder();

        String replicaSetName = (String) params.get(REPLICA_SET_NAME_FIELD_NAME);
        if (replicaSetName != null) {
            builder.setReplicaSetName(replicaSetName);
        }

        Integer nodeCount = (Integer) params.get(NODE_COUNT_FIELD_NAME);
        if (nodeCount != null) {
            builder.setNodeCount(nodeCount);
        }

        Boolean allNodesElectable = (Boolean) params.get(ALL_NODES_ELECTABLE_FIELD_NAME);
        if (allNodesElectable != null) {
            builder.setAllNodesElectable(allNodesElectable);
        }

        Boolean votingSecondaries = (Boolean) params.get(VOTING_SECONDARIES_FIELD_NAME);
        if (votingSecondaries != null) {
            builder.setVotingSecondaries(votingSecondaries);
        }

        Boolean useReplicaSetConnectionString = (Boolean) params.get(USE_REPLICA_SET_CONNECTION_STRING_FIELD_NAME);
        if (useReplicaSetConnectionString != null) {
            builder.setUseReplicaSetConnectionString(useReplicaSetConnectionString);
        }

        Boolean linearChain = (Boolean) params.get(LINEAR_CHAIN_FIELD_NAME);
        if (linearChain != null) {
            builder.setLinearChain(linearChain);
        }

        Boolean startInitialSyncNode = (Boolean) params.get(START_INITIAL_SYNC_NODE_FIELD_NAME);
        if (startInitialSyncNode != null) {
            builder.setStartInitialSyncNode(startInitialSyncNode);
        }

        Boolean writeConcernMajorityJournalDefault = (Boolean) params
                .get(WRITE_CONCERN_MAJORITY_JOURNAL_DEFAULT_FIELD_NAME);
        if (writeConcernMajorityJournalDefault != null) {
            builder.setWriteConcernMajorityJournalDefault(writeConcernMajorityJournalDefault);
        }

        Boolean configServer = (Boolean) params.get(CONFIG_SERVER_FIELD_NAME);
        if (configServer != null) {
            builder.setConfigServer(configServer);
        }

        Map<String, Object> settings = (Map<String, Object>) params.get(SETTINGS_FIELD_NAME);
        if (settings != null) {
            builder.setSettings(settings);
        }

        Map<String, Object> nodeOptions = (Map<String, Object>) params.get(NODE_OPTIONS_FIELD_NAME);
        if (nodeOptions != null) {
            builder.setNodeOptions(nodeOptions);
        }

        String dbpathPrefix = (String) params.get(DBPATH_PREFIX_FIELD_NAME);
        if (dbpathPrefix != null) {
            builder.setDbpathPrefix(dbpathPrefix);
        }

        Boolean preserveDbpath = (Boolean) params.get(PRESERVE_DBPATH_FIELD_NAME);
        if (preserveDbpath != null) {
            builder.setPreserveDbpath(preserveDbpath);
        }

        Map<String, Object> auth = (Map<String, Object>) params.get(AUTH_FIELD_NAME);
        if (auth != null) {
            builder.setAuthOptions(parseAuthOptions(auth));
        }

        Number pollIntervalMillis = (Number) params.get(POLL_INTERVAL_MILLIS_FIELD_NAME);
        if (pollIntervalMillis != null) {
            builder.setPollIntervalMillis(pollIntervalMillis.longValue());
        }

        Integer initiateAttempts = (Integer) params.get(INITIATE_ATTEMPTS_FIELD_NAME);
        if (initiateAttempts != null) {
            builder.setInitiateAttempts(initiateAttempts);
        }

        Number initiateRetryDelayMillis = (Number) params.get(INITIATE_RETRY_DELAY_MILLIS_FIELD_NAME);
        if (initiateRetryDelayMillis != null) {
            builder.setInitiateRetryDelayMillis(initiateRetryDelayMillis.longValue());
        }

        Number leaderDiscoveryTimeoutSecs = (Number) params.get(LEADER_DISCOVERY_TIMEOUT_SECS_FIELD_NAME);
        if (leaderDiscoveryTimeoutSecs != null) {
            builder.setLeaderDiscoveryTimeoutSecs(leaderDiscoveryTimeoutSecs.longValue());
        }

        Number readinessTimeoutSecs = (Number) params.get(READINESS_TIMEOUT_SECS_FIELD_NAME);
        if (readinessTimeoutSecs != null) {
            builder.setReadinessTimeoutSecs(readinessTimeoutSecs.longValue());
        }

        return builder.build();
    }

    private static AuthOptions parseAuthOptions(Map<String, Object> auth) {
        AuthOptionsBuilder builder = AuthOptions.newBuilder();

        String authenticationDatabase = (String) auth.get(AUTH_AUTHENTICATION_DATABASE_FIELD_NAME);
        if (authenticationDatabase != null) {
            builder.setAuthenticationDatabase(authenticationDatabase);
        }

        String username = (String) auth.get(AUTH_USERNAME_FIELD_NAME);
        if (username != null) {
            builder.setUsername(username);
        }

        String password = (String) auth.get(AUTH_PASSWORD_FIELD_NAME);
        if (password != null) {
            builder.setPassword(password);
        }

        String mechanism = (String) auth.get(AUTH_MECHANISM_FIELD_NAME);
        if (mechanism != null) {
            builder.setAuthenticationMechanism(mechanism);
        }

        return builder.build();
    }

}
