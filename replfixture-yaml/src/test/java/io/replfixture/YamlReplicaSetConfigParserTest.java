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

import io.replfixture.test.util.BaseTest;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.yaml.snakeyaml.Yaml;

import java.io.ByteArrayInputStream;
import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

public class YamlReplicaSetConfigParserTest
        extends BaseTest {

    @Rule
    public final TemporaryFolder folder = new TemporaryFolder();

    private final String yamlString = "replica-set:\n" + " replica-set-name: shard0\n" + " node-count: 3\n"
            + " all-nodes-electable: true\n" + " voting-secondaries: false\n" + " linear-chain: true\n"
            + " start-initial-sync-node: true\n" + " write-concern-majority-journal-default: true\n"
            + " config-server: false\n" + " settings:\n" + "  electionTimeoutMillis: 5000\n" + " node-options:\n"
            + "  oplogSize: 511\n" + " dbpath-prefix: /data/db/job0\n" + " preserve-dbpath: true\n" + " auth:\n"
            + "  username: admin\n" + "  password: secret\n" + " poll-interval-millis: 250\n"
            + " initiate-attempts: 5\n" + " initiate-retry-delay-millis: 1000\n"
            + " leader-discovery-timeout-secs: 60\n" + " readiness-timeout-secs: 300";

    @Test
    public void test_parseValidYamlString() {
        ReplicaSetConfig config = YamlReplicaSetConfigParser.parseString(new Yaml(), yamlString);

        assertConfig(config);
    }

    @Test
    public void test_parseValidYamlReader() {
        ReplicaSetConfig config = YamlReplicaSetConfigParser.parseReader(new Yaml(), new StringReader(yamlString));

        assertConfig(config);
    }

    @Test
    public void test_parseValidYamlInputStream() {
        ReplicaSetConfig config = YamlReplicaSetConfigParser.parseInputStream(new Yaml(), new ByteArrayInputStream(
                yamlString.getBytes(StandardCharsets.UTF_8)));

        assertConfig(config);
    }

    @Test
    public void test_parseValidYamlFile()
            throws IOException {
        File file = folder.newFile();
        try (FileWriter writer = new FileWriter(file)) {
            writer.write(yamlString);
        }

        assertConfig(YamlReplicaSetConfigParser.parseFile(new Yaml(), file));
        assertConfig(YamlReplicaSetConfigParser.parseFile(new Yaml(), file.getPath()));
    }

    @Test(expected = NullPointerException.class)
    public void test_nonExistingConfig() {
        YamlReplicaSetConfigParser.parseString(new Yaml(), "other:\n a: 1");
    }

    @Test(expected = NullPointerException.class)
    public void test_nullString() {
        YamlReplicaSetConfigParser.parseString(new Yaml(), null);
    }

    @Test(expected = ClassCastException.class)
    public void test_wrongValueType() {
        YamlReplicaSetConfigParser.parseString(new Yaml(), "replica-set:\n node-count: three");
    }

    private void assertConfig(ReplicaSetConfig config) {
        assertThat(config.getReplicaSetName()).isEqualTo("shard0");
        assertThat(config.getNodeCount()).isEqualTo(3);
        assertThat(config.isAllNodesElectable()).isTrue();
        assertThat(config.isVotingSecondaries()).isFalse();
        assertThat(config.isUseReplicaSetConnectionString()).isTrue();
        assertThat(config.isLinearChain()).isTrue();
        assertThat(config.isStartInitialSyncNode()).isTrue();
        assertThat(config.getWriteConcernMajorityJournalDefault()).isTrue();
        assertThat(config.isConfigServer()).isFalse();
        assertThat(config.getSettings()).containsEntry("electionTimeoutMillis", 5000);
        assertThat(config.getNodeOptions()).containsEntry("oplogSize", 511);
        assertThat(config.getDbpathPrefix()).isEqualTo("/data/db/job0");
        assertThat(config.isPreserveDbpath()).isTrue();
        assertThat(config.getAuthOptions().getUsername()).isEqualTo("admin");
        assertThat(config.getAuthOptions().getAuthenticationDatabase()).isEqualTo("admin");
        assertThat(config.getPollIntervalMillis()).isEqualTo(250L);
        assertThat(config.getInitiateAttempts()).isEqualTo(5);
        assertThat(config.getInitiateRetryDelayMillis()).isEqualTo(1000L);
        assertThat(config.getLeaderDiscoveryTimeoutSecs()).isEqualTo(60L);
        assertThat(config.getReadinessTimeoutSecs()).isEqualTo(300L);
    }

}
