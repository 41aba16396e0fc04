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

package io.replfixture.model;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static java.util.Objects.requireNonNull;
import static java.util.stream.Collectors.toList;

/**
 * The replica set configuration document sent to the first node of a
 * fixture.
 * <p>
 * The same object is used in both bootstrap phases. It first carries only
 * the first member with version 1 for the initiate command, then the full
 * member list with version 2 for the reconfigure command. It cannot be
 * changed anymore after {@link #freeze()} is called.
 */
public final class ReplicaSetSpec {

    /**
     * Settings field name of the election timeout.
     */
    public static final String ELECTION_TIMEOUT_MILLIS_SETTING = "electionTimeoutMillis";

    private final String name;
    private final List<MemberDescriptor> members = new ArrayList<>();
    private final Map<String, Object> settings = new LinkedHashMap<>();
    private int version = 1;
    private boolean configServer;
    private Boolean writeConcernMajorityJournalDefault;
    private boolean frozen;

    public ReplicaSetSpec(@Nonnull String name) {
        this.name = requireNonNull(name);
    }

    @Nonnull
    public String getName() {
        return name;
    }

    @Nonnull
    public List<MemberDescriptor> getMembers() {
        return Collections.unmodifiableList(members);
    }

    public void setMembers(@Nonnull List<MemberDescriptor> members) {
        requireNonNull(members);
        checkNotFrozen();
        if (members.isEmpty()) {
            throw new IllegalArgumentException("Replica set " + name + " must have at least one member!");
        }

        List<MemberDescriptor> copy = new ArrayList<>(members);
        this.members.clear();
        this.members.addAll(copy);
    }

    @Nonnull
    public Map<String, Object> getSettings() {
        return Collections.unmodifiableMap(settings);
    }

    public void putSettings(@Nonnull Map<String, Object> settings) {
        checkNotFrozen();
        this.settings.putAll(requireNonNull(settings));
    }

    /**
     * Sets the given setting only if it is not set yet.
     *
     * @param key
     *         the setting name
     * @param value
     *         the setting value
     */
    public void putSettingIfAbsent(@Nonnull String key, @Nonnull Object value) {
        checkNotFrozen();
        settings.putIfAbsent(requireNonNull(key), requireNonNull(value));
    }

    public int getVersion() {
        return version;
    }

    public void setVersion(int version) {
        checkNotFrozen();
        if (version < this.version) {
            throw new IllegalArgumentException("Replica set config version cannot go back from " + this.version
                                               + " to " + version);
        }

        this.version = version;
    }

    public boolean isConfigServer() {
        return configServer;
    }

    public void setConfigServer(boolean configServer) {
        checkNotFrozen();
        this.configServer = configServer;
    }

    @Nullable
    public Boolean getWriteConcernMajorityJournalDefault() {
        return writeConcernMajorityJournalDefault;
    }

    public void setWriteConcernMajorityJournalDefault(@Nullable Boolean writeConcernMajorityJournalDefault) {
        checkNotFrozen();
        this.writeConcernMajorityJournalDefault = writeConcernMajorityJournalDefault;
    }

    /**
     * Makes this object unmodifiable. Called when the fixture starts to tear
     * down.
     */
    public void freeze() {
        frozen = true;
    }

    public boolean isFrozen() {
        return frozen;
    }

    /**
     * Returns the configuration document sent in replica set initiate and
     * reconfigure commands. The version field is written only after the
     * first reconfiguration.
     *
     * @return the configuration document
     */
    @Nonnull
    public Map<String, Object> toDocument() {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("_id", name);
        if (writeConcernMajorityJournalDefault != null) {
            document.put("writeConcernMajorityJournalDefault", writeConcernMajorityJournalDefault);
        }
        if (configServer) {
            document.put("configsvr", true);
        }
        if (!settings.isEmpty()) {
            document.put("settings", new LinkedHashMap<>(settings));
        }
        document.put("members", members.stream().map(MemberDescriptor::toDocument).collect(toList()));
        if (version > 1) {
            document.put("version", version);
        }

        return document;
    }

    private void checkNotFrozen() {
        if (frozen) {
            throw new IllegalStateException("Replica set config of " + name + " cannot be changed after teardown!");
        }
    }

    @Override
    public String toString() {
        return "ReplicaSetSpec" + toDocument();
    }

}
