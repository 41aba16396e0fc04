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

package io.replfixture.node;

import javax.annotation.Nonnull;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Launch options of a single node of a replica set fixture.
 */
public final class NodeOptions {

    /**
     * Name of the server option that carries the replica set name.
     */
    public static final String REPL_SET_OPTION = "replSet";

    /**
     * Name of the server option that carries the data directory.
     */
    public static final String DBPATH_OPTION = "dbpath";

    /**
     * Name of the entry of the user-supplied server options that holds the
     * server parameters. It is moved to {@link #getSetParameters()}.
     */
    public static final String SET_PARAMETERS_OPTION = "setParameters";

    private final int index;
    private final String name;
    private final String replicaSetName;
    private final Path dbpath;
    private final boolean preserveDbpath;
    private final Map<String, Object> serverOptions;
    private final Map<String, Object> setParameters;

    private NodeOptions(NodeOptionsBuilder builder) {
        this.index = builder.index;
        this.name = builder.name;
        this.replicaSetName = builder.replicaSetName;
        this.dbpath = builder.dbpath;
        this.preserveDbpath = builder.preserveDbpath;
        Map<String, Object> serverOptions = new LinkedHashMap<>(builder.serverOptions);
        serverOptions.put(REPL_SET_OPTION, replicaSetName);
        serverOptions.put(DBPATH_OPTION, dbpath.toString());
        this.serverOptions = Collections.unmodifiableMap(serverOptions);
        this.setParameters = Collections.unmodifiableMap(new LinkedHashMap<>(builder.setParameters));
    }

    @Nonnull
    public static NodeOptionsBuilder newBuilder() {
        return new NodeOptionsBuilder();
    }

    public int getIndex() {
        return index;
    }

    /**
     * Returns the logical name of the node, i.e., "primary", "secondary1"
     * or "initsync". Used for naming the log output of the node.
     *
     * @return the logical name of the node
     */
    @Nonnull
    public String getName() {
        return name;
    }

    @Nonnull
    public String getReplicaSetName() {
        return replicaSetName;
    }

    @Nonnull
    public Path getDbpath() {
        return dbpath;
    }

    /**
     * Returns true if the data directory of the node must be kept when the
     * node is started again.
     *
     * @return true if the data directory must be kept
     */
    public boolean isPreserveDbpath() {
        return preserveDbpath;
    }

    /**
     * Returns the server options. Always contains the replica set name and
     * the data directory.
     *
     * @return the server options
     */
    @Nonnull
    public Map<String, Object> getServerOptions() {
        return serverOptions;
    }

    @Nonnull
    public Map<String, Object> getSetParameters() {
        return setParameters;
    }

    @Override
    public String toString() {
        return "NodeOptions{" + "index=" + index + ", name='" + name + '\'' + ", replicaSetName='" + replicaSetName
               + '\'' + ", dbpath=" + dbpath + ", preserveDbpath=" + preserveDbpath + ", serverOptions=" + serverOptions
               + ", setParameters=" + setParameters + '}';
    }

    public static final class NodeOptionsBuilder {

        private int index = -1;
        private String name;
        private String replicaSetName;
        private Path dbpath;
        private boolean preserveDbpath;
        private final Map<String, Object> serverOptions = new LinkedHashMap<>();
        private final Map<String, Object> setParameters = new LinkedHashMap<>();

        private NodeOptionsBuilder() {
        }

        @Nonnull
        public NodeOptionsBuilder setIndex(int index) {
            if (index < 0) {
                throw new IllegalArgumentException("node index cannot be negative!");
            }

            this.index = index;
            return this;
        }

        @Nonnull
        public NodeOptionsBuilder setName(@Nonnull String name) {
            this.name = requireNonNull(name);
            return this;
        }

        @Nonnull
        public NodeOptionsBuilder setReplicaSetName(@Nonnull String replicaSetName) {
            this.replicaSetName = requireNonNull(replicaSetName);
            return this;
        }

        @Nonnull
        public NodeOptionsBuilder setDbpath(@Nonnull Path dbpath) {
            this.dbpath = requireNonNull(dbpath);
            return this;
        }

        @Nonnull
        public NodeOptionsBuilder setPreserveDbpath(boolean preserveDbpath) {
            this.preserveDbpath = preserveDbpath;
            return this;
        }

        @Nonnull
        public NodeOptionsBuilder setServerOptions(@Nonnull Map<String, Object> serverOptions) {
            this.serverOptions.clear();
            this.serverOptions.putAll(requireNonNull(serverOptions));
            return this;
        }

        @Nonnull
        public NodeOptionsBuilder putSetParameter(@Nonnull String name, @Nonnull Object value) {
            this.setParameters.put(requireNonNull(name), requireNonNull(value));
            return this;
        }

        @Nonnull
        public NodeOptionsBuilder setSetParameters(@Nonnull Map<String, Object> setParameters) {
            this.setParameters.clear();
            this.setParameters.putAll(requireNonNull(setParameters));
            return this;
        }

        @Nonnull
        public NodeOptions build() {
            if (index < 0) {
                throw new IllegalArgumentException("node index must be set!");
            }

            requireNonNull(name, "node name must be set!");
            requireNonNull(replicaSetName, "replica set name must be set!");
            requireNonNull(dbpath, "dbpath must be set!");

            return new NodeOptions(this);
        }

    }

}
