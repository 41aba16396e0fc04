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
import io.replfixture.ReplicaSetFixture.ReplicaSetFixtureBuilder;
import io.replfixture.impl.metrics.MetricsContext;
import io.replfixture.node.NodeFactory;
import io.replfixture.runtime.Sleeper;

import javax.annotation.Nonnull;
import java.time.Clock;

import static io.replfixture.ReplicaSetConfig.DEFAULT_REPLICA_SET_CONFIG;
import static java.util.Objects.requireNonNull;

/**
 * Builder for {@link ReplicaSetFixture}.
 */
public class ReplicaSetFixtureBuilderImpl implements ReplicaSetFixtureBuilder {

    private ReplicaSetConfig config = DEFAULT_REPLICA_SET_CONFIG;
    private NodeFactory nodeFactory;
    private Clock clock = Clock.systemUTC();
    private Sleeper sleeper = Sleeper.THREAD_SLEEPER;
    private MeterRegistry meterRegistry = new SimpleMeterRegistry();
    private boolean done;

    @Nonnull
    @Override
    public ReplicaSetFixtureBuilder setConfig(@Nonnull ReplicaSetConfig config) {
        this.config = requireNonNull(config);
        return this;
    }

    @Nonnull
    @Override
    public ReplicaSetFixtureBuilder setNodeFactory(@Nonnull NodeFactory nodeFactory) {
        this.nodeFactory = requireNonNull(nodeFactory);
        return this;
    }

    @Nonnull
    @Override
    public ReplicaSetFixtureBuilder setClock(@Nonnull Clock clock) {
        this.clock = requireNonNull(clock);
        return this;
    }

    @Nonnull
    @Override
    public ReplicaSetFixtureBuilder setSleeper(@Nonnull Sleeper sleeper) {
        this.sleeper = requireNonNull(sleeper);
        return this;
    }

    @Nonnull
    @Override
    public ReplicaSetFixtureBuilder setMeterRegistry(@Nonnull MeterRegistry meterRegistry) {
        this.meterRegistry = requireNonNull(meterRegistry);
        return this;
    }

    @Nonnull
    @Override
    public ReplicaSetFixture build() {
        if (done) {
            throw new IllegalStateException("Replica set fixture is already built!");
        }

        if (nodeFactory == null) {
            throw new IllegalStateException("Node factory must be provided!");
        }

        MetricsContext metricsContext = new MetricsContext(clock, meterRegistry, config.getReplicaSetName());

        done = true;
        return new ReplicaSetFixtureImpl(config, nodeFactory, sleeper, metricsContext);
    }

}
