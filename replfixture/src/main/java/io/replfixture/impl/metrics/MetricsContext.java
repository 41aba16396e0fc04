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

package io.replfixture.impl.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Timer;

import java.time.Clock;
import java.util.Collections;
import java.util.List;
import java.util.function.Supplier;

import static java.util.Objects.requireNonNull;

/**
 * Holds the clock, the meter registry and the common tags of the meters a
 * replica set fixture publishes.
 */
public class MetricsContext {

    public static final String REPLICA_SET_TAG_NAME = "replicaSet";

    public static final String STATUS_METRIC = "replfixture.status";

    public static final String COMMAND_RETRIES_METRIC = "replfixture.command.retries";

    public static final String LEADER_DISCOVERY_TIMEOUTS_METRIC = "replfixture.leader.discovery.timeouts";

    public static final String SETUP_TIME_METRIC = "replfixture.setup.time";

    private final Clock clock;

    private final MeterRegistry meterRegistry;

    private final List<Tag> tags;

    public MetricsContext(Clock clock, MeterRegistry meterRegistry, String replicaSetName) {
        this.clock = requireNonNull(clock);
        this.meterRegistry = requireNonNull(meterRegistry);
        this.tags = Collections.singletonList(Tag.of(REPLICA_SET_TAG_NAME, requireNonNull(replicaSetName)));
    }

    public Clock clock() {
        return clock;
    }

    public long nowMs() {
        return clock.millis();
    }

    public long elapsedDurationMs(long tsMs) {
        if (tsMs <= 0) {
            return 0;
        }

        return Math.max(nowMs() - tsMs, 0);
    }

    public Counter registerCounter(String name) {
        return Counter.builder(name).tags(tags).register(meterRegistry);
    }

    public Timer registerTimer(String name) {
        return Timer.builder(name).publishPercentiles(0.5, 0.95, 0.99, 1).tags(tags).register(meterRegistry);
    }

    public Gauge registerGauge(String name, Supplier<Number> supplierFunc) {
        return Gauge.builder(name, supplierFunc).tags(tags).register(meterRegistry);
    }

}
