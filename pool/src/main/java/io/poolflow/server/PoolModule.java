package io.poolflow.server;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import io.poolflow.budget.Accountants;
import io.poolflow.budget.ResourceAccountant;
import io.poolflow.config.PoolConfig;
import io.poolflow.grpc.PoolAdminServer;
import io.poolflow.process.DefaultProcessLauncher;
import io.poolflow.process.ProcessLauncher;
import io.poolflow.runtime.FirstFitAdmission;
import io.poolflow.runtime.Pool;
import io.poolflow.runtime.PoolBuilder;

/**
 * Wires a dynamic pool and its gRPC admin endpoint from a {@link PoolConfig}.
 */
public class PoolModule extends AbstractModule {
    private final PoolConfig config;

    public PoolModule(PoolConfig config) { this.config = config; }

    @Override
    protected void configure() {
        bind(PoolConfig.class).toInstance(config);
    }

    @Provides @Singleton MetricRegistry metricRegistry() { return new MetricRegistry(); }

    @Provides @Singleton ResourceAccountant accountant() { return Accountants.detect(config.capacityBytes()); }

    @Provides @Singleton ProcessLauncher launcher() { return new DefaultProcessLauncher(config.memoryLimit()); }

    @Provides @Singleton Pool pool(ResourceAccountant accountant, ProcessLauncher launcher, MetricRegistry registry) {
        return PoolBuilder.dynamicPool()
                .accountant(accountant)
                .launcher(launcher)
                .admission(new FirstFitAdmission())
                .tickInterval(config.tickInterval())
                .metrics(registry)
                .build();
    }

    @Provides @Singleton PoolAdminServer adminServer(Pool pool) { return new PoolAdminServer(config.grpcPort(), pool); }
}
