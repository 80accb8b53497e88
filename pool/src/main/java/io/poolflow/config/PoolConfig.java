package io.poolflow.config;

import io.poolflow.process.MemoryLimit;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;
import java.util.OptionalLong;

public record PoolConfig(
        OptionalLong capacityBytes,
        Duration tickInterval,
        Duration refreshInterval,
        MemoryLimit memoryLimit,
        int grpcPort,
        int adminPort,
        Optional<Path> output
) {
    public static PoolConfig fromEnv() {
        String cap = setting("poolflow.capacity", "POOLFLOW_CAPACITY", "");
        long tick = Long.parseLong(setting("poolflow.tick.ms", "POOLFLOW_TICK_MS", "1000"));
        long refresh = Long.parseLong(setting("poolflow.refresh.ms", "POOLFLOW_REFRESH_MS", "5000"));
        MemoryLimit limit = MemoryLimit.parse(setting("poolflow.memlimit", "POOLFLOW_MEMLIMIT", "none"));
        int grpc = Integer.parseInt(setting("poolflow.grpc.port", "POOLFLOW_GRPC_PORT", "7455"));
        int admin = Integer.parseInt(setting("poolflow.admin.port", "POOLFLOW_ADMIN_PORT", "7456"));
        String out = setting("poolflow.output", "POOLFLOW_OUTPUT", "");
        return new PoolConfig(
                cap.isBlank() ? OptionalLong.empty() : OptionalLong.of(ByteSizes.parse(cap)),
                Duration.ofMillis(tick),
                Duration.ofMillis(refresh),
                limit,
                grpc,
                admin,
                out.isBlank() ? Optional.empty() : Optional.of(Path.of(out)));
    }

    public PoolConfig withCapacity(long bytes) {
        return new PoolConfig(OptionalLong.of(bytes), tickInterval, refreshInterval, memoryLimit, grpcPort, adminPort, output);
    }

    public PoolConfig withPorts(int grpc, int admin) {
        return new PoolConfig(capacityBytes, tickInterval, refreshInterval, memoryLimit, grpc, admin, output);
    }

    private static String setting(String property, String env, String def) {
        return System.getProperty(property, System.getenv().getOrDefault(env, def));
    }
}
