package io.poolflow.server;

import com.google.inject.Guice;
import com.google.inject.Injector;
import io.poolflow.admin.AdminServer;
import io.poolflow.config.ByteSizes;
import io.poolflow.config.PoolConfig;
import io.poolflow.grpc.PoolAdminServer;
import io.poolflow.report.ConsoleStatusReporter;
import io.poolflow.report.PoolReview;
import io.poolflow.runtime.Pool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * Dynamic pool daemon. Jobs arrive through the gRPC and HTTP admin endpoints; the process exits
 * after an {@code end} request once every queued job has finished.
 */
@CommandLine.Command(name = "poolflow-server", mixinStandardHelpOptions = true, description = "Serve a dynamic job pool")
public final class PoolServerMain implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(PoolServerMain.class);

    @CommandLine.Option(names = {"-c", "--capacity"}, description = "Memory budget, e.g. 16G; default from poolflow.capacity or free memory")
    String capacity;

    @CommandLine.Option(names = {"--grpc-port"}, description = "gRPC admin port; default from poolflow.grpc.port")
    Integer grpcPort;

    @CommandLine.Option(names = {"--admin-port"}, description = "HTTP admin port; default from poolflow.admin.port")
    Integer adminPort;

    public static void main(String[] args) {
        int code = new CommandLine(new PoolServerMain()).execute(args);
        System.exit(code);
    }

    @Override
    public Integer call() throws Exception {
        PoolConfig cfg = PoolConfig.fromEnv();
        if (capacity != null) cfg = cfg.withCapacity(ByteSizes.parse(capacity));
        cfg = cfg.withPorts(grpcPort != null ? grpcPort : cfg.grpcPort(), adminPort != null ? adminPort : cfg.adminPort());

        Injector injector = Guice.createInjector(new PoolModule(cfg));
        Pool pool = injector.getInstance(Pool.class);
        try (PoolAdminServer grpc = injector.getInstance(PoolAdminServer.class);
             AdminServer admin = new AdminServer(cfg.adminPort(), cfg.grpcPort())) {
            grpc.start();
            admin.start();
            pool.start();
            Runtime.getRuntime().addShutdownHook(new Thread(pool::close, "poolflow-shutdown"));
            Thread status = new ConsoleStatusReporter(pool.createdAt(), System.out, cfg.output().orElse(null))
                    .emitEvery(pool, cfg.refreshInterval());
            log.info("Pool server ready: grpc={} http={}", grpc.port(), admin.port());
            while (!pool.awaitTermination(Duration.ofSeconds(1))) {
                if (!pool.isLoopRunning() && !pool.isTerminated()) {
                    log.error("Scheduler loop exited before the pool terminated");
                    return 1;
                }
            }
            status.join(Duration.ofSeconds(5).toMillis());
            PoolReview.print(pool, System.out);
            return pool.fault().isPresent() ? 1 : 0;
        } finally {
            pool.close();
        }
    }
}
