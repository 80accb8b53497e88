package io.poolflow.cli;

import io.grpc.ManagedChannel;
import io.grpc.ManagedChannelBuilder;
import io.poolflow.grpc.PoolAdminGrpc;
import io.poolflow.grpc.PoolAdminServer;
import io.poolflow.process.JobProcess;
import io.poolflow.runtime.Pool;
import io.poolflow.runtime.PoolBuilder;
import io.poolflow.runtime.PoolState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class PoolCliTest {
    Pool pool;
    PoolAdminServer grpc;
    ManagedChannel channel;
    PoolAdminGrpc.PoolAdminBlockingStub stub;
    final ByteArrayOutputStream out = new ByteArrayOutputStream();
    final ByteArrayOutputStream err = new ByteArrayOutputStream();

    @BeforeEach
    void setUp() throws Exception {
        pool = PoolBuilder.dynamicPool().capacity(1L << 20).launcher(job -> (JobProcess) Optional::empty).build();
        grpc = new PoolAdminServer(0, pool);
        grpc.start();
        channel = ManagedChannelBuilder.forAddress("127.0.0.1", grpc.port()).usePlaintext().build();
        stub = PoolAdminGrpc.newBlockingStub(channel);
    }

    @AfterEach
    void tearDown() {
        channel.shutdownNow();
        grpc.close();
        pool.close();
    }

    private int run(String... args) {
        return PoolCli.run(stub, args, new PrintStream(out, true, StandardCharsets.UTF_8), new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    @Test
    void submit_then_status_then_end() {
        assertEquals(0, run("submit", "64K", "sleep", "5"));
        assertTrue(out.toString(StandardCharsets.UTF_8).contains("{\"jobId\":1}"));
        assertEquals(0, run("status"));
        assertTrue(out.toString(StandardCharsets.UTF_8).contains("\"pending\":1"));
        assertEquals(0, run("end"));
        assertEquals(PoolState.DRAINING, pool.state());
        assertEquals(0, run("health"));
        assertTrue(out.toString(StandardCharsets.UTF_8).contains("\"ready\":true"));
    }

    @Test
    void rejected_submission_exits_non_zero() {
        assertEquals(1, run("submit", "2M", "big"));
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("INVALID_ARGUMENT"));
    }

    @Test
    void bad_usage_exits_two() {
        assertEquals(2, run("submit", "1K"));
        assertEquals(2, run("submit", "many", "x"));
        assertEquals(2, run("frobnicate"));
    }
}
