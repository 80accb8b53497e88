package io.poolflow.cli;

import io.grpc.ManagedChannel;
import io.grpc.ManagedChannelBuilder;
import io.grpc.StatusRuntimeException;
import io.poolflow.config.ByteSizes;
import io.poolflow.grpc.*;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.Arrays;

/**
 * Talks to a running pool server: {@code submit <cost> <cmd...>}, {@code status}, {@code end},
 * {@code health}. Prints one JSON line per command.
 */
public class PoolCli {
    public static void main(String[] args) {
        if (args.length == 0) { usage(System.out); return; }
        String host = System.getProperty("host", System.getenv().getOrDefault("POOLFLOW_HOST", "127.0.0.1"));
        int port = Integer.parseInt(System.getProperty("poolflow.grpc.port", System.getenv().getOrDefault("POOLFLOW_GRPC_PORT", "7455")));
        ManagedChannel ch = ManagedChannelBuilder.forAddress(host, port).usePlaintext().build();
        int code;
        try {
            code = run(PoolAdminGrpc.newBlockingStub(ch), args, System.out, System.err);
        } finally {
            ch.shutdownNow();
        }
        if (code != 0) System.exit(code);
    }

    static int run(PoolAdminGrpc.PoolAdminBlockingStub stub, String[] args, PrintStream out, PrintStream err) {
        try {
            switch (args[0]) {
                case "submit" -> {
                    if (args.length < 3) { err.println("submit requires <cost> <command...>"); return 2; }
                    SubmitRequest.Builder req = SubmitRequest.newBuilder()
                            .setCostBytes(ByteSizes.parse(args[1]))
                            .addAllArgv(Arrays.asList(args).subList(2, args.length))
                            .setWorkingDir(Path.of("").toAbsolutePath().toString());
                    SubmitResponse r = stub.submit(req.build());
                    out.printf("{\"jobId\":%d}%n", r.getJobId());
                }
                case "status" -> {
                    PoolStatus s = stub.getStatus(Empty.getDefaultInstance());
                    out.printf("{\"mode\":\"%s\",\"state\":\"%s\",\"closed\":%s,\"pending\":%d,\"running\":%d,\"allocated\":%d,\"capacity\":%s,\"completed\":%d,\"failed\":%d,\"rejected\":%d}%n",
                            s.getMode(), s.getState(), s.getClosed(), s.getPendingCount(), s.getRunningCount(), s.getAllocatedBytes(),
                            s.getCapacityUnbounded() ? "\"unbounded\"" : Long.toString(s.getCapacityBytes()),
                            s.getCompletedCount(), s.getFailedCount(), s.getRejectedCount());
                }
                case "end" -> {
                    EndResponse r = stub.end(Empty.getDefaultInstance());
                    out.printf("{\"state\":\"%s\"}%n", r.getState());
                }
                case "health" -> {
                    HealthStatus h = stub.health(Empty.getDefaultInstance());
                    out.printf("{\"ready\":%s,\"running\":%s,\"state\":\"%s\"}%n", h.getReady(), h.getRunning(), h.getState());
                }
                default -> { usage(out); return 2; }
            }
            return 0;
        } catch (StatusRuntimeException e) {
            err.printf("{\"error\":\"%s\",\"message\":\"%s\"}%n", e.getStatus().getCode(), e.getStatus().getDescription());
            return 1;
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            return 2;
        }
    }

    private static void usage(PrintStream out) {
        out.println("Usage: PoolCli <submit <cost> <command...>|status|end|health>");
    }
}
