package io.poolflow.grpc;

import io.grpc.Server;
import io.grpc.ServerBuilder;
import io.grpc.protobuf.services.ProtoReflectionService;
import io.grpc.stub.StreamObserver;
import io.poolflow.job.ExternalCommand;
import io.poolflow.job.JobId;
import io.poolflow.runtime.CostExceedsCapacityException;
import io.poolflow.runtime.JobRejectedException;
import io.poolflow.runtime.Pool;
import io.poolflow.runtime.PoolState;
import io.poolflow.runtime.StatusSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Remote job submission and status for a dynamic pool.
 */
public class PoolAdminServer implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(PoolAdminServer.class);

    private final Server server;

    public PoolAdminServer(int port, Pool pool) {
        this.server = ServerBuilder.forPort(port)
                .addService(new ServiceImpl(pool))
                .addService(ProtoReflectionService.newInstance())
                .build();
    }

    public void start() throws IOException {
        server.start();
        log.info("Pool admin gRPC listening on port {}", server.getPort());
    }

    /** Bound port; differs from the requested one when that was 0. */
    public int port() { return server.getPort(); }

    @Override
    public void close() { server.shutdownNow(); }

    static PoolStatus toProto(StatusSnapshot s) {
        PoolStatus.Builder b = PoolStatus.newBuilder()
                .setMode(s.mode().name())
                .setState(s.state().name())
                .setClosed(s.closed())
                .setEnforced(s.enforced())
                .setCapacityUnbounded(s.capacityUnbounded())
                .setCapacityBytes(s.capacityUnbounded() ? 0 : s.capacity())
                .setAllocatedBytes(s.allocated())
                .setPendingCount(s.pendingCount())
                .setCompletedCount(s.completedCount())
                .setFailedCount(s.failedCount())
                .setRejectedCount(s.rejectedCount());
        for (StatusSnapshot.RunningJob r : s.runningJobs()) {
            b.addRunning(RunningJob.newBuilder()
                    .setId(r.id().value())
                    .setCostBytes(r.cost())
                    .setLabel(r.label())
                    .setStartedAtMs(r.startedAt() == null ? 0 : r.startedAt().toEpochMilli()));
        }
        return b.build();
    }

    private static class ServiceImpl extends PoolAdminGrpc.PoolAdminImplBase {
        private final Pool pool;

        ServiceImpl(Pool pool) { this.pool = pool; }

        @Override
        public void submit(SubmitRequest request, StreamObserver<SubmitResponse> responseObserver) {
            if (request.getArgvCount() == 0) {
                responseObserver.onError(io.grpc.Status.INVALID_ARGUMENT.withDescription("argv is empty").asRuntimeException());
                return;
            }
            ExternalCommand cmd = new ExternalCommand(request.getArgvList(),
                    request.getWorkingDir().isEmpty() ? null : Path.of(request.getWorkingDir()), null);
            try {
                JobId id = pool.submit(request.getCostBytes(), cmd);
                responseObserver.onNext(SubmitResponse.newBuilder().setJobId(id.value()).build());
                responseObserver.onCompleted();
            } catch (CostExceedsCapacityException e) {
                responseObserver.onError(io.grpc.Status.INVALID_ARGUMENT.withDescription(e.getMessage()).asRuntimeException());
            } catch (JobRejectedException | IllegalStateException e) {
                responseObserver.onError(io.grpc.Status.FAILED_PRECONDITION.withDescription(e.getMessage()).asRuntimeException());
            } catch (IllegalArgumentException e) {
                responseObserver.onError(io.grpc.Status.INVALID_ARGUMENT.withDescription(e.getMessage()).asRuntimeException());
            }
        }

        @Override
        public void end(Empty request, StreamObserver<EndResponse> responseObserver) {
            try {
                pool.end();
            } catch (IllegalStateException e) {
                responseObserver.onError(io.grpc.Status.FAILED_PRECONDITION.withDescription(e.getMessage()).asRuntimeException());
                return;
            }
            responseObserver.onNext(EndResponse.newBuilder().setState(pool.state().name()).build());
            responseObserver.onCompleted();
        }

        @Override
        public void getStatus(Empty request, StreamObserver<PoolStatus> responseObserver) {
            responseObserver.onNext(toProto(pool.snapshot()));
            responseObserver.onCompleted();
        }

        @Override
        public void health(Empty request, StreamObserver<HealthStatus> responseObserver) {
            PoolState state = pool.state();
            HealthStatus hs = HealthStatus.newBuilder()
                    .setReady(pool.fault().isEmpty())
                    .setRunning(state != PoolState.TERMINATED)
                    .setState(state.name())
                    .build();
            responseObserver.onNext(hs);
            responseObserver.onCompleted();
        }
    }
}
