package io.github.samzhu.aigate.grpc;

import org.springframework.stereotype.Service;

import io.github.samzhu.aigate.grpc.v1.HealthRequest;
import io.github.samzhu.aigate.grpc.v1.HealthResponse;
import io.github.samzhu.aigate.grpc.v1.HealthServiceGrpc;
import io.grpc.stub.StreamObserver;

/**
 * gRPC 健康檢查
 *
 * <p>{@code Health} 為公開方法；{@code HealthWithAuthentication} 需要有效的 API Key，
 * 可用來確認呼叫端的 Key 是否正確。
 */
@Service
public class HealthGrpcService extends HealthServiceGrpc.HealthServiceImplBase {

    static final String HEALTHY = "Healthy";

    @Override
    public void health(HealthRequest request, StreamObserver<HealthResponse> responseObserver) {
        reply(responseObserver);
    }

    @Override
    public void healthWithAuthentication(HealthRequest request, StreamObserver<HealthResponse> responseObserver) {
        reply(responseObserver);
    }

    private static void reply(StreamObserver<HealthResponse> responseObserver) {
        responseObserver.onNext(HealthResponse.newBuilder().setMessage(HEALTHY).build());
        responseObserver.onCompleted();
    }
}
