package io.github.samzhu.aigate.grpc;

import java.util.List;
import java.util.function.Function;
import java.util.function.Supplier;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import io.github.samzhu.aigate.auth.GrpcRequestContext;
import io.github.samzhu.aigate.batch.Batch;
import io.github.samzhu.aigate.batch.BatchCancellation;
import io.github.samzhu.aigate.batch.BatchOrchestrator;
import io.github.samzhu.aigate.batch.FailurePolicy;
import io.github.samzhu.aigate.batch.RequestItem;
import io.github.samzhu.aigate.batch.ResponseItem;
import io.github.samzhu.aigate.config.GatewayProperties;
import io.github.samzhu.aigate.exception.GatewayException;
import io.github.samzhu.aigate.exception.GrpcExceptionTranslator;
import io.github.samzhu.aigate.grpc.v1.AiServiceGrpc;
import io.github.samzhu.aigate.grpc.v1.BatchResponseItem;
import io.github.samzhu.aigate.grpc.v1.HelloRequest;
import io.github.samzhu.aigate.grpc.v1.HelloResponse;
import io.github.samzhu.aigate.grpc.v1.MediaBatchRequest;
import io.github.samzhu.aigate.grpc.v1.MediaBatchResponse;
import io.github.samzhu.aigate.grpc.v1.NoteGenerationRequest;
import io.github.samzhu.aigate.grpc.v1.NoteGenerationResponse;
import io.github.samzhu.aigate.provider.Capability;
import io.grpc.Context;
import io.grpc.stub.StreamObserver;

/**
 * AI 批次服務 gRPC Handler
 *
 * <p>每個 RPC 的處理流程：
 * <ol>
 *   <li>將 protobuf 項目轉為 {@link RequestItem} 並驗證批次（格式錯誤即 {@code INVALID_ARGUMENT}，不呼叫供應商）</li>
 *   <li>交給 {@link BatchOrchestrator} 以端點固定的 {@link Capability} 處理</li>
 *   <li>依端點的 {@link FailurePolicy} 決定回傳部分失敗標記，或升級為呼叫層級錯誤</li>
 * </ol>
 *
 * <p>客戶端取消呼叫時，透過 {@link Context.CancellationListener} 觸發 {@link BatchCancellation}。
 * 所有異常統一交給 {@link GrpcExceptionTranslator} 轉換。
 */
@Service
public class AiGrpcService extends AiServiceGrpc.AiServiceImplBase {

    private static final Logger log = LoggerFactory.getLogger(AiGrpcService.class);

    static final String NOTE_GENERATION = "note-generation";
    static final String IMAGE_ANALYSIS = "image-analysis";
    static final String AUDIO_TRANSCRIPTION = "audio-transcription";

    private final BatchOrchestrator batchOrchestrator;
    private final GrpcExceptionTranslator exceptionTranslator;
    private final GatewayProperties.BatchSettings batchSettings;

    public AiGrpcService(BatchOrchestrator batchOrchestrator,
                         GrpcExceptionTranslator exceptionTranslator,
                         GatewayProperties gatewayProperties) {
        this.batchOrchestrator = batchOrchestrator;
        this.exceptionTranslator = exceptionTranslator;
        this.batchSettings = gatewayProperties.batch();
    }

    @Override
    public void sayHello(HelloRequest request, StreamObserver<HelloResponse> responseObserver) {
        if (StringUtils.isBlank(request.getName())) {
            responseObserver.onError(exceptionTranslator.translate(
                GatewayException.invalidArgument("Name must not be blank")));
            return;
        }
        responseObserver.onNext(HelloResponse.newBuilder()
            .setMessage("Hello %s! This is the AI gRPC Gateway".formatted(request.getName()))
            .build());
        responseObserver.onCompleted();
    }

    @Override
    public void noteGeneration(NoteGenerationRequest request,
                               StreamObserver<NoteGenerationResponse> responseObserver) {
        handleBatch(NOTE_GENERATION, Capability.TEXT_GENERATION,
            () -> BatchMapper.fromNoteItems(request.getItemsList()),
            items -> NoteGenerationResponse.newBuilder().addAllItems(items).build(),
            responseObserver);
    }

    @Override
    public void imageAnalysis(MediaBatchRequest request, StreamObserver<MediaBatchResponse> responseObserver) {
        handleBatch(IMAGE_ANALYSIS, Capability.IMAGE_ANALYSIS,
            () -> BatchMapper.fromMediaItems(request.getItemsList(), Capability.IMAGE_ANALYSIS),
            items -> MediaBatchResponse.newBuilder().addAllItems(items).build(),
            responseObserver);
    }

    @Override
    public void audioTranscription(MediaBatchRequest request, StreamObserver<MediaBatchResponse> responseObserver) {
        handleBatch(AUDIO_TRANSCRIPTION, Capability.AUDIO_TRANSCRIPTION,
            () -> BatchMapper.fromMediaItems(request.getItemsList(), Capability.AUDIO_TRANSCRIPTION),
            items -> MediaBatchResponse.newBuilder().addAllItems(items).build(),
            responseObserver);
    }

    private <T> void handleBatch(String endpoint, Capability capability,
                                 Supplier<List<RequestItem>> requestItems,
                                 Function<List<BatchResponseItem>, T> responseBuilder,
                                 StreamObserver<T> responseObserver) {
        long startTime = System.currentTimeMillis();
        String callerId = GrpcRequestContext.currentCallerId().orElse("anonymous");

        BatchCancellation cancellation = new BatchCancellation();
        Context context = Context.current();
        Context.CancellationListener cancellationListener = cancelled -> cancellation.cancel();
        context.addListener(cancellationListener, Runnable::run);
        try {
            Batch batch = Batch.of(requestItems.get(), batchSettings.maxItems());
            List<ResponseItem> results = batchOrchestrator.process(batch, capability, cancellation);
            if (batchSettings.policyFor(endpoint) == FailurePolicy.ALL_OR_NOTHING) {
                escalateFirstFailure(results);
            }

            long failed = results.stream().filter(result -> !result.isSuccess()).count();
            log.info("Batch completed: endpoint={}, caller={}, items={}, failed={}, latencyMs={}",
                endpoint, callerId, results.size(), failed, System.currentTimeMillis() - startTime);

            responseObserver.onNext(responseBuilder.apply(BatchMapper.toProto(results)));
            responseObserver.onCompleted();
        } catch (RuntimeException e) {
            log.debug("Batch failed: endpoint={}, caller={}, latencyMs={}",
                endpoint, callerId, System.currentTimeMillis() - startTime);
            responseObserver.onError(exceptionTranslator.translate(e));
        } finally {
            context.removeListener(cancellationListener);
        }
    }

    private static void escalateFirstFailure(List<ResponseItem> results) {
        results.stream()
            .filter(result -> !result.isSuccess())
            .findFirst()
            .ifPresent(failure -> {
                throw new GatewayException(failure.errorKind(),
                    "Item '" + failure.id() + "' failed: " + failure.errorMessage());
            });
    }
}
