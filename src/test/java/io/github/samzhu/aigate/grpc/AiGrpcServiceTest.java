package io.github.samzhu.aigate.grpc;

import java.io.IOException;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import java.util.stream.Collectors;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.google.protobuf.ByteString;

import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import io.github.samzhu.aigate.batch.BatchOrchestrator;
import io.github.samzhu.aigate.batch.FailurePolicy;
import io.github.samzhu.aigate.config.GatewayProperties;
import io.github.samzhu.aigate.exception.GrpcExceptionTranslator;
import io.github.samzhu.aigate.exception.ProviderException;
import io.github.samzhu.aigate.grpc.v1.AiServiceGrpc;
import io.github.samzhu.aigate.grpc.v1.Attachment;
import io.github.samzhu.aigate.grpc.v1.BatchResponseItem;
import io.github.samzhu.aigate.grpc.v1.ErrorKind;
import io.github.samzhu.aigate.grpc.v1.HelloRequest;
import io.github.samzhu.aigate.grpc.v1.MediaBatchRequest;
import io.github.samzhu.aigate.grpc.v1.MediaBatchResponse;
import io.github.samzhu.aigate.grpc.v1.MediaRequestItem;
import io.github.samzhu.aigate.grpc.v1.NoteGenerationRequest;
import io.github.samzhu.aigate.grpc.v1.NoteGenerationRequestItem;
import io.github.samzhu.aigate.grpc.v1.NoteGenerationResponse;
import io.github.samzhu.aigate.provider.Capability;
import io.github.samzhu.aigate.provider.ProviderRegistry;
import io.github.samzhu.aigate.provider.StubProviderClient;
import io.grpc.Context;
import io.grpc.ManagedChannel;
import io.grpc.Server;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import io.grpc.inprocess.InProcessChannelBuilder;
import io.grpc.inprocess.InProcessServerBuilder;

import static org.junit.jupiter.api.Assertions.*;

class AiGrpcServiceTest {

    private ExecutorService executor;
    private ScheduledExecutorService scheduler;
    private StubProviderClient provider;
    private Server server;
    private ManagedChannel channel;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
        scheduler = Executors.newSingleThreadScheduledExecutor();
        provider = new StubProviderClient("openai", (prompt, context) -> {
            if (context.label().startsWith("fail")) {
                throw ProviderException.unavailable("openai", "openai request failed with status 503", null);
            }
            return "V" + context.label();
        }, (media, prompt) -> media.stream()
            .map(attachment -> attachment.mimeType() + "/" + attachment.size())
            .collect(Collectors.joining(",")));
    }

    @AfterEach
    void tearDown() {
        if (channel != null) {
            channel.shutdownNow();
        }
        if (server != null) {
            server.shutdownNow();
        }
        executor.shutdownNow();
        scheduler.shutdownNow();
    }

    @Test
    @DisplayName("SayHello greets by name and rejects a blank name")
    void sayHello() throws IOException {
        start(Map.of());
        AiServiceGrpc.AiServiceBlockingStub stub = AiServiceGrpc.newBlockingStub(channel);

        assertEquals("Hello Mai! This is the AI gRPC Gateway",
            stub.sayHello(HelloRequest.newBuilder().setName("Mai").build()).getMessage());

        StatusRuntimeException thrown = assertThrows(StatusRuntimeException.class,
            () -> stub.sayHello(HelloRequest.newBuilder().setName(" ").build()));
        assertEquals(Status.Code.INVALID_ARGUMENT, thrown.getStatus().getCode());
    }

    @Test
    @DisplayName("NoteGeneration returns one item per request item, in order")
    void noteGeneration() throws IOException {
        start(Map.of());

        NoteGenerationResponse response = AiServiceGrpc.newBlockingStub(channel).noteGeneration(
            NoteGenerationRequest.newBuilder()
                .addItems(noteItem("a", "L1"))
                .addItems(noteItem("b", "L2"))
                .build());

        assertEquals(2, response.getItemsCount());
        assertEquals(BatchResponseItem.newBuilder().setId("a").setLabel("L1").setValue("VL1").build(),
            response.getItems(0));
        assertEquals(BatchResponseItem.newBuilder().setId("b").setLabel("L2").setValue("VL2").build(),
            response.getItems(1));
    }

    @Test
    @DisplayName("Empty request yields an empty response")
    void emptyRequest() throws IOException {
        start(Map.of());

        NoteGenerationResponse response = AiServiceGrpc.newBlockingStub(channel)
            .noteGeneration(NoteGenerationRequest.getDefaultInstance());

        assertEquals(0, response.getItemsCount());
        assertEquals(0, provider.calls());
    }

    @Test
    @DisplayName("Duplicate ids fail with INVALID_ARGUMENT and no provider call is made")
    void duplicateIds() throws IOException {
        start(Map.of());

        StatusRuntimeException thrown = assertThrows(StatusRuntimeException.class,
            () -> AiServiceGrpc.newBlockingStub(channel).noteGeneration(NoteGenerationRequest.newBuilder()
                .addItems(noteItem("a", "L1"))
                .addItems(noteItem("a", "L2"))
                .build()));

        assertEquals(Status.Code.INVALID_ARGUMENT, thrown.getStatus().getCode());
        assertEquals("Duplicate item id 'a'", thrown.getStatus().getDescription());
        assertEquals("INVALID_ARGUMENT", thrown.getTrailers().get(GrpcExceptionTranslator.ERROR_KIND_KEY));
        assertEquals(0, provider.calls());
    }

    @Test
    @DisplayName("PARTIAL policy surfaces a failed item as an error marker between successes")
    void partialFailure() throws IOException {
        start(Map.of());

        NoteGenerationResponse response = AiServiceGrpc.newBlockingStub(channel).noteGeneration(
            NoteGenerationRequest.newBuilder()
                .addItems(noteItem("1", "one"))
                .addItems(noteItem("2", "fail-two"))
                .addItems(noteItem("3", "three"))
                .build());

        assertEquals("Vone", response.getItems(0).getValue());
        BatchResponseItem failed = response.getItems(1);
        assertEquals("2", failed.getId());
        assertEquals("", failed.getValue());
        assertTrue(failed.hasError());
        assertEquals(ErrorKind.ERROR_KIND_PROVIDER_UNAVAILABLE, failed.getError().getKind());
        assertEquals("Vthree", response.getItems(2).getValue());
        assertFalse(response.getItems(2).hasError());
    }

    @Test
    @DisplayName("ALL_OR_NOTHING policy escalates the first failed item to a call-level status")
    void allOrNothing() throws IOException {
        start(Map.of(AiGrpcService.NOTE_GENERATION, FailurePolicy.ALL_OR_NOTHING));

        StatusRuntimeException thrown = assertThrows(StatusRuntimeException.class,
            () -> AiServiceGrpc.newBlockingStub(channel).noteGeneration(NoteGenerationRequest.newBuilder()
                .addItems(noteItem("1", "one"))
                .addItems(noteItem("2", "fail-two"))
                .addItems(noteItem("3", "fail-three"))
                .build()));

        assertEquals(Status.Code.UNAVAILABLE, thrown.getStatus().getCode());
        assertEquals("Item '2' failed: openai request failed with status 503", thrown.getStatus().getDescription());
    }

    @Test
    @DisplayName("ImageAnalysis forwards every attachment of an item in order, defaulting the mime type")
    void imageAnalysis() throws IOException {
        start(Map.of());

        MediaBatchResponse response = AiServiceGrpc.newBlockingStub(channel).imageAnalysis(
            MediaBatchRequest.newBuilder()
                .addItems(MediaRequestItem.newBuilder()
                    .setId("img-1").setLabel("receipt")
                    .addAttachments(attachment(new byte[] {1, 2, 3, 4}, "")))
                .addItems(MediaRequestItem.newBuilder()
                    .setId("img-2").setLabel("before-and-after")
                    .addAttachments(attachment(new byte[] {5}, "image/jpeg"))
                    .addAttachments(attachment(new byte[] {6, 7}, "image/webp")))
                .build());

        assertEquals("image/png/4", response.getItems(0).getValue());
        assertEquals("image/jpeg/1,image/webp/2", response.getItems(1).getValue());
        assertEquals(2, provider.calls());
    }

    @Test
    @DisplayName("AudioTranscription rejects missing or empty audio before any provider call")
    void emptyAudio() throws IOException {
        start(Map.of());
        AiServiceGrpc.AiServiceBlockingStub stub = AiServiceGrpc.newBlockingStub(channel);

        StatusRuntimeException missing = assertThrows(StatusRuntimeException.class,
            () -> stub.audioTranscription(MediaBatchRequest.newBuilder()
                .addItems(MediaRequestItem.newBuilder().setId("a").setLabel("clip"))
                .build()));
        assertEquals(Status.Code.INVALID_ARGUMENT, missing.getStatus().getCode());
        assertEquals("Item 'a' has no media attachments", missing.getStatus().getDescription());

        StatusRuntimeException empty = assertThrows(StatusRuntimeException.class,
            () -> stub.audioTranscription(MediaBatchRequest.newBuilder()
                .addItems(MediaRequestItem.newBuilder().setId("b").setLabel("clip")
                    .addAttachments(attachment(new byte[0], "audio/wav")))
                .build()));
        assertEquals(Status.Code.INVALID_ARGUMENT, empty.getStatus().getCode());

        assertEquals(0, provider.calls());
    }

    @Test
    @DisplayName("AudioTranscription accepts exactly one attachment per item")
    void multipleAudioAttachments() throws IOException {
        start(Map.of());

        StatusRuntimeException thrown = assertThrows(StatusRuntimeException.class,
            () -> AiServiceGrpc.newBlockingStub(channel).audioTranscription(MediaBatchRequest.newBuilder()
                .addItems(MediaRequestItem.newBuilder().setId("a").setLabel("clip")
                    .addAttachments(attachment(new byte[] {1}, "audio/wav"))
                    .addAttachments(attachment(new byte[] {2}, "audio/wav")))
                .build()));

        assertEquals(Status.Code.INVALID_ARGUMENT, thrown.getStatus().getCode());
        assertEquals("Item 'a' has 2 audio attachments, exactly one is supported", thrown.getStatus().getDescription());
        assertEquals(0, provider.calls());
    }

    @Test
    @DisplayName("Client cancellation interrupts the in-flight provider call and ends the RPC with CANCELLED")
    void clientCancellation() throws Exception {
        provider = new StubProviderClient("openai", (prompt, context) -> {
            StubProviderClient.sleep(10_000);
            return "late";
        });
        start(Map.of(), false);
        AiServiceGrpc.AiServiceBlockingStub stub = AiServiceGrpc.newBlockingStub(channel);
        NoteGenerationRequest request = NoteGenerationRequest.newBuilder().addItems(noteItem("a", "L1")).build();
        Context.CancellableContext callContext = Context.current().withCancellation();

        CompletableFuture<Void> call = CompletableFuture.runAsync(
            () -> callContext.run(() -> stub.noteGeneration(request)), executor);
        awaitCondition(() -> provider.calls() == 1);
        callContext.cancel(null);

        ExecutionException thrown = assertThrows(ExecutionException.class, () -> call.get(3, TimeUnit.SECONDS));
        StatusRuntimeException status = assertInstanceOf(StatusRuntimeException.class, thrown.getCause());
        assertEquals(Status.Code.CANCELLED, status.getStatus().getCode());
        awaitCondition(() -> provider.interrupted() == 1);
        assertEquals(0, provider.inFlight());
    }

    private void start(Map<String, FailurePolicy> policies) throws IOException {
        start(policies, true);
    }

    /**
     * @param inline 是否在呼叫端執行緒上直接執行 handler；測試取消時 handler 需要跑在自己的執行緒
     */
    private void start(Map<String, FailurePolicy> policies, boolean inline) throws IOException {
        GatewayProperties properties = new GatewayProperties(null, null,
            new GatewayProperties.BatchSettings(10, 4, Duration.ofSeconds(5), policies));
        Map<Capability, String> routing = new EnumMap<>(Capability.class);
        for (Capability capability : Capability.values()) {
            routing.put(capability, "openai");
        }
        TimeLimiterRegistry timeLimiterRegistry = TimeLimiterRegistry.of(TimeLimiterConfig.custom()
            .timeoutDuration(properties.batch().itemTimeout())
            .cancelRunningFuture(true)
            .build());
        BatchOrchestrator orchestrator = new BatchOrchestrator(
            new ProviderRegistry(List.of(provider), routing), CircuitBreakerRegistry.ofDefaults(),
            timeLimiterRegistry, executor, scheduler, properties);
        AiGrpcService service = new AiGrpcService(orchestrator, new GrpcExceptionTranslator(), properties);

        String name = InProcessServerBuilder.generateName();
        InProcessServerBuilder serverBuilder = InProcessServerBuilder.forName(name);
        if (inline) {
            serverBuilder.directExecutor();
        } else {
            serverBuilder.executor(executor);
        }
        server = serverBuilder.addService(service).build().start();
        channel = InProcessChannelBuilder.forName(name).directExecutor().build();
    }

    private static Attachment attachment(byte[] content, String mimeType) {
        return Attachment.newBuilder()
            .setContent(ByteString.copyFrom(content))
            .setMimeType(mimeType)
            .build();
    }

    private static void awaitCondition(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(3);
        while (!condition.getAsBoolean()) {
            assertTrue(System.nanoTime() < deadline, "condition not met within 3 seconds");
            Thread.sleep(10);
        }
    }

    private static NoteGenerationRequestItem noteItem(String id, String label) {
        return NoteGenerationRequestItem.newBuilder()
            .setId(id)
            .setLabel(label)
            .setGuide("Write a short note")
            .setSample("")
            .build();
    }
}
