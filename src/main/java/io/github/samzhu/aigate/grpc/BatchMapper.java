package io.github.samzhu.aigate.grpc;

import java.util.List;

import org.apache.commons.lang3.StringUtils;

import io.github.samzhu.aigate.batch.RequestItem;
import io.github.samzhu.aigate.batch.ResponseItem;
import io.github.samzhu.aigate.exception.FailureKind;
import io.github.samzhu.aigate.exception.GatewayException;
import io.github.samzhu.aigate.grpc.v1.Attachment;
import io.github.samzhu.aigate.grpc.v1.BatchResponseItem;
import io.github.samzhu.aigate.grpc.v1.ErrorKind;
import io.github.samzhu.aigate.grpc.v1.ItemError;
import io.github.samzhu.aigate.grpc.v1.MediaRequestItem;
import io.github.samzhu.aigate.grpc.v1.NoteGenerationRequestItem;
import io.github.samzhu.aigate.provider.Capability;
import io.github.samzhu.aigate.provider.MediaAttachment;

/**
 * Protobuf 訊息與批次領域型別之間的轉換
 */
final class BatchMapper {

    static final String DEFAULT_IMAGE_MIME_TYPE = "image/png";
    static final String DEFAULT_AUDIO_MIME_TYPE = "audio/mp3";

    private BatchMapper() {
    }

    static List<RequestItem> fromNoteItems(List<NoteGenerationRequestItem> items) {
        return items.stream()
            .map(item -> RequestItem.text(item.getId(), item.getLabel(), item.getGuide(), item.getSample()))
            .toList();
    }

    /**
     * 轉換媒體項目
     *
     * <p>每個項目至少要有一個附件；語音轉文字只接受一個附件。
     *
     * @throws GatewayException {@code INVALID_ARGUMENT}，附件數不符時
     */
    static List<RequestItem> fromMediaItems(List<MediaRequestItem> items, Capability capability) {
        boolean audio = capability == Capability.AUDIO_TRANSCRIPTION;
        String defaultMimeType = audio ? DEFAULT_AUDIO_MIME_TYPE : DEFAULT_IMAGE_MIME_TYPE;
        return items.stream()
            .map(item -> {
                if (item.getAttachmentsCount() == 0) {
                    throw GatewayException.invalidArgument("Item '" + item.getId() + "' has no media attachments");
                }
                if (audio && item.getAttachmentsCount() > 1) {
                    throw GatewayException.invalidArgument("Item '" + item.getId() + "' has "
                        + item.getAttachmentsCount() + " audio attachments, exactly one is supported");
                }
                List<MediaAttachment> media = item.getAttachmentsList().stream()
                    .map(attachment -> fromProto(attachment, defaultMimeType))
                    .toList();
                return RequestItem.media(item.getId(), item.getLabel(), item.getGuide(), media);
            })
            .toList();
    }

    private static MediaAttachment fromProto(Attachment attachment, String defaultMimeType) {
        return new MediaAttachment(attachment.getContent().toByteArray(),
            StringUtils.defaultIfBlank(attachment.getMimeType(), defaultMimeType));
    }

    static List<BatchResponseItem> toProto(List<ResponseItem> items) {
        return items.stream().map(BatchMapper::toProto).toList();
    }

    static BatchResponseItem toProto(ResponseItem item) {
        BatchResponseItem.Builder builder = BatchResponseItem.newBuilder()
            .setId(item.id())
            .setLabel(item.label());
        if (item.isSuccess()) {
            builder.setValue(item.value());
        } else {
            builder.setError(ItemError.newBuilder()
                .setKind(toProto(item.errorKind()))
                .setMessage(StringUtils.defaultString(item.errorMessage())));
        }
        return builder.build();
    }

    static ErrorKind toProto(FailureKind kind) {
        return switch (kind) {
            case PROVIDER_UNAVAILABLE -> ErrorKind.ERROR_KIND_PROVIDER_UNAVAILABLE;
            case PROVIDER_TIMEOUT -> ErrorKind.ERROR_KIND_PROVIDER_TIMEOUT;
            case PROVIDER_INVALID_RESPONSE -> ErrorKind.ERROR_KIND_PROVIDER_INVALID_RESPONSE;
            default -> ErrorKind.ERROR_KIND_INTERNAL;
        };
    }
}
