package io.github.samzhu.aigate.batch;

import java.util.List;

import org.apache.commons.lang3.StringUtils;

import io.github.samzhu.aigate.provider.MediaAttachment;

/**
 * 批次中的單一請求項目
 *
 * @param id 呼叫端指定的 id，批次內唯一
 * @param label 人類可讀的標籤（不可空白）
 * @param guide 指示或提示內容
 * @param sample 範例內容（可空白）
 * @param media 影像或音訊附件，依呼叫端順序；文字項目為空
 */
public record RequestItem(
    String id,
    String label,
    String guide,
    String sample,
    List<MediaAttachment> media
) {
    public RequestItem {
        id = StringUtils.defaultString(id);
        label = StringUtils.defaultString(label);
        guide = StringUtils.defaultString(guide);
        sample = StringUtils.defaultString(sample);
        media = media == null ? List.of() : List.copyOf(media);
    }

    public static RequestItem text(String id, String label, String guide, String sample) {
        return new RequestItem(id, label, guide, sample, List.of());
    }

    public static RequestItem media(String id, String label, String guide, MediaAttachment... media) {
        return media(id, label, guide, List.of(media));
    }

    public static RequestItem media(String id, String label, String guide, List<MediaAttachment> media) {
        return new RequestItem(id, label, guide, "", media);
    }

    public boolean hasMedia() {
        return !media.isEmpty();
    }
}
