package io.github.samzhu.aigate.provider;

import org.apache.commons.lang3.StringUtils;

/**
 * 文字生成的輸入內容（項目標籤與範例內容）
 *
 * @param label 項目標籤
 * @param sample 範例內容（可為空白）
 */
public record PromptContext(
    String label,
    String sample
) {
    public PromptContext {
        label = StringUtils.defaultString(label);
        sample = StringUtils.defaultString(sample);
    }

    /**
     * 組成送給模型的使用者訊息
     */
    public String toUserMessage() {
        if (StringUtils.isBlank(sample)) {
            return "Label: " + label;
        }
        return "Label: " + label + "\n\nSample:\n" + sample;
    }
}
