package io.github.samzhu.aigate.provider;

/**
 * 供應商呼叫所執行的 AI 操作
 */
public enum Capability {
    TEXT_GENERATION("text generation"),
    IMAGE_ANALYSIS("image analysis"),
    AUDIO_TRANSCRIPTION("audio transcription");

    private final String displayName;

    Capability(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
