package io.github.samzhu.aigate.provider;

/**
 * 供應商回應語言
 */
public enum Language {
    VI_VN("Vietnamese"),
    EN_US("English");

    private final String displayName;

    Language(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
