package com.cargo.monitor.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Language {
    EN,
    ES,
    ZH;

    /**
     * Resolves a language code, falling back to English for anything unsupported.
     */
    public static Language fromCode(String code) {
        if (code == null) {
            return EN;
        }
        for (Language language : values()) {
            if (language.getCode().equalsIgnoreCase(code.trim())) {
                return language;
            }
        }
        return EN;
    }

    public static boolean isSupported(String code) {
        if (code == null) {
            return false;
        }
        for (Language language : values()) {
            if (language.getCode().equalsIgnoreCase(code.trim())) {
                return true;
            }
        }
        return false;
    }

    @JsonValue
    public String getCode() {
        return name().toLowerCase();
    }
}
