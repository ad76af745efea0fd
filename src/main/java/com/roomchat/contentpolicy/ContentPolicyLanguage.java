package com.roomchat.contentpolicy;

import java.util.Locale;

/**
 * 프리셋 금칙어 목록을 제공하는 언어 코드.
 */
public enum ContentPolicyLanguage {
    EN, AR, DE, ES, FR, IT, HI, JA, KO, PT, RU, ZH;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * @param code "en", "KO" 등 (대소문자 무시)
     * @throws IllegalArgumentException 지원하지 않는 코드
     */
    public static ContentPolicyLanguage fromCode(String code) {
        if (code == null) {
            throw new IllegalArgumentException("language code 없음");
        }
        for (ContentPolicyLanguage language : values()) {
            if (language.code().equals(code.trim().toLowerCase(Locale.ROOT))) {
                return language;
            }
        }
        throw new IllegalArgumentException("지원하지 않는 content policy language: " + code);
    }
}
