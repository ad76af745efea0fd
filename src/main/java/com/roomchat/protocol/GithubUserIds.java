package com.roomchat.protocol;

import java.util.Collection;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * GitHub 숫자 사용자 ID 검증. 선행 0 없는 10진수 문자열만 허용한다.
 */
public final class GithubUserIds {

    private static final Pattern GITHUB_USER_ID = Pattern.compile("^[1-9][0-9]*$");

    private GithubUserIds() {
    }

    public static boolean isValid(String value) {
        return value != null
                && !value.isEmpty()
                && value.length() <= ProtocolConstants.GITHUB_USER_ID_MAX_LEN
                && GITHUB_USER_ID.matcher(value).matches();
    }

    /**
     * 설정값 목록 → ID 집합. 각 항목은 trim 후 빈 값은 건너뛴다.
     *
     * @param key 오류 메시지에 쓸 설정 key
     * @throws IllegalArgumentException 형식이 틀린 항목이 하나라도 있으면
     */
    public static Set<String> parseList(Collection<String> values, String key) {
        Set<String> ids = new TreeSet<>();
        if (values == null) {
            return ids;
        }
        for (String value : values) {
            if (value == null) {
                continue;
            }
            String trimmed = value.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            if (!isValid(trimmed)) {
                throw new IllegalArgumentException(key + " 는 GitHub 숫자 사용자 ID 목록이어야 함: " + trimmed);
            }
            ids.add(trimmed);
        }
        return ids;
    }
}
