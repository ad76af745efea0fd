package com.roomchat.protocol;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * DM 대화 ID: "dm:v1:&lt;a&gt;:&lt;b&gt;" (a, b 는 GitHub 숫자 ID 이고 숫자 크기 기준 a &lt;= b).
 * 같은 두 사용자는 누가 먼저 열어도 같은 ID 를 얻는다.
 */
public final class DmIds {

    public static final int DM_ID_MAX_LEN = 128;

    private static final Pattern DM_ID = Pattern.compile("^dm:v1:([1-9][0-9]*):([1-9][0-9]*)$");

    private DmIds() {
    }

    public static String fromParticipants(String githubUserIdA, String githubUserIdB) {
        return compareNumeric(githubUserIdA, githubUserIdB) <= 0
                ? "dm:v1:" + githubUserIdA + ":" + githubUserIdB
                : "dm:v1:" + githubUserIdB + ":" + githubUserIdA;
    }

    public static boolean isValid(String dmId) {
        return participants(dmId).isPresent();
    }

    /**
     * @return [a, b] 순서의 참여자 ID. 형식이 틀리거나 정렬되지 않은 ID 면 빈 값
     */
    public static Optional<String[]> participants(String dmId) {
        if (dmId == null || dmId.length() > DM_ID_MAX_LEN) {
            return Optional.empty();
        }
        Matcher matcher = DM_ID.matcher(dmId);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        String a = matcher.group(1);
        String b = matcher.group(2);
        if (!GithubUserIds.isValid(a) || !GithubUserIds.isValid(b) || compareNumeric(a, b) > 0) {
            return Optional.empty();
        }
        return Optional.of(new String[]{a, b});
    }

    // 선행 0 이 없으므로 길이 → 사전순 비교가 숫자 비교와 같다
    static int compareNumeric(String a, String b) {
        if (a.length() != b.length()) {
            return Integer.compare(a.length(), b.length());
        }
        return a.compareTo(b);
    }
}
