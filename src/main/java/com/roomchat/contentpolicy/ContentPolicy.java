package com.roomchat.contentpolicy;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * @class ContentPolicy
 * @brief 채팅 본문 난독화 우회를 막는 정규화 + 금칙어 매칭. 상태 없는 순수 함수 모음.
 *
 * @details
 * - 전각/호환 문자는 NFKC 로 접어 ASCII 대역으로 되돌린다.
 * - zero-width 등 보이지 않는 서식 문자, 공백/구두점/기호는 제거한다.
 *   "f u-c k" 처럼 글자 사이를 벌려 놓은 입력도 인접 글자로 붙는다.
 * - 매칭은 토큰 단위가 아니라 정규화된 문자열의 부분 문자열 기준.
 * - 어떤 금칙어가 걸렸는지는 밖으로 내보내지 않는다 (boolean 판정만 제공).
 */
public final class ContentPolicy {

    private static final Pattern INVISIBLE_FORMAT = Pattern.compile("[\\p{Cf}\\u200B\\u200C\\u200D\\uFEFF]");
    private static final Pattern SEPARATORS_PUNCTUATION_SYMBOLS = Pattern.compile("[\\p{Z}\\p{P}\\p{S}\\s]");

    private ContentPolicy() {
    }

    /**
     * @method normalizeContentText
     * @param text 원문
     * @return 비교용 정규화 문자열 (빈 문자열 가능)
     */
    public static String normalizeContentText(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String folded = Normalizer.normalize(text, Normalizer.Form.NFKC).toLowerCase(Locale.ROOT);
        String visible = INVISIBLE_FORMAT.matcher(folded).replaceAll("");
        return SEPARATORS_PUNCTUATION_SYMBOLS.matcher(visible).replaceAll("");
    }

    /**
     * @method compileDenylist
     * @brief 각 항목 정규화 → 빈 항목 제거 → 최초 등장 순서 유지하며 중복 제거
     */
    public static CompiledDenylist compileDenylist(Collection<String> terms) {
        Set<String> seen = new LinkedHashSet<>();
        if (terms != null) {
            for (String term : terms) {
                String normalized = normalizeContentText(term);
                if (!normalized.isEmpty()) {
                    seen.add(normalized);
                }
            }
        }
        return new CompiledDenylist(new ArrayList<>(seen));
    }

    /**
     * @method buildCompiledDenylist
     * @brief (preset ∪ extra) 를 컴파일한 뒤, 정규화된 allowlist 와 같은 항목을 제거
     * @note 입력이 바뀌면 증분 수정하지 않고 항상 새로 만든다.
     */
    public static CompiledDenylist buildCompiledDenylist(Collection<String> presetDenylist,
                                                         Collection<String> extraDenylist,
                                                         Collection<String> allowlist) {
        List<String> combined = new ArrayList<>();
        if (presetDenylist != null) {
            combined.addAll(presetDenylist);
        }
        if (extraDenylist != null) {
            combined.addAll(extraDenylist);
        }
        CompiledDenylist compiled = compileDenylist(combined);
        CompiledDenylist allow = compileDenylist(allowlist);
        if (allow.isEmpty()) {
            return compiled;
        }
        return compiled.without(allow);
    }

    /**
     * @method violatesDenylist
     * @return 정규화된 text 에 컴파일된 금칙어 중 하나라도 부분 문자열로 포함되면 true
     */
    public static boolean violatesDenylist(String text, CompiledDenylist denylist) {
        if (denylist == null || denylist.isEmpty()) {
            return false;
        }
        String normalized = normalizeContentText(text);
        if (normalized.isEmpty()) {
            return false;
        }
        return denylist.matchesAny(normalized);
    }
}
