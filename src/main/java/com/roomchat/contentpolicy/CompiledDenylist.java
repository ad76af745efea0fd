package com.roomchat.contentpolicy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 정규화 + 중복 제거가 끝난 금칙어 집합. 한번 만들어지면 바뀌지 않는다.
 */
public final class CompiledDenylist {

    private static final CompiledDenylist EMPTY = new CompiledDenylist(List.of());

    private final List<String> terms;

    CompiledDenylist(List<String> terms) {
        this.terms = Collections.unmodifiableList(new ArrayList<>(terms));
    }

    public static CompiledDenylist empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return terms.isEmpty();
    }

    public int size() {
        return terms.size();
    }

    /**
     * 컴파일 결과 확인용 (설정 로딩 로그, 테스트). 매칭에 걸린 항목을 알려주는 API 는 두지 않는다.
     */
    public List<String> terms() {
        return terms;
    }

    boolean matchesAny(String normalizedText) {
        for (String term : terms) {
            if (normalizedText.contains(term)) {
                return true;
            }
        }
        return false;
    }

    CompiledDenylist without(CompiledDenylist other) {
        Set<String> removal = new HashSet<>(other.terms);
        List<String> kept = new ArrayList<>(terms.size());
        for (String term : terms) {
            if (!removal.contains(term)) {
                kept.add(term);
            }
        }
        return new CompiledDenylist(kept);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        return terms.equals(((CompiledDenylist) obj).terms);
    }

    @Override
    public int hashCode() {
        return terms.hashCode();
    }

    @Override
    public String toString() {
        return "CompiledDenylist(size=" + terms.size() + ")";
    }
}
