package com.roomchat.protocol;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * @class PresenceSnapshot
 * @brief 현재 연결 집합에서 계산된 "누가 방에 있는가". 부분 수정 없이 항상 통째로 교체된다.
 */
public final class PresenceSnapshot implements Iterable<PresenceEntry> {

    private static final PresenceSnapshot EMPTY = new PresenceSnapshot(List.of());

    private final List<PresenceEntry> entries;

    public PresenceSnapshot(List<PresenceEntry> entries) {
        this.entries = Collections.unmodifiableList(new ArrayList<>(entries));
    }

    public static PresenceSnapshot empty() {
        return EMPTY;
    }

    public List<PresenceEntry> getEntries() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public boolean contains(String githubUserId) {
        for (PresenceEntry entry : entries) {
            if (entry.getUser().getGithubUserId().equals(githubUserId)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public Iterator<PresenceEntry> iterator() {
        return entries.iterator();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        return entries.equals(((PresenceSnapshot) obj).entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return "PresenceSnapshot" + entries;
    }
}
