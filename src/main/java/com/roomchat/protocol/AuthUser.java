package com.roomchat.protocol;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * @class AuthUser
 * @brief 핸드셰이크 단계에서 검증이 끝난 연결 사용자 신원. 엔진은 이 값을 그대로 신뢰한다.
 */
@Getter
@EqualsAndHashCode
@ToString(exclude = "avatarUrl")
public final class AuthUser {

    private final String githubUserId;
    private final String login;
    private final String displayName;
    private final String avatarUrl;
    private final Set<UserRole> roles;

    public AuthUser(String githubUserId, String login, String displayName, String avatarUrl, Set<UserRole> roles) {
        this.githubUserId = Objects.requireNonNull(githubUserId, "githubUserId");
        this.login = Objects.requireNonNull(login, "login");
        this.displayName = (displayName == null || displayName.isBlank()) ? login : displayName;
        this.avatarUrl = Objects.requireNonNull(avatarUrl, "avatarUrl");
        this.roles = (roles == null || roles.isEmpty())
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(roles));
    }

    public AuthUser withRoles(Set<UserRole> newRoles) {
        return new AuthUser(githubUserId, login, displayName, avatarUrl, newRoles);
    }

    public boolean isModerator() {
        return roles.contains(UserRole.MODERATOR);
    }
}
