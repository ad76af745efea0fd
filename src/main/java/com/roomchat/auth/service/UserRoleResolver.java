package com.roomchat.auth.service;

import com.roomchat.config.ChatRoomProperties;
import com.roomchat.protocol.AuthUser;
import com.roomchat.protocol.GithubUserIds;
import com.roomchat.protocol.UserRole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Set;

/**
 * 검증된 사용자에 서버 설정 기반 역할을 붙인다 (chat.moderation.moderator-github-user-ids).
 */
@Component
public class UserRoleResolver {

    private static final Logger logger = LoggerFactory.getLogger(UserRoleResolver.class);

    private final Set<String> moderatorGithubUserIds;

    public UserRoleResolver(ChatRoomProperties properties) {
        try {
            this.moderatorGithubUserIds = GithubUserIds.parseList(
                    properties.getModeration().getModeratorGithubUserIds(),
                    "chat.moderation.moderator-github-user-ids");
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("잘못된 설정: " + e.getMessage(), e);
        }
        logger.info("[moderation] 모더레이터 수={}", moderatorGithubUserIds.size());
    }

    public AuthUser resolve(AuthUser user) {
        Set<UserRole> roles = EnumSet.noneOf(UserRole.class);
        if (moderatorGithubUserIds.contains(user.getGithubUserId())) {
            roles.add(UserRole.MODERATOR);
        }
        return user.withRoles(roles);
    }
}
