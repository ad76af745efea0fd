package com.roomchat.protocol;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.Objects;

/**
 * @class ChatMessagePlain
 * @brief 수락된 채팅 메시지 1건. 생성 이후 변경되지 않는다.
 * @note 클라이언트 correlation id 는 여기 담지 않는다. 히스토리에 저장되거나 다른 사용자에게 새지 않도록
 *       발신자용 이벤트(ServerMessageNew)에만 붙는다.
 */
@Getter
@EqualsAndHashCode
@ToString(exclude = "text")
public final class ChatMessagePlain {

    private final String id;
    private final AuthUser user;
    private final String text;
    private final Instant createdAt;

    public ChatMessagePlain(String id, AuthUser user, String text, Instant createdAt) {
        this.id = Objects.requireNonNull(id, "id");
        this.user = Objects.requireNonNull(user, "user");
        this.text = Objects.requireNonNull(text, "text");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
    }
}
