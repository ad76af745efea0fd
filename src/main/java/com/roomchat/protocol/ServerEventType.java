package com.roomchat.protocol;

/**
 * 서버 → 클라이언트 이벤트 type 값
 */
public enum ServerEventType {
    WELCOME("server/welcome"),
    MESSAGE_NEW("server/message.new"),
    DM_WELCOME("server/dm.welcome"),
    DM_MESSAGE_NEW("server/dm.message.new"),
    PRESENCE("server/presence"),
    ERROR("server/error"),
    MODERATION_SNAPSHOT("server/moderation.snapshot"),
    MODERATION_USER_DENIED("server/moderation.user.denied"),
    MODERATION_USER_ALLOWED("server/moderation.user.allowed");

    private final String wireName;

    ServerEventType(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }
}
