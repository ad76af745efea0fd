package com.roomchat.protocol;

/**
 * 클라이언트 → 서버 이벤트 type 값
 */
public enum ClientEventType {
    HELLO("client/hello"),
    MESSAGE_SEND("client/message.send"),
    DM_IDENTITY_PUBLISH("client/dm.identity.publish"),
    DM_OPEN("client/dm.open"),
    DM_MESSAGE_SEND("client/dm.message.send"),
    MODERATION_USER_DENY("client/moderation.user.deny"),
    MODERATION_USER_ALLOW("client/moderation.user.allow");

    private final String wireName;

    ClientEventType(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    /**
     * @return 일치하는 type, 없으면 null
     */
    public static ClientEventType fromWireName(String wireName) {
        for (ClientEventType type : values()) {
            if (type.wireName.equals(wireName)) {
                return type;
            }
        }
        return null;
    }
}
