package com.roomchat.protocol;

/**
 * 클라이언트/서버 공통 프로토콜 상수
 */
public final class ProtocolConstants {

    /** 모든 서버 이벤트에 찍히는 프로토콜 버전 */
    public static final int PROTOCOL_VERSION = 4;

    /** 채팅 본문 최대 길이(문자 수) */
    public static final int CHAT_MESSAGE_TEXT_MAX_LEN = 500;

    public static final int CLIENT_MESSAGE_ID_MAX_LEN = 128;

    public static final int GITHUB_USER_ID_MAX_LEN = 32;

    private ProtocolConstants() {
    }
}
