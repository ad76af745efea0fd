package com.roomchat.protocol;

/**
 * @interface ServerEvent
 * @brief 서버가 내보내는 이벤트의 닫힌 합 타입. 모든 이벤트는 프로토콜 버전을 싣는다.
 * @see ProtocolCodec#encode(ServerEvent) type 별 직렬화 (switch 로 전 variant 처리)
 */
public sealed interface ServerEvent
        permits ServerWelcome, ServerMessageNew, ServerDmWelcome, ServerDmMessageNew, ServerPresence, ServerError,
                ServerModerationSnapshot, ServerModerationUserDenied, ServerModerationUserAllowed {

    ServerEventType getType();

    default int getVersion() {
        return ProtocolConstants.PROTOCOL_VERSION;
    }
}
