package com.roomchat.room.message;

import com.roomchat.protocol.ChatMessagePlain;
import com.roomchat.protocol.ServerMessageNew;

/**
 * @class MessageCorrelation
 * @brief 발신자 화면의 낙관적 표시(clientMessageId)를 서버 확정 메시지와 잇기 위한 이벤트 쌍 생성/선택.
 *
 * @details
 * - 공개 이벤트에는 clientMessageId 를 절대 싣지 않는다.
 * - 발신자 이벤트는 clientMessageId 가 있을 때만 그것을 싣고, 없으면 공개 이벤트와 같은 인스턴스다.
 * - 수신자 선택은 사용자 ID 일치 여부로만 판단한다. 같은 사용자의 다른 연결(다른 창)도 발신자 이벤트를 받는다.
 */
public final class MessageCorrelation {

    private MessageCorrelation() {
    }

    public static CorrelatedMessageEvents createCorrelatedServerMessageNewEvents(ChatMessagePlain message,
                                                                                 String clientMessageId) {
        ServerMessageNew publicEvent = ServerMessageNew.publicVariant(message);
        if (clientMessageId == null) {
            return new CorrelatedMessageEvents(publicEvent, publicEvent);
        }
        return new CorrelatedMessageEvents(publicEvent, ServerMessageNew.senderVariant(message, clientMessageId));
    }

    public static ServerMessageNew pickCorrelatedServerMessageNewEvent(String recipientGithubUserId,
                                                                       String senderGithubUserId,
                                                                       CorrelatedMessageEvents events) {
        if (recipientGithubUserId != null && recipientGithubUserId.equals(senderGithubUserId)) {
            return events.getSenderEvent();
        }
        return events.getPublicEvent();
    }
}
