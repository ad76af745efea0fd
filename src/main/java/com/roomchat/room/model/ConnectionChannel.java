package com.roomchat.room.model;

import java.io.IOException;

/**
 * @interface ConnectionChannel
 * @brief 엔진이 연결 1개에 대해 필요로 하는 전송 기능만 추린 추상화.
 *
 * @details
 * - 실제 구현은 WebSocketSession 을 감싼다 (websocketcore.model.WebSocketSessionChannel).
 * - 테스트에서는 보낸 프레임을 기록하는 가짜 구현으로 대체한다.
 */
public interface ConnectionChannel {

    /** 연결 식별자. 연결이 살아있는 동안 바뀌지 않는다. */
    String getId();

    /**
     * @throws IOException 전송 실패 (느린 수신자 한도 초과 포함). 호출 측은 이 연결을 끊긴 것으로 본다.
     */
    void send(String payload) throws IOException;

    /** 이미 닫힌 연결에 대해서도 안전해야 한다. */
    void close(int code, String reason);

    boolean isOpen();
}
