package com.roomchat.websocketcore.model;

import com.roomchat.room.model.ConnectionChannel;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.SessionLimitExceededException;

import java.io.IOException;

/**
 * @class WebSocketSessionChannel
 * @brief WebSocketSession → ConnectionChannel 어댑터.
 *
 * @details
 * - ConcurrentWebSocketSessionDecorator 로 감싸서 느린 수신자 1명이 방 전체 전송을 붙잡지 않게 한다.
 *   send 시간/버퍼 한도를 넘으면 decorator 가 세션을 닫고, 여기서는 IOException 으로 바꿔 올린다.
 * - 엔진은 IOException 을 받으면 해당 연결을 끊긴 것으로 처리한다.
 */
public class WebSocketSessionChannel implements ConnectionChannel {

    private static final Logger logger = LogManager.getLogger(WebSocketSessionChannel.class);

    private final WebSocketSession session;

    public WebSocketSessionChannel(WebSocketSession session, int sendTimeLimitMs, int bufferSizeLimit) {
        this.session = new ConcurrentWebSocketSessionDecorator(session, sendTimeLimitMs, bufferSizeLimit);
    }

    @Override
    public String getId() {
        return session.getId();
    }

    @Override
    public void send(String payload) throws IOException {
        try {
            session.sendMessage(new TextMessage(payload));
        } catch (SessionLimitExceededException e) {
            throw new IOException("전송 한도 초과: " + e.getStatus(), e);
        } catch (IllegalStateException e) {
            // 이미 닫힌 세션
            throw new IOException("세션 닫힘", e);
        }
    }

    @Override
    public void close(int code, String reason) {
        if (!session.isOpen()) {
            return;
        }
        try {
            session.close(new CloseStatus(code, reason));
        } catch (IOException e) {
            logger.debug("[close] 세션 종료 중 오류 무시: sessionId={}, error={}", session.getId(), e.getMessage());
        }
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }
}
