package com.roomchat.websocketcore.core;

import com.roomchat.config.ChatRoomProperties;
import com.roomchat.protocol.AuthUser;
import com.roomchat.room.core.RoomRegistry;
import com.roomchat.websocketcore.model.WebSocketSessionChannel;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.Optional;

/**
 * @class ChatTextWebSocketHandler
 * @brief WebSocket 연결/해제/수신 이벤트를 방 엔진으로 넘기는 지점.
 *
 * @responsibility
 * - 입장 시: 세션을 ConnectionChannel 로 감싸 방에 등록
 * - 수신 시: 텍스트 프레임을 그대로 방 엔진에 전달 (검증/처리는 엔진 몫)
 * - 퇴장 시: 방 엔진에서 연결 제거 (중복 호출 안전)
 * - 바이너리 프레임은 TextWebSocketHandler 기본 동작대로 연결을 닫는다
 *
 * @called_by WebSocketConfig.registerWebSocketHandlers()
 */
public class ChatTextWebSocketHandler extends TextWebSocketHandler {

    private static final Logger logger = LogManager.getLogger(ChatTextWebSocketHandler.class);

    private final RoomRegistry roomRegistry;
    private final ChatRoomProperties.Outbound outbound;

    public ChatTextWebSocketHandler(RoomRegistry roomRegistry, ChatRoomProperties properties) {
        this.roomRegistry = roomRegistry;
        this.outbound = properties.getOutbound();
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws Exception {
        String roomId = roomIdOf(session)
                .orElseThrow(() -> new IllegalStateException("roomId 없음"));
        AuthUser user = Optional.ofNullable((AuthUser) session.getAttributes().get(ChatHandShakeIntercepter.AUTH_USER_ATTRIBUTE))
                .orElseThrow(() -> new IllegalStateException("authUser 없음"));

        logger.info("[입장] roomId={}, userId={}, sessionId={}", roomId, user.getGithubUserId(), session.getId());

        WebSocketSessionChannel channel = new WebSocketSessionChannel(session,
                (int) outbound.getSendTimeLimit().toMillis(), outbound.getBufferSizeLimit());
        roomRegistry.connect(roomId, channel, user);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        Optional<String> roomId = roomIdOf(session);
        if (roomId.isEmpty()) {
            logger.warn("[수신] roomId 없는 세션: sessionId={}", session.getId());
            return;
        }
        roomRegistry.receive(roomId.get(), session.getId(), message.getPayload());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        Optional<String> roomId = roomIdOf(session);
        logger.info("[퇴장] roomId={}, sessionId={}, status={}", roomId.orElse("Unknown"), session.getId(), status);
        roomId.ifPresent(id -> roomRegistry.disconnect(id, session.getId()));
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        Optional<String> roomId = roomIdOf(session);
        logger.error("[오류 종료] roomId={}, sessionId={}, 이유={}", roomId.orElse("Unknown"), session.getId(), exception.getMessage());
        roomId.ifPresent(id -> roomRegistry.disconnect(id, session.getId()));
    }

    private static Optional<String> roomIdOf(WebSocketSession session) {
        return Optional.ofNullable((String) session.getAttributes().get(ChatHandShakeIntercepter.ROOM_ID_ATTRIBUTE));
    }
}
