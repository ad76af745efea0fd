package com.roomchat.websocketcore.core;

import com.roomchat.auth.filter.customfilter.JwtAuthProcessorFilter;
import com.roomchat.auth.filter.util.HeaderUtil;
import com.roomchat.protocol.AuthUser;
import com.roomchat.protocol.HandshakeRejection;
import com.roomchat.protocol.ProtocolCodec;
import com.roomchat.room.RoomIds;
import com.roomchat.room.core.RoomRegistry;
import jakarta.servlet.http.HttpServletRequest;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.http.server.ServletServerHttpRequest;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Optional;

/**
 * @class ChatHandShakeIntercepter
 * @brief WebSocket 핸드셰이크 시 방 ID/인증 사용자/클라이언트 IP 를 확인하고 방 입장 심사를 거쳐
 *        세션 attributes 에 주입하는 인터셉터.
 * @see org.springframework.web.socket.server.HandshakeInterceptor
 */
public class ChatHandShakeIntercepter implements HandshakeInterceptor {

    public static final String ROOM_ID_ATTRIBUTE = "roomId";
    public static final String AUTH_USER_ATTRIBUTE = "authUser";

    private static final Logger logger = LogManager.getLogger(ChatHandShakeIntercepter.class);

    private final RoomRegistry roomRegistry;

    /**
     * @constructor ChatHandShakeIntercepter
     * @param roomRegistry 방 조회/입장 심사 책임 객체 DI
     */
    public ChatHandShakeIntercepter(RoomRegistry roomRegistry) {
        this.roomRegistry = roomRegistry;
    }

    /**
     * @override beforeHandshake
     * @brief 업그레이드 직전 호출. 거절 시 HTTP status + JSON 본문 {code, message, retryAfterMs?} 를 응답에 쓴다.
     * @return boolean 핸드셰이크 허용 여부(true=허용, false=거부)
     */
    @Override
    public boolean beforeHandshake(ServerHttpRequest request, ServerHttpResponse response,
                                   WebSocketHandler wsHandler, Map<String, Object> attributes) throws Exception {

        // @step1: ServletHttpRequest로 캐스팅, 실제 HTTP 파라미터 추출
        HttpServletRequest servletRequest = ((ServletServerHttpRequest) request).getServletRequest();

        // @step2: 방 ID 파라미터 (없으면 기본 방)
        String roomId = RoomIds.resolve(servletRequest.getParameter("room"));
        if (roomId == null) {
            logger.warn("[beforeHandshake] room 파라미터 형식 오류 - 핸드셰이크 거부");
            reject(response, HandshakeRejection.invalidRoom());
            return false;
        }

        // @step3: 인증 사용자 (JwtAuthProcessorFilter 에서 설정)
        AuthUser user = (AuthUser) servletRequest.getAttribute(JwtAuthProcessorFilter.AUTH_USER_ATTRIBUTE);
        if (user == null) {
            logger.warn("[beforeHandshake] 인증 사용자 없음 - 핸드셰이크 거부: roomId={}", roomId);
            reject(response, HandshakeRejection.unauthorized());
            return false;
        }

        // @step4: 방 입장 심사 (연결 빈도 → 차단 → 정원 → 사용자별 연결 수)
        String clientIp = HeaderUtil.resolveClientIp(servletRequest);
        Optional<HandshakeRejection> rejection = roomRegistry.admit(roomId, user, clientIp);
        if (rejection.isPresent()) {
            logger.info("[beforeHandshake] 입장 거부: roomId={}, userId={}, code={}",
                    roomId, user.getGithubUserId(), rejection.get().getCode().getWireName());
            reject(response, rejection.get());
            return false;
        }

        // @step5: 세션 attributes 등록(WebSocketSession.getAttributes()로 복사됨)
        attributes.put(ROOM_ID_ATTRIBUTE, roomId);
        attributes.put(AUTH_USER_ATTRIBUTE, user);
        logger.info("[beforeHandshake] 핸드셰이크 허용: roomId={}, userId={}", roomId, user.getGithubUserId());
        return true;
    }

    @Override
    public void afterHandshake(ServerHttpRequest request, ServerHttpResponse response,
                               WebSocketHandler wsHandler, Exception exception) {
        if (exception != null) {
            logger.error("[afterHandshake] 핸드셰이크 실패: {}", exception.getMessage());
        }
    }

    private static void reject(ServerHttpResponse response, HandshakeRejection rejection) throws IOException {
        response.setStatusCode(HttpStatusCode.valueOf(rejection.getStatus()));
        response.getHeaders().setContentType(new MediaType(MediaType.APPLICATION_JSON, StandardCharsets.UTF_8));
        rejection.getRetryAfterMs().ifPresent(retryAfterMs ->
                response.getHeaders().set(HttpHeaders.RETRY_AFTER, String.valueOf((retryAfterMs + 999) / 1000)));
        response.getBody().write(ProtocolCodec.encodeHandshakeRejection(rejection).getBytes(StandardCharsets.UTF_8));
    }
}
