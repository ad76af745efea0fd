package com.roomchat.auth.exception.handler;

import com.roomchat.auth.filter.customfilter.JwtAuthProcessorFilter;
import com.roomchat.protocol.HandshakeRejection;
import com.roomchat.protocol.ProtocolCodec;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * JWT 인증 실패 시 401 + JSON 본문 {code, message}. 만료 토큰이면 code = auth_expired.
 */
public class JwtAuthenticationFailureHandler implements AuthenticationEntryPoint {

    private static final Logger logger = LoggerFactory.getLogger(JwtAuthenticationFailureHandler.class);

    @Override
    public void commence(HttpServletRequest request,
                         HttpServletResponse response,
                         AuthenticationException authException) throws IOException {
        boolean expired = Boolean.TRUE.equals(request.getAttribute(JwtAuthProcessorFilter.AUTH_EXPIRED_ATTRIBUTE));
        HandshakeRejection rejection = expired ? HandshakeRejection.authExpired() : HandshakeRejection.unauthorized();
        logger.warn("[인증 실패] uri={}, code={}", request.getRequestURI(), rejection.getCode().getWireName());

        response.setStatus(rejection.getStatus());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        response.getWriter().write(ProtocolCodec.encodeHandshakeRejection(rejection));
    }
}
