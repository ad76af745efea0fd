package com.roomchat.auth.filter.customfilter;

import com.roomchat.auth.exception.InvalidSessionTokenException;
import com.roomchat.auth.filter.util.HeaderUtil;
import com.roomchat.auth.filter.util.JWTUtil;
import com.roomchat.auth.service.UserRoleResolver;
import com.roomchat.protocol.AuthUser;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;
import java.util.Locale;

/**
 * @class JwtAuthProcessorFilter
 * @brief WebSocket 업그레이드 요청의 Bearer 세션 토큰 검증.
 *
 * @details
 * - 성공: SecurityContext 에 인증 설정 + 요청 attribute 에 AuthUser 저장 (핸드셰이크 인터셉터가 읽는다)
 * - 실패: 인증 없이 체인을 계속 진행 → 인가 단계에서 401 (JwtAuthenticationFailureHandler)
 *   만료 여부는 요청 attribute 로 넘겨서 응답 code 를 auth_expired 로 구분한다.
 */
public class JwtAuthProcessorFilter extends OncePerRequestFilter {

    private static final Logger logger = LoggerFactory.getLogger(JwtAuthProcessorFilter.class);

    public static final String AUTH_USER_ATTRIBUTE = "authUser";
    public static final String AUTH_EXPIRED_ATTRIBUTE = "authExpired";

    private final JWTUtil jwtUtil;
    private final UserRoleResolver userRoleResolver;

    public JwtAuthProcessorFilter(JWTUtil jwtUtil, UserRoleResolver userRoleResolver) {
        this.jwtUtil = jwtUtil;
        this.userRoleResolver = userRoleResolver;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain)
                                    throws ServletException, IOException {
        logger.debug("JwtAuthProcessorFilter - 요청 처리 시작: {} {}", request.getMethod(), request.getRequestURI());

        // 1. Authorization 헤더에서 Bearer 토큰 추출
        String token = HeaderUtil.extractBearerToken(request.getHeader("Authorization"));
        if (token == null) {
            logger.warn("Authorization 헤더 내 Bearer 토큰이 존재하지 않음");
            filterChain.doFilter(request, response);
            return;
        }

        // 2. 서명/만료/claims 검증
        AuthUser verified;
        try {
            verified = jwtUtil.verify(token);
        } catch (InvalidSessionTokenException e) {
            logger.warn("JWT 토큰 검증 실패: expired={}, reason={}", e.isExpired(), e.getMessage());
            if (e.isExpired()) {
                request.setAttribute(AUTH_EXPIRED_ATTRIBUTE, Boolean.TRUE);
            }
            SecurityContextHolder.clearContext();
            filterChain.doFilter(request, response);
            return;
        }

        // 3. 서버 설정 기반 역할 부여
        AuthUser user = userRoleResolver.resolve(verified);

        // 4. SecurityContext + 요청 attribute 설정
        List<SimpleGrantedAuthority> authorities = user.getRoles().stream()
                .map(role -> new SimpleGrantedAuthority("ROLE_" + role.name().toUpperCase(Locale.ROOT)))
                .toList();
        UsernamePasswordAuthenticationToken authentication =
                new UsernamePasswordAuthenticationToken(user.getGithubUserId(), null, authorities);
        authentication.setDetails(user.getLogin());
        SecurityContextHolder.getContext().setAuthentication(authentication);

        request.setAttribute(AUTH_USER_ATTRIBUTE, user);   /* WebSocket 핸드셰이크 인터셉터에서 사용 */

        logger.info("JWT 인증 성공: userId={}, login={}", user.getGithubUserId(), user.getLogin());
        filterChain.doFilter(request, response);
    }
}
