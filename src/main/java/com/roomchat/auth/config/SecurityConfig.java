package com.roomchat.auth.config;

import com.roomchat.auth.exception.handler.JwtAuthenticationFailureHandler;
import com.roomchat.auth.filter.customfilter.JwtAuthProcessorFilter;
import com.roomchat.auth.filter.util.JWTUtil;
import com.roomchat.auth.service.UserRoleResolver;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;

@Configuration
@EnableWebSecurity
public class SecurityConfig {

    private final JWTUtil jwtUtil;
    private final UserRoleResolver userRoleResolver;

    public SecurityConfig(JWTUtil jwtUtil, UserRoleResolver userRoleResolver) {
        this.jwtUtil = jwtUtil;
        this.userRoleResolver = userRoleResolver;
    }

    /* 헬스 체크 : 인증 없이 허용 */
    @Bean
    public SecurityFilterChain healthFilterChain(HttpSecurity http) throws Exception {
        http.securityMatcher("/health")
            .authorizeHttpRequests(auth -> auth.anyRequest().permitAll())
            .csrf(csrf -> csrf.disable())
            .sessionManagement(sess -> sess.sessionCreationPolicy(SessionCreationPolicy.STATELESS));
        return http.build();
    }

    /* 채팅 WebSocket 업그레이드 : Bearer 세션 토큰 필수 */
    @Bean
    public SecurityFilterChain chatWebSocketFilterChain(HttpSecurity http) throws Exception {
        http.securityMatcher("/chat", "/chat/**")
            .authorizeHttpRequests(auth -> auth.anyRequest().authenticated())
            .csrf(csrf -> csrf.disable())
            .sessionManagement(sess -> sess.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
            .addFilterAt(new JwtAuthProcessorFilter(jwtUtil, userRoleResolver), UsernamePasswordAuthenticationFilter.class)
            .exceptionHandling(exception ->
                exception.authenticationEntryPoint(new JwtAuthenticationFailureHandler()));   // JWT 인증 실패 시 실행될 핸들러 등록
        return http.build();
    }
}
