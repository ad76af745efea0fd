package com.roomchat.auth.filter.util;

import jakarta.servlet.http.HttpServletRequest;

/**
 * 요청 헤더에서 인증/클라이언트 정보 추출
 */
public final class HeaderUtil {

    private static final String BEARER_PREFIX = "bearer ";

    private HeaderUtil() {
    }

    /**
     * @return "Authorization: Bearer {token}" 의 token, 형식이 다르면 null
     */
    public static String extractBearerToken(String authorizationHeader) {
        if (authorizationHeader == null) {
            return null;
        }
        String trimmed = authorizationHeader.trim();
        if (trimmed.length() <= BEARER_PREFIX.length()
                || !trimmed.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            return null;
        }
        String token = trimmed.substring(BEARER_PREFIX.length()).trim();
        return token.isEmpty() ? null : token;
    }

    /**
     * 클라이언트 IP: X-Forwarded-For 첫 항목 → remoteAddr. 둘 다 없으면 null.
     */
    public static String resolveClientIp(HttpServletRequest request) {
        String forwardedFor = request.getHeader("X-Forwarded-For");
        if (forwardedFor != null) {
            String first = forwardedFor.split(",")[0].trim();
            if (!first.isEmpty()) {
                return first;
            }
        }
        String remoteAddr = request.getRemoteAddr();
        return (remoteAddr == null || remoteAddr.isEmpty()) ? null : remoteAddr;
    }
}
