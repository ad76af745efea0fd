package com.roomchat.auth.filter.util;

import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;

import static org.junit.jupiter.api.Assertions.*;

public class HeaderUtilTest {

    @Test
    public void extractsBearerTokenCaseInsensitively() {
        assertEquals("abc", HeaderUtil.extractBearerToken("Bearer abc"));
        assertEquals("abc", HeaderUtil.extractBearerToken("bearer   abc "));
        assertNull(HeaderUtil.extractBearerToken("Basic abc"));
        assertNull(HeaderUtil.extractBearerToken("Bearer "));
        assertNull(HeaderUtil.extractBearerToken(null));
    }

    @Test
    public void clientIpPrefersFirstForwardedAddress() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.setRemoteAddr("10.0.0.9");
        assertEquals("10.0.0.9", HeaderUtil.resolveClientIp(request));

        request.addHeader("X-Forwarded-For", " 203.0.113.5 , 10.0.0.1");
        assertEquals("203.0.113.5", HeaderUtil.resolveClientIp(request));
    }
}
