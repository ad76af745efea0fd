package com.roomchat.auth.exception.handler;

import com.roomchat.auth.filter.customfilter.JwtAuthProcessorFilter;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.authentication.InsufficientAuthenticationException;

import static org.junit.jupiter.api.Assertions.*;

public class JwtAuthenticationFailureHandlerTest {

    private final JwtAuthenticationFailureHandler handler = new JwtAuthenticationFailureHandler();

    @Test
    public void respondsUnauthorizedJson() throws Exception {
        MockHttpServletResponse response = new MockHttpServletResponse();

        handler.commence(new MockHttpServletRequest("GET", "/chat"), response,
                new InsufficientAuthenticationException("no token"));

        assertEquals(401, response.getStatus());
        assertEquals("unauthorized", new JSONObject(response.getContentAsString()).getString("code"));
    }

    @Test
    public void expiredSessionUsesAuthExpiredCode() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/chat");
        request.setAttribute(JwtAuthProcessorFilter.AUTH_EXPIRED_ATTRIBUTE, Boolean.TRUE);
        MockHttpServletResponse response = new MockHttpServletResponse();

        handler.commence(request, response, new InsufficientAuthenticationException("expired"));

        assertEquals(401, response.getStatus());
        assertEquals("auth_expired", new JSONObject(response.getContentAsString()).getString("code"));
    }
}
