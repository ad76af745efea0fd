package com.roomchat.auth.filter.util;

import com.roomchat.auth.exception.InvalidSessionTokenException;
import com.roomchat.config.ChatRoomProperties;
import com.roomchat.protocol.AuthUser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Date;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class JWTUtilTest {

    private static final String SECRET = "0123456789abcdef0123456789abcdef";
    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    private JWTUtil jwtUtil;

    private static ChatRoomProperties properties(String secret) {
        ChatRoomProperties properties = new ChatRoomProperties();
        properties.getSession().setSecret(secret);
        return properties;
    }

    @BeforeEach
    public void setup() {
        jwtUtil = new JWTUtil(properties(SECRET), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    public void issuedTokenVerifies() throws Exception {
        AuthUser user = new AuthUser("42", "octocat", "The Octocat", "https://avatars.example.com/42", Set.of());

        AuthUser verified = jwtUtil.verify(jwtUtil.issueToken(user, Duration.ofHours(1)));

        assertEquals("42", verified.getGithubUserId());
        assertEquals("octocat", verified.getLogin());
        assertEquals("The Octocat", verified.getDisplayName());
        assertTrue(verified.getRoles().isEmpty());
    }

    @Test
    public void displayNameFallsBackToLogin() throws Exception {
        AuthUser user = new AuthUser("42", "octocat", null, "https://avatars.example.com/42", Set.of());

        assertEquals("octocat", jwtUtil.verify(jwtUtil.issueToken(user, Duration.ofHours(1))).getDisplayName());
    }

    @Test
    public void expiredTokenIsFlagged() {
        AuthUser user = new AuthUser("42", "octocat", null, "https://avatars.example.com/42", Set.of());
        String token = jwtUtil.issueToken(user, Duration.ofMinutes(1));

        JWTUtil later = new JWTUtil(properties(SECRET), Clock.fixed(NOW.plus(Duration.ofHours(1)), ZoneOffset.UTC));
        InvalidSessionTokenException e = assertThrows(InvalidSessionTokenException.class, () -> later.verify(token));
        assertTrue(e.isExpired());
    }

    @Test
    public void tokenSignedWithOtherKeyIsRejected() {
        JWTUtil other = new JWTUtil(properties("ffffffffffffffffffffffffffffffff"), Clock.fixed(NOW, ZoneOffset.UTC));
        AuthUser user = new AuthUser("42", "octocat", null, "https://avatars.example.com/42", Set.of());
        String token = other.issueToken(user, Duration.ofHours(1));

        InvalidSessionTokenException e = assertThrows(InvalidSessionTokenException.class, () -> jwtUtil.verify(token));
        assertFalse(e.isExpired());
    }

    @Test
    public void claimsAreValidated() {
        String nonNumericSub = Jwts.builder()
                .subject("octocat")
                .claim("login", "octocat")
                .claim("avatarUrl", "https://avatars.example.com/42")
                .expiration(Date.from(NOW.plusSeconds(60)))
                .signWith(Keys.hmacShaKeyFor(SECRET.getBytes(StandardCharsets.UTF_8)), Jwts.SIG.HS256)
                .compact();
        assertThrows(InvalidSessionTokenException.class, () -> jwtUtil.verify(nonNumericSub));

        String badAvatar = Jwts.builder()
                .subject("42")
                .claim("login", "octocat")
                .claim("avatarUrl", "javascript:alert(1)")
                .expiration(Date.from(NOW.plusSeconds(60)))
                .signWith(Keys.hmacShaKeyFor(SECRET.getBytes(StandardCharsets.UTF_8)), Jwts.SIG.HS256)
                .compact();
        assertThrows(InvalidSessionTokenException.class, () -> jwtUtil.verify(badAvatar));

        assertThrows(InvalidSessionTokenException.class, () -> jwtUtil.verify("not.a.jwt"));
    }

    @Test
    public void shortSecretFailsFast() {
        assertThrows(IllegalStateException.class,
                () -> new JWTUtil(properties("too-short"), Clock.systemUTC()));
    }
}
