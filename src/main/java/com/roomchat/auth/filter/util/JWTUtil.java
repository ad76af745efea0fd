package com.roomchat.auth.filter.util;

import com.roomchat.auth.exception.InvalidSessionTokenException;
import com.roomchat.config.ChatRoomProperties;
import com.roomchat.protocol.AuthUser;
import com.roomchat.protocol.GithubUserIds;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtBuilder;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jws;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.Set;

/**
 * @class JWTUtil
 * @brief 세션 토큰(HS256 JWT) 발급/검증.
 *
 * @details
 * - claims: sub = GitHub 숫자 사용자 ID, login, avatarUrl, name(선택, 표시 이름)
 * - 서명 키는 chat.session.secret (32자 이상). 짧으면 기동 시점에 실패한다.
 * - 역할(role)은 토큰에 싣지 않는다. 모더레이터 여부는 서버 설정으로 입장 시점에 결정한다.
 */
@Component
public class JWTUtil {

    private static final String CLAIM_LOGIN = "login";
    private static final String CLAIM_AVATAR_URL = "avatarUrl";
    private static final String CLAIM_NAME = "name";
    private static final int MIN_SECRET_LENGTH = 32;

    private final SecretKey signingKey;
    private final Clock clock;

    public JWTUtil(ChatRoomProperties properties, Clock clock) {
        String secret = properties.getSession().getSecret();
        if (secret == null || secret.length() < MIN_SECRET_LENGTH) {
            throw new IllegalStateException("chat.session.secret 는 " + MIN_SECRET_LENGTH + "자 이상이어야 함");
        }
        this.signingKey = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.clock = clock;
    }

    public String issueToken(AuthUser user, Duration ttl) {
        Instant now = clock.instant();
        JwtBuilder builder = Jwts.builder()
                .subject(user.getGithubUserId())
                .claim(CLAIM_LOGIN, user.getLogin())
                .claim(CLAIM_AVATAR_URL, user.getAvatarUrl())
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plus(ttl)));
        if (!user.getDisplayName().equals(user.getLogin())) {
            builder.claim(CLAIM_NAME, user.getDisplayName());
        }
        return builder.signWith(signingKey, Jwts.SIG.HS256).compact();
    }

    /**
     * @method verify
     * @return 역할 없는 AuthUser
     * @throws InvalidSessionTokenException 서명/형식/만료/claims 오류
     */
    public AuthUser verify(String token) throws InvalidSessionTokenException {
        Jws<Claims> jws;
        String githubUserId;
        String login;
        String avatarUrl;
        String name;
        try {
            jws = Jwts.parser()
                    .verifyWith(signingKey)
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token);

            Claims claims = jws.getPayload();
            githubUserId = claims.getSubject();
            login = claims.get(CLAIM_LOGIN, String.class);
            avatarUrl = claims.get(CLAIM_AVATAR_URL, String.class);
            name = claims.get(CLAIM_NAME, String.class);
        } catch (ExpiredJwtException e) {
            throw new InvalidSessionTokenException("토큰 만료", true, e);
        } catch (JwtException | IllegalArgumentException e) {
            // claim 타입 불일치(RequiredTypeException)도 여기로 온다
            throw new InvalidSessionTokenException("토큰 검증 실패", false, e);
        }

        if (!"HS256".equals(jws.getHeader().getAlgorithm())) {
            throw new InvalidSessionTokenException("허용되지 않은 서명 알고리즘: " + jws.getHeader().getAlgorithm());
        }

        if (!GithubUserIds.isValid(githubUserId)) {
            throw new InvalidSessionTokenException("sub 가 GitHub 숫자 사용자 ID 가 아님");
        }
        if (login == null || login.isEmpty()) {
            throw new InvalidSessionTokenException("login claim 없음");
        }
        if (avatarUrl == null || !(avatarUrl.startsWith("https://") || avatarUrl.startsWith("http://"))) {
            throw new InvalidSessionTokenException("avatarUrl claim 형식 오류");
        }
        return new AuthUser(githubUserId, login, name, avatarUrl, Set.of());
    }
}
