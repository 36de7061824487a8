package com.bluecodes.common.security;

import com.bluecodes.common.exception.BusinessException;
import com.bluecodes.common.exception.ErrorCode;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.util.Date;

/**
 * JWT 토큰 생성/검증 컴포넌트.
 *
 * <p>HMAC-SHA256 대칭 키로 서명한다. 시크릿은 {@code jwt.secret}(환경 변수 JWT_SECRET)에서 주입받는다.</p>
 *
 * <h3>토큰 구조 (JWT Claims)</h3>
 * <pre>
 *   Payload: {"sub":  "buyer@example.com",  ← 이메일
 *             "role": "user",               ← user | admin
 *             "iat":  1700000000,
 *             "exp":  1700043200}           ← 기본 12시간
 * </pre>
 *
 * <p>서명 불일치, 만료, 형식 오류, subject 누락, 알 수 없는 role은 모두
 * {@link ErrorCode#UNAUTHORIZED}로 통일한다. 어떤 이유로 실패했는지 클라이언트에 구분해 주지 않는다.</p>
 */
@Component
public class JwtTokenProvider {

    static final String ROLE_CLAIM = "role";

    private final SecretKey key;
    private final long expiration;   // 밀리초 (기본 12시간 = 43200000ms)

    public JwtTokenProvider(
            @Value("${jwt.secret:bluecodesDevelopmentSecretKeyThatIsLongEnoughForHs256}") String secret,
            @Value("${jwt.expiration:43200000}") long expiration) {
        // HS256은 256비트 이상의 키를 요구한다. 짧은 시크릿이면 JJWT가 서명 시점에 WeakKeyException을 던진다.
        this.key = new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), "HmacSHA256");
        this.expiration = expiration;
    }

    public String createToken(String email, Role role) {
        Date now = new Date();
        return Jwts.builder()
                .subject(email)
                .claim(ROLE_CLAIM, role.claimValue())
                .issuedAt(now)
                .expiration(new Date(now.getTime() + expiration))
                .signWith(key)
                .compact();
    }

    /**
     * 토큰을 검증하고 클레임을 꺼낸다.
     * role 클레임이 없으면 user로 본다.
     *
     * @throws BusinessException UNAUTHORIZED - 어떤 이유로든 검증 실패 시
     */
    public TokenClaims parseClaims(String token) {
        Claims claims;
        try {
            claims = Jwts.parser()
                    .verifyWith(key)
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
        } catch (JwtException | IllegalArgumentException e) {
            throw new BusinessException(ErrorCode.UNAUTHORIZED, ErrorCode.UNAUTHORIZED.getMessage(), e);
        }

        String email = claims.getSubject();
        if (!StringUtils.hasText(email)) {
            throw new BusinessException(ErrorCode.UNAUTHORIZED);
        }
        String roleValue = claims.get(ROLE_CLAIM, String.class);
        try {
            Role role = roleValue == null ? Role.USER : Role.fromClaim(roleValue);
            return new TokenClaims(email, role);
        } catch (IllegalArgumentException e) {
            throw new BusinessException(ErrorCode.UNAUTHORIZED, ErrorCode.UNAUTHORIZED.getMessage(), e);
        }
    }
}
