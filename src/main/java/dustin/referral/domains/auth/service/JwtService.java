package dustin.referral.domains.auth.service;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;

/**
 * JWT 서비스
 * JWT Service for access token verification
 * 
 * - 토큰 발급은 외부 인증 서비스 담당, 여기서는 같은 비밀키로 검증만 수행
 * - generateAccessToken은 운영 도구와 테스트용
 */
@Service
public class JwtService {

    private static final Duration ACCESS_TOKEN_TTL = Duration.ofHours(1);

    private final SecretKey secretKey;

    public JwtService(@Value("${jwt.secret}") String secret) {
        this.secretKey = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Access Token 발급 (1시간 만료)
     */
    public String generateAccessToken(Long userId, String email) {
        Instant now = Instant.now();

        return Jwts.builder()
                .subject(String.valueOf(userId))
                .claim("email", email)
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plus(ACCESS_TOKEN_TTL)))
                .signWith(secretKey)
                .compact();
    }

    /**
     * Access Token 검증 및 Claims 추출
     * Verify Access Token and extract Claims
     * 
     * @throws JwtException 서명 불일치, 만료, 형식 오류
     */
    public Claims verifyAccessToken(String token) {
        return Jwts.parser()
                .verifyWith(secretKey)
                .build()
                .parseSignedClaims(token)
                .getPayload();
    }

    /**
     * Access Token에서 사용자 ID 추출
     * 
     * @throws JwtException 검증 실패 또는 subject가 숫자가 아님
     */
    public Long extractUserId(String token) {
        String subject = verifyAccessToken(token).getSubject();
        try {
            return Long.parseLong(subject);
        } catch (NumberFormatException e) {
            throw new JwtException("Token subject is not a user id: " + subject, e);
        }
    }
}
