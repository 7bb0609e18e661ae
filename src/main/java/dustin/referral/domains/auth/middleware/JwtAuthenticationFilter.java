package dustin.referral.domains.auth.middleware;

import dustin.referral.domains.auth.service.JwtService;
import io.jsonwebtoken.JwtException;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * JWT 인증 필터
 * JWT Authentication Filter
 * 
 * - Authorization: Bearer <token> 검증 후 Request Attribute "userId"에 사용자 ID 저장
 * - Swagger 문서와 추천 코드 검증 API는 인증 없이 통과
 * - /api/ 밖의 경로는 검사하지 않음
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    private final JwtService jwtService;

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getRequestURI();
        // Swagger UI, /api-docs 는 /api/ 밖의 경로
        return !path.startsWith("/api/") ||
               // 가입 화면에서 호출하는 공개 API
               path.startsWith("/api/referral/code/validate");
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain
    ) throws ServletException, IOException {

        String authHeader = request.getHeader("Authorization");

        if (authHeader == null || !authHeader.startsWith("Bearer ")) {
            writeUnauthorized(response, "Missing or invalid authorization header");
            return;
        }

        String token = authHeader.substring(7); // "Bearer " 제거

        Long userId;
        String email;
        try {
            var claims = jwtService.verifyAccessToken(token);
            userId = Long.parseLong(claims.getSubject());
            email = claims.get("email", String.class);
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("[JwtAuthenticationFilter] 토큰 검증 실패: path={}, reason={}", request.getRequestURI(), e.getMessage());
            writeUnauthorized(response, "Invalid or expired token");
            return;
        }

        request.setAttribute("userId", userId);
        request.setAttribute("email", email);

        filterChain.doFilter(request, response);
    }

    private void writeUnauthorized(HttpServletResponse response, String message) throws IOException {
        if (response.isCommitted()) {
            return;
        }
        response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        response.setContentType("application/json; charset=UTF-8");
        response.getWriter().write("{\"error\":\"UNAUTHORIZED\",\"message\":\"" + message + "\"}");
        response.getWriter().flush();
    }
}
