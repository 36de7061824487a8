package com.bluecodes.common.security;

import com.bluecodes.common.exception.BusinessException;
import jakarta.servlet.*;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.io.IOException;

/**
 * JWT 인증 필터.
 *
 * <p>Authorization 헤더의 Bearer 토큰을 검증하고, 성공하면 {@link TokenClaims}를
 * {@link #CLAIMS_ATTRIBUTE} 요청 속성에 저장한다. 컨트롤러는
 * {@code @RequestAttribute(name = CLAIMS_ATTRIBUTE, required = false)}로 꺼내 쓴다.</p>
 *
 * <p>토큰이 없거나 잘못돼도 요청을 막지 않는다. 공개 API(상품 조회, 체크아웃)도 같은 필터를 지나기 때문이다.
 * 인증이 필요한 API에서 속성이 비어 있으면 서비스 계층이 UNAUTHORIZED를 던진다.</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AuthenticationFilter implements Filter {

    public static final String CLAIMS_ATTRIBUTE = "tokenClaims";

    private static final String BEARER_PREFIX = "Bearer ";

    private final JwtTokenProvider jwtTokenProvider;

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        HttpServletRequest httpRequest = (HttpServletRequest) request;
        String token = resolveToken(httpRequest);

        if (token != null) {
            try {
                httpRequest.setAttribute(CLAIMS_ATTRIBUTE, jwtTokenProvider.parseClaims(token));
            } catch (BusinessException e) {
                // 여기서는 거절하지 않는다. 보호된 API에서 속성이 없으면 401이 된다.
                log.debug("Rejected bearer token on {}: {}", httpRequest.getRequestURI(), e.getMessage());
            }
        }

        chain.doFilter(request, response);
    }

    // "Bearer eyJhbGci..." → "eyJhbGci..."
    private String resolveToken(HttpServletRequest request) {
        String bearer = request.getHeader("Authorization");
        if (StringUtils.hasText(bearer) && bearer.startsWith(BEARER_PREFIX)) {
            return bearer.substring(BEARER_PREFIX.length());
        }
        return null;
    }
}
