package com.bluecodes.storefront.user.service;

import com.bluecodes.common.exception.BusinessException;
import com.bluecodes.common.exception.ErrorCode;
import com.bluecodes.common.security.JwtTokenProvider;
import com.bluecodes.common.security.Role;
import com.bluecodes.common.security.TokenClaims;
import com.bluecodes.storefront.user.entity.User;
import com.bluecodes.storefront.user.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * 회원가입/로그인과 요청자 확인.
 *
 * <h3>인증 흐름</h3>
 * <pre>
 *   AuthenticationFilter  : Bearer 토큰 서명/만료 검증 → TokenClaims 요청 속성
 *   AuthService           : TokenClaims의 이메일이 실제 가입자인지 확인
 *   requireAdmin          : role == admin 이 아니면 403
 * </pre>
 *
 * <p>토큰이 없는 요청과 서명이 깨진 요청은 필터 단계에서 구분되지 않는다.
 * 둘 다 claims == null로 들어와 401이 된다.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuthService {

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final JwtTokenProvider jwtTokenProvider;

    public String register(String email, String password, String name) {
        if (userRepository.findByEmail(email).isPresent()) {
            throw new BusinessException(ErrorCode.DUPLICATE_EMAIL);
        }

        User user = User.builder()
                .email(email)
                .name(name)
                .passwordHash(passwordEncoder.encode(password))
                .role(Role.USER)
                .build();
        try {
            userRepository.save(user);
        } catch (DuplicateKeyException e) {
            // 동시 가입 요청이 사전 검사를 함께 통과한 경우 (unique index가 막는다)
            throw new BusinessException(ErrorCode.DUPLICATE_EMAIL, ErrorCode.DUPLICATE_EMAIL.getMessage(), e);
        }

        log.info("User registered: email={}", email);
        return jwtTokenProvider.createToken(email, Role.USER);
    }

    // 이메일 미존재와 비밀번호 불일치는 같은 에러로 응답한다
    public String login(String email, String password) {
        User user = userRepository.findByEmail(email)
                .filter(found -> passwordEncoder.matches(password, found.getPasswordHash()))
                .orElseThrow(() -> new BusinessException(ErrorCode.INVALID_CREDENTIALS));
        return jwtTokenProvider.createToken(user.getEmail(), user.getRole());
    }

    /**
     * 보호된 API의 요청자를 확인한다.
     *
     * @throws BusinessException UNAUTHORIZED - 토큰이 없거나/유효하지 않거나, 가입자가 아닐 때
     */
    public User authenticate(TokenClaims claims) {
        if (claims == null) {
            throw new BusinessException(ErrorCode.UNAUTHORIZED);
        }
        return userRepository.findByEmail(claims.email())
                .orElseThrow(() -> new BusinessException(ErrorCode.UNAUTHORIZED));
    }

    /**
     * 관리자 전용 API 가드. 인증 실패는 401, role 불일치는 403.
     * role은 토큰의 role 클레임으로 판단한다.
     */
    public User requireAdmin(TokenClaims claims) {
        User user = authenticate(claims);
        if (!claims.isAdmin()) {
            throw new BusinessException(ErrorCode.ADMIN_ONLY);
        }
        return user;
    }

    /**
     * 공개 API(체크아웃)에서 로그인한 사용자를 선택적으로 식별한다. 실패해도 예외를 던지지 않는다.
     */
    public Optional<User> findCurrentUser(TokenClaims claims) {
        if (claims == null) {
            return Optional.empty();
        }
        return userRepository.findByEmail(claims.email());
    }
}
