package com.bluecodes.common.security;

/**
 * 검증이 끝난 토큰에서 꺼낸 클레임.
 *
 * @param email subject 클레임 (사용자 이메일)
 * @param role  role 클레임
 */
public record TokenClaims(String email, Role role) {

    public boolean isAdmin() {
        return role == Role.ADMIN;
    }
}
