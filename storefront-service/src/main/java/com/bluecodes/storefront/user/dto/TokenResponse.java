package com.bluecodes.storefront.user.dto;

/**
 * 로그인/회원가입 응답. JSON으로는 {@code {"access_token": "...", "token_type": "bearer"}}.
 */
public record TokenResponse(String accessToken, String tokenType) {

    public static TokenResponse bearer(String accessToken) {
        return new TokenResponse(accessToken, "bearer");
    }
}
