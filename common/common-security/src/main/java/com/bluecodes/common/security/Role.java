package com.bluecodes.common.security;

import java.util.Arrays;

/**
 * 사용자 역할. JWT의 role 클레임에는 소문자 값("user", "admin")이 들어간다.
 */
public enum Role {
    USER("user"),
    ADMIN("admin");

    private final String claimValue;

    Role(String claimValue) {
        this.claimValue = claimValue;
    }

    public String claimValue() {
        return claimValue;
    }

    /**
     * 클레임 값으로 역할을 찾는다. 알 수 없는 값이면 {@link IllegalArgumentException}.
     */
    public static Role fromClaim(String value) {
        return Arrays.stream(values())
                .filter(role -> role.claimValue.equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown role: " + value));
    }
}
