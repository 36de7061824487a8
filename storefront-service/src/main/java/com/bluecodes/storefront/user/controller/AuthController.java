package com.bluecodes.storefront.user.controller;

import com.bluecodes.common.dto.ApiResponse;
import com.bluecodes.storefront.user.dto.LoginRequest;
import com.bluecodes.storefront.user.dto.RegisterRequest;
import com.bluecodes.storefront.user.dto.TokenResponse;
import com.bluecodes.storefront.user.service.AuthService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/auth")
@RequiredArgsConstructor
public class AuthController {

    private final AuthService authService;

    @PostMapping("/register")
    public ApiResponse<TokenResponse> register(@Valid @RequestBody RegisterRequest request) {
        String token = authService.register(request.email(), request.password(), request.name());
        return ApiResponse.ok(TokenResponse.bearer(token));
    }

    @PostMapping("/login")
    public ApiResponse<TokenResponse> login(@Valid @RequestBody LoginRequest request) {
        return ApiResponse.ok(TokenResponse.bearer(authService.login(request.email(), request.password())));
    }
}
