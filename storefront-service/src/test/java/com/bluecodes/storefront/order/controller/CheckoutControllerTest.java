package com.bluecodes.storefront.order.controller;

import com.bluecodes.common.security.JwtTokenProvider;
import com.bluecodes.common.security.Role;
import com.bluecodes.storefront.order.dto.CheckoutConfirmResponse;
import com.bluecodes.storefront.order.dto.CheckoutInitResponse;
import com.bluecodes.storefront.order.service.CheckoutService;
import com.bluecodes.storefront.user.entity.User;
import com.bluecodes.storefront.user.repository.UserRepository;
import com.bluecodes.storefront.user.service.AuthService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = CheckoutController.class)
@Import({JwtTokenProvider.class, AuthService.class})
class CheckoutControllerTest {

    @Autowired
    private MockMvc mockMvc;
    @Autowired
    private JwtTokenProvider jwtTokenProvider;

    @MockBean
    private CheckoutService checkoutService;
    @MockBean
    private UserRepository userRepository;
    @MockBean
    private PasswordEncoder passwordEncoder;

    @Test
    @DisplayName("비회원 체크아웃 - userId 없이 주문 생성")
    void init_Guest() throws Exception {
        // Given
        given(checkoutService.initCheckout(anyList(), eq("guest@example.com"), isNull(), isNull()))
                .willReturn(new CheckoutInitResponse("o1", 3998, null));

        // When & Then
        mockMvc.perform(post("/api/checkout/init")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"items": [{"product_id": "p1", "quantity": 2}], "email": "guest@example.com"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.order_id").value("o1"))
                .andExpect(jsonPath("$.data.total_cents").value(3998))
                .andExpect(jsonPath("$.data.client_secret").doesNotExist());
    }

    @Test
    @DisplayName("로그인 상태 체크아웃 - 주문에 userId 기록")
    void init_LoggedIn() throws Exception {
        User user = User.builder().email("me@example.com").passwordHash("x").build();
        given(userRepository.findByEmail("me@example.com")).willReturn(Optional.of(user));
        given(checkoutService.initCheckout(anyList(), anyString(), any(), any()))
                .willReturn(new CheckoutInitResponse("o2", 1999, "pi_secret"));

        mockMvc.perform(post("/api/checkout/init")
                        .header("Authorization", "Bearer " + jwtTokenProvider.createToken("me@example.com", Role.USER))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"items": [{"product_id": "p1", "quantity": 1}], "email": "me@example.com"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.client_secret").value("pi_secret"));

        // 메모리 밖에서 만든 User라 id는 null이다
        verify(checkoutService).initCheckout(anyList(), eq("me@example.com"), isNull(), eq(user.getId()));
    }

    @Test
    @DisplayName("수량 11개 - 400, 주문 생성하지 않음")
    void init_QuantityOverLimit() throws Exception {
        mockMvc.perform(post("/api/checkout/init")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"items": [{"product_id": "p1", "quantity": 11}], "email": "guest@example.com"}
                                """))
                .andExpect(status().isBadRequest());

        verify(checkoutService, never()).initCheckout(anyList(), anyString(), any(), any());
    }

    @Test
    @DisplayName("빈 장바구니 - 400")
    void init_EmptyCart() throws Exception {
        mockMvc.perform(post("/api/checkout/init")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"items": [], "email": "guest@example.com"}
                                """))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("결제 확정 - provider 생략 시 stripe")
    void confirm_DefaultProvider() throws Exception {
        given(checkoutService.confirmCheckout("o1", "stripe"))
                .willReturn(new CheckoutConfirmResponse("o1", List.of("AAA-1", "AAA-2")));

        mockMvc.perform(post("/api/checkout/confirm")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"order_id": "o1"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.codes[0]").value("AAA-1"))
                .andExpect(jsonPath("$.data.codes.length()").value(2));
    }
}
