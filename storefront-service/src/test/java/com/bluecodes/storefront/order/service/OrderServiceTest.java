package com.bluecodes.storefront.order.service;

import com.bluecodes.common.exception.BusinessException;
import com.bluecodes.common.exception.ErrorCode;
import com.bluecodes.common.security.Role;
import com.bluecodes.common.security.TokenClaims;
import com.bluecodes.storefront.order.repository.OrderRepository;
import com.bluecodes.storefront.user.service.AuthService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class OrderServiceTest {

    @Mock
    private OrderRepository orderRepository;
    @Mock
    private AuthService authService;

    @InjectMocks
    private OrderService orderService;

    @Test
    @DisplayName("일반 사용자는 자기 이메일 주문만 50건까지")
    void listOrders_User() {
        TokenClaims claims = new TokenClaims("me@example.com", Role.USER);
        given(orderRepository.findByEmail("me@example.com", OrderService.LIST_LIMIT)).willReturn(List.of());

        orderService.listOrders(claims);

        verify(authService).authenticate(claims);
        verify(orderRepository).findByEmail("me@example.com", 50);
        verify(orderRepository, never()).findAll(anyInt());
    }

    @Test
    @DisplayName("관리자는 전체 주문")
    void listOrders_Admin() {
        TokenClaims claims = new TokenClaims("admin@example.com", Role.ADMIN);
        given(orderRepository.findAll(OrderService.LIST_LIMIT)).willReturn(List.of());

        orderService.listOrders(claims);

        verify(orderRepository).findAll(50);
        verify(orderRepository, never()).findByEmail(anyString(), anyInt());
    }

    @Test
    @DisplayName("인증 실패는 그대로 전파")
    void listOrders_Unauthenticated() {
        given(authService.authenticate(null)).willThrow(new BusinessException(ErrorCode.UNAUTHORIZED));

        assertThatThrownBy(() -> orderService.listOrders(null))
                .isInstanceOf(BusinessException.class)
                .extracting(e -> ((BusinessException) e).getErrorCode())
                .isEqualTo(ErrorCode.UNAUTHORIZED);
    }
}
