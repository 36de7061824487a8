package com.bluecodes.storefront.order.service;

import com.bluecodes.common.security.TokenClaims;
import com.bluecodes.storefront.order.entity.Order;
import com.bluecodes.storefront.order.repository.OrderRepository;
import com.bluecodes.storefront.user.service.AuthService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
@RequiredArgsConstructor
public class OrderService {

    static final int LIST_LIMIT = 50;

    private final OrderRepository orderRepository;
    private final AuthService authService;

    // 관리자는 전체 주문, 일반 사용자는 자기 이메일로 된 주문만
    public List<Order> listOrders(TokenClaims claims) {
        authService.authenticate(claims);
        if (claims.isAdmin()) {
            return orderRepository.findAll(LIST_LIMIT);
        }
        return orderRepository.findByEmail(claims.email(), LIST_LIMIT);
    }
}
