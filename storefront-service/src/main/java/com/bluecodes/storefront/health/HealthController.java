package com.bluecodes.storefront.health;

import com.bluecodes.common.document.DocumentStore;
import com.bluecodes.common.dto.ApiResponse;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 서비스 배너와 저장소 연결 확인.
 */
@RestController
public class HealthController {

    static final String SERVICE_NAME = "Game Codes Store API";

    private final DocumentStore documentStore;
    private final String siteName;

    public HealthController(DocumentStore documentStore, @Value("${site.name:BlueCodes}") String siteName) {
        this.documentStore = documentStore;
        this.siteName = siteName;
    }

    @GetMapping("/")
    public ApiResponse<ServiceInfo> root() {
        return ApiResponse.ok(new ServiceInfo(true, SERVICE_NAME, siteName));
    }

    @GetMapping("/test")
    public ApiResponse<StoreStatus> test() {
        return ApiResponse.ok(new StoreStatus(true, documentStore.ping()));
    }

    public record ServiceInfo(boolean ok, String service, String site) {}

    public record StoreStatus(boolean ok, boolean db) {}
}
