package com.bluecodes.gamestat.health;

import com.bluecodes.common.document.DocumentStore;
import com.bluecodes.common.dto.ApiResponse;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class HealthController {

    static final String SERVICE_NAME = "MMORPG Helper API";

    private final DocumentStore documentStore;
    private final String siteName;

    public HealthController(DocumentStore documentStore, @Value("${site.name:MMORPG Helper}") String siteName) {
        this.documentStore = documentStore;
        this.siteName = siteName;
    }

    @GetMapping("/")
    public ApiResponse<ServiceInfo> root() {
        return ApiResponse.ok(new ServiceInfo(true, SERVICE_NAME, siteName));
    }

    // 저장소 ping 결과. 연결이 안 돼도 200으로 내려가고 db=false
    @GetMapping("/test")
    public ApiResponse<StoreStatus> test() {
        return ApiResponse.ok(new StoreStatus(true, documentStore.ping()));
    }

    public record ServiceInfo(boolean ok, String service, String site) {}

    public record StoreStatus(boolean ok, boolean db) {}
}
