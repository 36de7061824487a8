package com.bluecodes.gamestat.ffxiv.service;

import com.bluecodes.gamestat.ffxiv.client.XivApiClient;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
@RequiredArgsConstructor
public class XivApiGateway {

    private final XivApiClient xivApiClient;

    @CircuitBreaker(name = "xivApi")
    public XivApiClient.CharacterSearchResponse searchCharacters(Map<String, String> params) {
        return xivApiClient.searchCharacters(params);
    }
}
