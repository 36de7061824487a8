package com.bluecodes.gamestat.osrs.controller;

import com.bluecodes.common.dto.ApiResponse;
import com.bluecodes.gamestat.osrs.dto.OsrsStatsRequest;
import com.bluecodes.gamestat.osrs.dto.OsrsStatsResponse;
import com.bluecodes.gamestat.osrs.service.OsrsStatsService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/osrs")
@RequiredArgsConstructor
public class OsrsController {

    private final OsrsStatsService osrsStatsService;

    @PostMapping("/stats")
    public ApiResponse<OsrsStatsResponse> stats(@Valid @RequestBody OsrsStatsRequest request) {
        return ApiResponse.ok(osrsStatsService.fetchStats(request.username()));
    }
}
