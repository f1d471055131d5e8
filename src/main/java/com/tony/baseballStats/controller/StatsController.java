package com.tony.baseballStats.controller;

import com.tony.baseballStats.model.dto.HomeRunPair;
import com.tony.baseballStats.service.HomeRunPairService;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.io.IOException;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/stats")
@RequiredArgsConstructor
public class StatsController {

    private final HomeRunPairService homeRunPairService;

    // Ex : GET /api/v1/stats/home-run-pairs?limit=10&exclude=Aaron Judge
    @GetMapping("/home-run-pairs")
    public ResponseEntity<?> getHomeRunPairs(
            @RequestParam(defaultValue = "10") int limit,
            @RequestParam(required = false) String exclude) {
        if (limit < 1) {
            return ResponseEntity.badRequest().body(Map.of("error", "limit doit être >= 1"));
        }
        List<HomeRunPair> pairs = homeRunPairService.topPairs(limit, exclude);
        return ResponseEntity.ok(pairs);
    }

    @GetMapping("/home-run-pairs.csv")
    public void exportHomeRunPairs(
            @RequestParam(defaultValue = "10") int limit,
            @RequestParam(required = false) String exclude,
            HttpServletResponse response) throws IOException {
        if (limit < 1) {
            response.sendError(HttpServletResponse.SC_BAD_REQUEST, "limit doit être >= 1");
            return;
        }
        response.setContentType("text/csv;charset=UTF-8");
        response.setHeader("Content-Disposition", "attachment; filename=\"home-run-pairs.csv\"");
        homeRunPairService.writeCsv(homeRunPairService.topPairs(limit, exclude), response.getWriter());
    }
}
