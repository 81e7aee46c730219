package com.todo.controller;

import com.todo.dto.response.ApiResponse;
import com.todo.dto.response.NavigationCounts;
import com.todo.dto.response.NavigationResponse;
import com.todo.security.CurrentUser;
import com.todo.service.NavigationService;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Sidebar data: system filters, projects, tags, saved views and badge counts.
 */
@RestController
@RequestMapping("/api/navigation")
@RequiredArgsConstructor
public class NavigationController {

    private final NavigationService navigationService;

    @GetMapping
    public ResponseEntity<ApiResponse<NavigationResponse>> navigation(Authentication authentication) {
        return ResponseEntity.ok(ApiResponse.ok(navigationService.navigation(CurrentUser.userId(authentication))));
    }

    @GetMapping("/counts")
    public ResponseEntity<CountsResponse> counts(Authentication authentication) {
        return ResponseEntity.ok(new CountsResponse(navigationService.counts(CurrentUser.userId(authentication))));
    }

    @Getter
    @AllArgsConstructor
    public static class CountsResponse {

        private final NavigationCounts counts;
    }
}
