package com.todo.controller;

import com.todo.dto.request.AccessibilityRequest;
import com.todo.dto.request.LocaleRequest;
import com.todo.dto.request.ThemeModeRequest;
import com.todo.dto.request.ThemeUpdateRequest;
import com.todo.dto.response.ApiResponse;
import com.todo.dto.response.ThemeResponse;
import com.todo.security.CurrentUser;
import com.todo.service.PreferenceService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.support.MessageSourceAccessor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

/**
 * Theme mode, interface language and accessibility settings of the current user.
 */
@RestController
@RequestMapping("/api/user/theme")
@RequiredArgsConstructor
@Slf4j
public class ThemeController {

    private final PreferenceService preferenceService;
    private final MessageSourceAccessor messages;

    @GetMapping
    public ResponseEntity<ApiResponse<ThemeResponse>> getTheme(Authentication authentication) {
        return ResponseEntity.ok(ApiResponse.ok(preferenceService.getTheme(CurrentUser.userId(authentication))));
    }

    @PutMapping
    public ResponseEntity<ApiResponse<ThemeResponse>> updateTheme(
            Authentication authentication,
            @Valid @RequestBody ThemeUpdateRequest request) {

        ThemeResponse theme = preferenceService.updateTheme(CurrentUser.userId(authentication), request);
        return ResponseEntity.ok(ApiResponse.ok(messages.getMessage("theme.updated"), theme));
    }

    @PutMapping("/mode")
    public ResponseEntity<ApiResponse<ThemeResponse>> updateMode(
            Authentication authentication,
            @Valid @RequestBody ThemeModeRequest request) {

        ThemeResponse theme = preferenceService.setMode(CurrentUser.userId(authentication), request.getThemeMode());
        return ResponseEntity.ok(ApiResponse.ok(messages.getMessage("theme.mode_updated"), theme));
    }

    @PutMapping("/locale")
    public ResponseEntity<ApiResponse<ThemeResponse>> updateLocale(
            Authentication authentication,
            @Valid @RequestBody LocaleRequest request) {

        ThemeResponse theme = preferenceService.setLocale(CurrentUser.userId(authentication), request.getLocale());
        return ResponseEntity.ok(ApiResponse.ok(messages.getMessage("theme.locale_updated"), theme));
    }

    @PutMapping("/preferences")
    public ResponseEntity<ApiResponse<ThemeResponse>> updateAccessibility(
            Authentication authentication,
            @Valid @RequestBody AccessibilityRequest request) {

        ThemeResponse theme = preferenceService.setAccessibility(CurrentUser.userId(authentication), request);
        return ResponseEntity.ok(ApiResponse.ok(messages.getMessage("theme.accessibility_updated"), theme));
    }

    @PutMapping("/reset")
    public ResponseEntity<ApiResponse<ThemeResponse>> reset(Authentication authentication) {
        log.info("Theme reset requested by user: {}", authentication.getName());
        ThemeResponse theme = preferenceService.reset(CurrentUser.userId(authentication));
        return ResponseEntity.ok(ApiResponse.ok(messages.getMessage("theme.reset"), theme));
    }
}
