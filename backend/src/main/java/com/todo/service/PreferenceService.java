package com.todo.service;

import com.todo.dto.request.AccessibilityRequest;
import com.todo.dto.request.ThemeUpdateRequest;
import com.todo.dto.request.UpdatePreferencesRequest;
import com.todo.dto.response.PreferenceResponse;
import com.todo.dto.response.ThemeResponse;
import com.todo.entity.User;
import com.todo.entity.UserPreference;
import com.todo.exception.ResourceNotFoundException;
import com.todo.repository.UserPreferenceRepository;
import com.todo.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Per-user preferences, including the theme and accessibility settings.
 *
 * The preference row is created on first access with every field at its
 * default, so callers never see a user without preferences.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PreferenceService {

    private final UserPreferenceRepository preferenceRepository;
    private final UserRepository userRepository;

    @Transactional
    public UserPreference getOrCreate(User user) {
        return preferenceRepository.findByUserId(user.getId())
                .orElseGet(() -> {
                    log.debug("Creating default preferences for user {}", user.getId());
                    return preferenceRepository.save(new UserPreference(user));
                });
    }

    /**
     * Applies every non-null field of the request.
     */
    @Transactional
    public PreferenceResponse updatePreferences(UUID userId, UpdatePreferencesRequest request) {
        UserPreference preference = getOrCreate(loadUser(userId));

        if (request.getTheme() != null) preference.setTheme(request.getTheme());
        if (request.getLanguage() != null) preference.setLanguage(request.getLanguage());
        if (request.getCalendarType() != null) preference.setCalendarType(request.getCalendarType());
        if (request.getEmailNotifications() != null) preference.setEmailNotifications(request.getEmailNotifications());
        if (request.getPushNotifications() != null) preference.setPushNotifications(request.getPushNotifications());
        if (request.getTaskReminders() != null) preference.setTaskReminders(request.getTaskReminders());
        if (request.getDailyDigest() != null) preference.setDailyDigest(request.getDailyDigest());
        if (request.getWeeklyDigest() != null) preference.setWeeklyDigest(request.getWeeklyDigest());
        if (request.getMarketingEmails() != null) preference.setMarketingEmails(request.getMarketingEmails());
        if (request.getSessionTimeout() != null) preference.setSessionTimeout(request.getSessionTimeout());
        if (request.getItemsPerPage() != null) preference.setItemsPerPage(request.getItemsPerPage());
        if (request.getDateFormat() != null) preference.setDateFormat(request.getDateFormat());
        if (request.getTimeFormat() != null) preference.setTimeFormat(request.getTimeFormat());
        if (request.getStartOfWeek() != null) preference.setStartOfWeek(request.getStartOfWeek());
        if (request.getDefaultTaskView() != null) preference.setDefaultTaskView(request.getDefaultTaskView());
        if (request.getShowWeekNumbers() != null) preference.setShowWeekNumbers(request.getShowWeekNumbers());
        if (request.getReducedMotion() != null) preference.setReducedMotion(request.getReducedMotion());
        if (request.getHighContrast() != null) preference.setHighContrast(request.getHighContrast());
        if (request.getFontScale() != null) preference.setFontScale(request.getFontScale());

        preference = preferenceRepository.saveAndFlush(preference);
        log.info("Preferences updated for user {}", userId);
        return PreferenceResponse.from(preference);
    }

    @Transactional
    public ThemeResponse getTheme(UUID userId) {
        return ThemeResponse.from(getOrCreate(loadUser(userId)));
    }

    @Transactional
    public ThemeResponse updateTheme(UUID userId, ThemeUpdateRequest request) {
        User user = loadUser(userId);
        UserPreference preference = getOrCreate(user);

        if (request.getThemeMode() != null) {
            preference.setTheme(request.getThemeMode());
        }
        if (request.getLocale() != null) {
            applyLocale(user, preference, request.getLocale());
        }
        if (request.getPreferences() != null) {
            applyAccessibility(preference, request.getPreferences());
        }
        return save(preference);
    }

    @Transactional
    public ThemeResponse setMode(UUID userId, String themeMode) {
        UserPreference preference = getOrCreate(loadUser(userId));
        preference.setTheme(themeMode);
        log.info("Theme mode set to {} for user {}", themeMode, userId);
        return save(preference);
    }

    /**
     * Sets the interface language; the account locale follows it.
     */
    @Transactional
    public ThemeResponse setLocale(UUID userId, String locale) {
        User user = loadUser(userId);
        UserPreference preference = getOrCreate(user);
        applyLocale(user, preference, locale);
        return save(preference);
    }

    @Transactional
    public ThemeResponse setAccessibility(UUID userId, AccessibilityRequest request) {
        UserPreference preference = getOrCreate(loadUser(userId));
        applyAccessibility(preference, request);
        return save(preference);
    }

    @Transactional
    public ThemeResponse reset(UUID userId) {
        UserPreference preference = getOrCreate(loadUser(userId));
        preference.resetTheme();
        log.info("Theme reset to defaults for user {}", userId);
        return save(preference);
    }

    private void applyLocale(User user, UserPreference preference, String locale) {
        preference.setLanguage(locale);
        user.setLocale(locale);
        userRepository.save(user);
    }

    private void applyAccessibility(UserPreference preference, AccessibilityRequest request) {
        if (request.getReducedMotion() != null) preference.setReducedMotion(request.getReducedMotion());
        if (request.getHighContrast() != null) preference.setHighContrast(request.getHighContrast());
        if (request.getFontScale() != null) preference.setFontScale(request.getFontScale());
    }

    private ThemeResponse save(UserPreference preference) {
        return ThemeResponse.from(preferenceRepository.saveAndFlush(preference));
    }

    private User loadUser(UUID userId) {
        return userRepository.findById(userId)
                .orElseThrow(() -> ResourceNotFoundException.of("User", userId));
    }
}
