package com.todo.dto.response;

import com.todo.entity.UserPreference;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Theme settings in the shape the front end's theme provider reads.
 *
 * <pre>
 * {
 *   "theme_mode": "dark",
 *   "locale": "en",
 *   "preferences": { "reduced_motion": false, "high_contrast": false, "font_scale": 1.00 },
 *   "updated_at": "2024-02-26T10:30:00"
 * }
 * </pre>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ThemeResponse {

    private String themeMode;

    private String locale;

    private Accessibility preferences;

    private LocalDateTime updatedAt;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Accessibility {

        private Boolean reducedMotion;

        private Boolean highContrast;

        private BigDecimal fontScale;
    }

    public static ThemeResponse from(UserPreference preference) {
        return ThemeResponse.builder()
                .themeMode(preference.getTheme())
                .locale(preference.getLanguage())
                .preferences(new Accessibility(
                        preference.getReducedMotion(),
                        preference.getHighContrast(),
                        preference.getFontScale()))
                .updatedAt(preference.getUpdatedAt())
                .build();
    }
}
