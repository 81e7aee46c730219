package com.todo.config;

import com.todo.entity.UserPreference;
import com.todo.repository.UserPreferenceRepository;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.util.StringUtils;
import org.springframework.web.servlet.LocaleResolver;

import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Picks the response language of a request, English or Persian.
 *
 * Resolution Order:
 * 1. The best supported language of the Accept-Language header
 * 2. A {@code lang} or {@code locale} query parameter
 * 3. The authenticated user's stored language preference
 * 4. English
 *
 * The result is cached on the request, so the preference lookup runs at most
 * once per request.
 */
@Slf4j
@RequiredArgsConstructor
public class PreferredLocaleResolver implements LocaleResolver {

    public static final Locale DEFAULT_LOCALE = Locale.ENGLISH;
    public static final List<Locale> SUPPORTED_LOCALES = List.of(Locale.ENGLISH, Locale.forLanguageTag("fa"));

    private static final String RESOLVED_LOCALE_ATTRIBUTE = PreferredLocaleResolver.class.getName() + ".LOCALE";

    private final UserPreferenceRepository preferenceRepository;

    @Override
    public Locale resolveLocale(HttpServletRequest request) {
        Object cached = request.getAttribute(RESOLVED_LOCALE_ATTRIBUTE);
        if (cached instanceof Locale) {
            return (Locale) cached;
        }

        Locale locale = fromHeader(request.getHeader(HttpHeaders.ACCEPT_LANGUAGE));
        if (locale == null) {
            locale = fromParameter(request);
        }
        if (locale == null) {
            locale = fromUserPreference();
        }
        if (locale == null) {
            locale = DEFAULT_LOCALE;
        }

        request.setAttribute(RESOLVED_LOCALE_ATTRIBUTE, locale);
        return locale;
    }

    @Override
    public void setLocale(HttpServletRequest request, HttpServletResponse response, Locale locale) {
        throw new UnsupportedOperationException(
                "Cannot change the request locale; send Accept-Language or update the language preference");
    }

    static Locale fromHeader(String header) {
        if (!StringUtils.hasText(header)) {
            return null;
        }
        try {
            return Locale.lookup(Locale.LanguageRange.parse(header), SUPPORTED_LOCALES);
        } catch (IllegalArgumentException e) {
            log.debug("Ignoring malformed Accept-Language header '{}': {}", header, e.getMessage());
            return null;
        }
    }

    private static Locale fromParameter(HttpServletRequest request) {
        String value = request.getParameter("lang");
        if (!StringUtils.hasText(value)) {
            value = request.getParameter("locale");
        }
        return supported(value);
    }

    private Locale fromUserPreference() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (!(authentication instanceof UsernamePasswordAuthenticationToken) || authentication.getName() == null) {
            return null;
        }
        UUID userId;
        try {
            userId = UUID.fromString(authentication.getName());
        } catch (IllegalArgumentException e) {
            log.debug("Principal '{}' is not a user id; using the default locale", authentication.getName());
            return null;
        }
        return preferenceRepository.findByUserId(userId)
                .map(UserPreference::getLanguage)
                .map(PreferredLocaleResolver::supported)
                .orElse(null);
    }

    private static Locale supported(String language) {
        if (!StringUtils.hasText(language)) {
            return null;
        }
        Locale candidate = Locale.forLanguageTag(language.trim());
        return SUPPORTED_LOCALES.stream()
                .filter(locale -> locale.getLanguage().equals(candidate.getLanguage()))
                .findFirst()
                .orElse(null);
    }
}
