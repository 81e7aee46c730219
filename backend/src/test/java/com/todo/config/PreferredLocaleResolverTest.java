package com.todo.config;

import com.todo.entity.UserPreference;
import com.todo.repository.UserPreferenceRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpHeaders;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("PreferredLocaleResolver Unit Tests")
class PreferredLocaleResolverTest {

    private static final Locale PERSIAN = Locale.forLanguageTag("fa");

    @Mock
    private UserPreferenceRepository preferenceRepository;

    private PreferredLocaleResolver resolver;
    private MockHttpServletRequest request;

    @BeforeEach
    void setUp() {
        resolver = new PreferredLocaleResolver(preferenceRepository);
        request = new MockHttpServletRequest("GET", "/api/tasks");
    }

    @AfterEach
    void tearDown() {
        SecurityContextHolder.clearContext();
    }

    @Test
    @DisplayName("Accept-Language should pick the best supported language")
    void testAcceptLanguage() {
        request.addHeader(HttpHeaders.ACCEPT_LANGUAGE, "de-DE,fa;q=0.8,en;q=0.5");

        assertEquals(PERSIAN, resolver.resolveLocale(request));
        verifyNoInteractions(preferenceRepository);
    }

    @Test
    @DisplayName("the lang parameter should apply when the header names nothing supported")
    void testLangParameter() {
        request.addHeader(HttpHeaders.ACCEPT_LANGUAGE, "de-DE");
        request.setParameter("lang", "fa");

        assertEquals(PERSIAN, resolver.resolveLocale(request));
    }

    @Test
    @DisplayName("the stored preference should apply to an authenticated user without a header")
    void testUserPreference() {
        // Arrange
        UUID userId = UUID.randomUUID();
        SecurityContextHolder.getContext().setAuthentication(
                new UsernamePasswordAuthenticationToken(userId.toString(), null, List.of()));
        UserPreference preference = new UserPreference();
        preference.setLanguage("fa");
        when(preferenceRepository.findByUserId(userId)).thenReturn(Optional.of(preference));

        // Act
        Locale first = resolver.resolveLocale(request);
        Locale second = resolver.resolveLocale(request);

        // Assert
        assertEquals(PERSIAN, first);
        assertEquals(PERSIAN, second);
        verify(preferenceRepository, times(1)).findByUserId(any());
    }

    @Test
    @DisplayName("an anonymous request without hints should be English")
    void testDefault() {
        assertEquals(Locale.ENGLISH, resolver.resolveLocale(request));
    }

    @Test
    @DisplayName("a malformed header should be ignored")
    void testMalformedHeader() {
        assertNull(PreferredLocaleResolver.fromHeader("fa;q=abc"));
        assertEquals(Locale.ENGLISH, PreferredLocaleResolver.fromHeader("en-US"));
    }
}
