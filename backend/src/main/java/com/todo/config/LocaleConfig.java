package com.todo.config;

import com.todo.repository.UserPreferenceRepository;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.context.MessageSource;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.i18n.LocaleContextHolder;
import org.springframework.context.support.MessageSourceAccessor;
import org.springframework.web.servlet.HandlerInterceptor;
import org.springframework.web.servlet.LocaleResolver;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Localization of API messages (English and Persian).
 *
 * Messages live in {@code messages.properties} and {@code messages_fa.properties}.
 * The request locale comes from {@link PreferredLocaleResolver}; the bean must be
 * named {@code localeResolver} for the DispatcherServlet to pick it up. Every
 * response names the language it was rendered in through {@code X-Locale}.
 */
@Configuration
public class LocaleConfig implements WebMvcConfigurer {

    public static final String LOCALE_HEADER = "X-Locale";

    @Bean
    public LocaleResolver localeResolver(UserPreferenceRepository preferenceRepository) {
        return new PreferredLocaleResolver(preferenceRepository);
    }

    /**
     * Message lookup in the current request's locale.
     */
    @Bean
    public MessageSourceAccessor messageSourceAccessor(MessageSource messageSource) {
        return new MessageSourceAccessor(messageSource);
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(new HandlerInterceptor() {
            @Override
            public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
                response.setHeader(LOCALE_HEADER, LocaleContextHolder.getLocale().getLanguage());
                return true;
            }
        });
    }
}
