package com.todo.config;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import org.springframework.boot.autoconfigure.jackson.Jackson2ObjectMapperBuilderCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;

/**
 * JSON settings beyond those in {@code spring.jackson.*}.
 *
 * Date-time request fields such as {@code due_date} also accept a bare
 * {@code yyyy-MM-dd}, read as the start of that day.
 */
@Configuration
public class JacksonConfig {

    @Bean
    public Jackson2ObjectMapperBuilderCustomizer dateOrDateTimeCustomizer() {
        return builder -> builder.deserializerByType(LocalDateTime.class, new DateOrDateTimeDeserializer());
    }

    /**
     * Reads {@code 2024-03-01}, {@code 2024-03-01T09:30:00}, {@code 2024-03-01 09:30:00}
     * and offset date-times such as {@code 2024-03-01T09:30:00Z}.
     */
    static class DateOrDateTimeDeserializer extends JsonDeserializer<LocalDateTime> {

        private static final int DATE_LENGTH = "yyyy-MM-dd".length();

        @Override
        public LocalDateTime deserialize(JsonParser parser, DeserializationContext context) throws IOException {
            String text = parser.getValueAsString();
            if (text == null || text.isBlank()) {
                return null;
            }
            String value = text.trim();
            try {
                if (value.length() == DATE_LENGTH) {
                    return LocalDate.parse(value).atStartOfDay();
                }
                String isoValue = value.replace(' ', 'T');
                if (isoValue.endsWith("Z") || isoValue.lastIndexOf('+') > DATE_LENGTH
                        || isoValue.lastIndexOf('-') > DATE_LENGTH) {
                    return OffsetDateTime.parse(isoValue).toLocalDateTime();
                }
                return LocalDateTime.parse(isoValue);
            } catch (DateTimeParseException e) {
                return (LocalDateTime) context.handleWeirdStringValue(LocalDateTime.class, value,
                        "expected a date (yyyy-MM-dd) or an ISO-8601 date-time");
            }
        }
    }
}
