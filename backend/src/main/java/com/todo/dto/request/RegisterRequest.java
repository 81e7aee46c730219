package com.todo.dto.request;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for account registration.
 *
 * Example JSON request:
 * <pre>
 * {
 *   "name": "Jane Doe",
 *   "email": "jane@example.com",
 *   "password": "secret123",
 *   "password_confirmation": "secret123",
 *   "timezone": "Europe/Berlin",
 *   "locale": "en"
 * }
 * </pre>
 *
 * Password confirmation and the timezone id are checked by the service, which
 * reports them on the {@code password} and {@code timezone} fields.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RegisterRequest {

    @NotBlank(message = "{validation.name.required}")
    @Size(max = 255, message = "{validation.name.max}")
    private String name;

    @NotBlank(message = "{validation.email.required}")
    @Email(message = "{validation.email.email}")
    @Size(max = 255, message = "{validation.email.max}")
    private String email;

    @NotBlank(message = "{validation.password.required}")
    @Size(min = 8, message = "{validation.password.min}")
    private String password;

    private String passwordConfirmation;

    @Size(max = 64, message = "{validation.timezone.max}")
    private String timezone;

    @Pattern(regexp = "^[a-zA-Z]{2}$", message = "{validation.locale.size}")
    private String locale;
}
