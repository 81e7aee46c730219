package com.todo.dto.request;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Partial profile update; null fields are left unchanged.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class UpdateProfileRequest {

    @Size(min = 1, max = 255, message = "{validation.name.between}")
    private String name;

    @Email(message = "{validation.email.email}")
    @Size(max = 255, message = "{validation.email.max}")
    private String email;

    @Size(max = 64, message = "{validation.timezone.max}")
    private String timezone;

    @Pattern(regexp = "^[a-zA-Z]{2}$", message = "{validation.locale.size}")
    private String locale;

    @Size(max = 500, message = "{validation.avatar_url.max}")
    private String avatarUrl;
}
