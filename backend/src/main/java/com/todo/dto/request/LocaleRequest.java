package com.todo.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class LocaleRequest {

    @NotBlank(message = "{validation.locale.required}")
    @Pattern(regexp = "en|fa", message = "{validation.locale.invalid}")
    private String locale;
}
