package com.todo.dto.request;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AccessibilityRequest {

    private Boolean reducedMotion;

    private Boolean highContrast;

    @DecimalMin(value = "0.8", message = "{validation.font_scale.min}")
    @DecimalMax(value = "1.5", message = "{validation.font_scale.max}")
    private BigDecimal fontScale;
}
