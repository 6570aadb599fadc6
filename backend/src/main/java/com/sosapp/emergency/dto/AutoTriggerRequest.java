package com.sosapp.emergency.dto;

import com.sosapp.emergency.model.EmergencyType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AutoTriggerRequest {

    @NotBlank
    @Size(max = 100)
    private String deviceId;

    @NotNull
    private Long userId;

    @NotNull
    private EmergencyType type;

    @NotNull
    @Valid
    private LocationDTO location;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private Double confidence;

    @Size(max = 1000)
    private String message;
}
