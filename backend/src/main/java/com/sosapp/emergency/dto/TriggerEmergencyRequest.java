package com.sosapp.emergency.dto;

import com.sosapp.emergency.model.EmergencyType;
import jakarta.validation.Valid;
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
public class TriggerEmergencyRequest {

    @NotNull
    private EmergencyType type;

    @NotNull
    @Valid
    private LocationDTO location;

    /** Null selects the configured default. */
    private Integer countdownSeconds;

    @Size(max = 1000)
    private String message;
}
