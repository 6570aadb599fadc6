package com.sosapp.emergency.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AcknowledgeEmergencyRequest {

    /** Falls back to the name stored in the owner's contact list. */
    @Size(max = 200)
    private String contactName;

    @Valid
    private LocationDTO location;

    @Size(max = 1000)
    private String message;
}
