package com.sosapp.emergency.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeliveryReceiptRequest {

    @NotBlank
    private String providerMessageId;

    /** DELIVERED or FAILED as reported by the provider. */
    @NotBlank
    private String status;

    private String errorCode;
}
