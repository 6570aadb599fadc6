package com.sosapp.emergency.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Position reported with an emergency or an acknowledgment. Stored as-is; only range checked.
 */
@Embeddable
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GeoLocation {

    @Column(name = "latitude")
    private Double latitude;

    @Column(name = "longitude")
    private Double longitude;

    @Column(name = "accuracy_meters")
    private Double accuracy;

    @Column(name = "altitude_meters")
    private Double altitude;

    @Column(name = "address", length = 500)
    private String address;
}
