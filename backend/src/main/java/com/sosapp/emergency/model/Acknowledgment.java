package com.sosapp.emergency.model;

import jakarta.persistence.AttributeOverride;
import jakarta.persistence.AttributeOverrides;
import jakarta.persistence.Column;
import jakarta.persistence.Embedded;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "acknowledgments", uniqueConstraints = {
        @UniqueConstraint(name = "uk_acknowledgments_emergency_contact", columnNames = {"emergency_id", "contact_id"})
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Acknowledgment {

    @Id
    private UUID id;

    @Column(name = "emergency_id", nullable = false)
    private UUID emergencyId;

    @Column(name = "contact_id", nullable = false)
    private Long contactId;

    @Column(name = "contact_name", nullable = false, length = 200)
    private String contactName;

    @Column(name = "contact_phone", length = 40)
    private String contactPhone;

    @Column(name = "contact_email", length = 255)
    private String contactEmail;

    @Column(name = "acknowledged_at", nullable = false)
    private Instant acknowledgedAt;

    @Embedded
    @AttributeOverrides({
            @AttributeOverride(name = "latitude", column = @Column(name = "contact_latitude")),
            @AttributeOverride(name = "longitude", column = @Column(name = "contact_longitude")),
            @AttributeOverride(name = "accuracy", column = @Column(name = "contact_accuracy_meters")),
            @AttributeOverride(name = "altitude", column = @Column(name = "contact_altitude_meters")),
            @AttributeOverride(name = "address", column = @Column(name = "contact_address", length = 500))
    })
    private GeoLocation location;

    @Column(length = 1000)
    private String message;
}
