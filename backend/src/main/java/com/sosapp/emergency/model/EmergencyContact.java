package com.sosapp.emergency.model;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Read model of a user's emergency contacts. Maintained by the profile service; this service
 * only reads it.
 */
@Entity
@Table(name = "emergency_contacts", indexes = {
        @Index(name = "idx_emergency_contacts_user_tier", columnList = "user_id, tier, priority")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EmergencyContact {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "contact_user_id", nullable = false)
    private Long contactUserId;

    @Column(nullable = false, length = 200)
    private String name;

    @Column(length = 40)
    private String phone;

    @Column(length = 255)
    private String email;

    @Column(name = "push_token", length = 500)
    private String pushToken;

    @Column(nullable = false)
    private int tier;

    @Column(nullable = false)
    private int priority;

    @Convert(converter = NotificationChannelListConverter.class)
    @Column(nullable = false, length = 60)
    @Builder.Default
    private List<NotificationChannel> channels = new ArrayList<>();

    @Column(nullable = false)
    private boolean active;

    public String destinationFor(NotificationChannel channel) {
        return switch (channel) {
            case PUSH -> pushToken;
            case SMS -> phone;
            case EMAIL -> email;
        };
    }
}
