package com.sosapp.emergency.repository;

import com.sosapp.emergency.model.Emergency;
import com.sosapp.emergency.model.EmergencyStatus;
import com.sosapp.emergency.model.EmergencyType;
import org.springframework.data.jpa.domain.Specification;

import java.time.Instant;

public final class EmergencySpecifications {

    private EmergencySpecifications() {
    }

    public static Specification<Emergency> history(Long userId, EmergencyStatus status, EmergencyType type,
                                                   Instant from, Instant to) {
        Specification<Emergency> spec = (root, query, cb) -> cb.equal(root.get("userId"), userId);
        if (status != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("status"), status));
        }
        if (type != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("type"), type));
        }
        if (from != null) {
            spec = spec.and((root, query, cb) -> cb.greaterThanOrEqualTo(root.<Instant>get("createdAt"), from));
        }
        if (to != null) {
            spec = spec.and((root, query, cb) -> cb.lessThanOrEqualTo(root.<Instant>get("createdAt"), to));
        }
        return spec;
    }
}
