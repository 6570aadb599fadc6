package com.sosapp.emergency.service;

import com.sosapp.emergency.config.NotificationProperties;
import com.sosapp.emergency.model.EmergencyContact;
import com.sosapp.emergency.model.NotificationChannel;
import com.sosapp.emergency.repository.EmergencyContactRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

@Service
@RequiredArgsConstructor
public class JpaContactDirectory implements ContactDirectory {

    private final EmergencyContactRepository emergencyContactRepository;
    private final NotificationProperties notificationProperties;

    @Override
    @Transactional(readOnly = true)
    public List<ContactEndpoint> getPrioritizedContacts(Long userId, int tier) {
        return emergencyContactRepository.findByUserIdAndTierAndActiveTrueOrderByPriorityAsc(userId, tier).stream()
                .map(this::toEndpoint)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<ContactEndpoint> findContact(Long userId, Long contactUserId) {
        return emergencyContactRepository.findFirstByUserIdAndContactUserIdAndActiveTrue(userId, contactUserId)
                .map(this::toEndpoint);
    }

    private ContactEndpoint toEndpoint(EmergencyContact contact) {
        List<NotificationChannel> usable = notificationProperties.getChannelOrder().stream()
                .filter(channel -> contact.getChannels().contains(channel))
                .filter(channel -> hasText(contact.destinationFor(channel)))
                .toList();
        return new ContactEndpoint(
                contact.getContactUserId(),
                contact.getName(),
                contact.getTier(),
                usable,
                contact.getPushToken(),
                contact.getPhone(),
                contact.getEmail());
    }

    private boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
