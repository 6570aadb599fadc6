package com.sosapp.emergency.service;

import java.util.List;
import java.util.Optional;

/**
 * Emergency contacts of a user, owned by the profile service.
 */
public interface ContactDirectory {

    /**
     * Contacts of exactly the given tier, highest priority first.
     */
    List<ContactEndpoint> getPrioritizedContacts(Long userId, int tier);

    /**
     * Looks up one of the user's contacts by the contact's own user id.
     */
    Optional<ContactEndpoint> findContact(Long userId, Long contactUserId);
}
