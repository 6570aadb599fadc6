package com.sosapp.emergency.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sosapp.emergency.dto.AutoTriggerRequest;
import com.sosapp.emergency.dto.LocationDTO;
import com.sosapp.emergency.dto.TriggerEmergencyRequest;
import com.sosapp.emergency.model.EmergencyType;
import com.sosapp.emergency.security.JwtTokenProvider;
import com.sosapp.emergency.support.IntegrationTestSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Map;
import java.util.UUID;

import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class EmergencyControllerTest extends IntegrationTestSupport {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private JwtTokenProvider jwtTokenProvider;

    @Autowired
    private ObjectMapper objectMapper;

    private String ownerToken;
    private String contactToken;
    private String strangerToken;

    @BeforeEach
    void setUpTokens() {
        ownerToken = "Bearer " + jwtTokenProvider.generateToken("owner", OWNER_ID, "USER");
        contactToken = "Bearer " + jwtTokenProvider.generateToken("primary", PRIMARY_CONTACT_ID, "USER");
        strangerToken = "Bearer " + jwtTokenProvider.generateToken("stranger", STRANGER_ID, "USER");
    }

    private String triggerBody(Integer countdownSeconds) throws Exception {
        return objectMapper.writeValueAsString(TriggerEmergencyRequest.builder()
                .type(EmergencyType.MEDICAL)
                .location(LocationDTO.builder().latitude(48.8566).longitude(2.3522).build())
                .countdownSeconds(countdownSeconds)
                .build());
    }

    private UUID trigger() throws Exception {
        String response = mockMvc.perform(post("/api/v1/emergency/trigger")
                        .header("Authorization", ownerToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(triggerBody(10)))
                .andExpect(status().isCreated())
                .andReturn().getResponse().getContentAsString();
        return UUID.fromString(objectMapper.readTree(response).get("emergencyId").asText());
    }

    private UUID activeEmergency() throws Exception {
        UUID id = trigger();
        advanceTo(at(10));
        return id;
    }

    @Test
    void triggerWithoutTokenIsUnauthorized() throws Exception {
        mockMvc.perform(post("/api/v1/emergency/trigger")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(triggerBody(10)))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.status").value(401))
                .andExpect(jsonPath("$.message").value("JWT missing/expired"));
    }

    @Test
    void triggerStartsCountdown() throws Exception {
        mockMvc.perform(post("/api/v1/emergency/trigger")
                        .header("Authorization", ownerToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(triggerBody(null)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.status").value("PENDING"))
                .andExpect(jsonPath("$.countdownSeconds").value(10))
                .andExpect(jsonPath("$.autoTriggered").value(false));
    }

    @Test
    void malformedTriggerIsRejected() throws Exception {
        mockMvc.perform(post("/api/v1/emergency/trigger")
                        .header("Authorization", ownerToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("type", "MEDICAL"))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details[0].field").value("location"));

        mockMvc.perform(post("/api/v1/emergency/trigger")
                        .header("Authorization", ownerToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"type\":\"MEDICAL\",\"location\":{\"latitude\":95.0,\"longitude\":0.0}}"))
                .andExpect(status().isBadRequest());

        mockMvc.perform(post("/api/v1/emergency/trigger")
                        .header("Authorization", ownerToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(triggerBody(60)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("countdownSeconds must be between 5 and 30"));
    }

    @Test
    void cancelMapsDomainErrorsToStatusCodes() throws Exception {
        mockMvc.perform(put("/api/v1/emergency/{id}/cancel", UUID.randomUUID())
                        .header("Authorization", ownerToken))
                .andExpect(status().isNotFound());

        UUID id = activeEmergency();

        mockMvc.perform(put("/api/v1/emergency/{id}/cancel", id)
                        .header("Authorization", strangerToken))
                .andExpect(status().isForbidden());

        mockMvc.perform(put("/api/v1/emergency/{id}/cancel", id)
                        .header("Authorization", ownerToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reason\":\"too late\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.currentStatus").value("ACTIVE"));

        mockMvc.perform(put("/api/v1/emergency/{id}/cancel", "not-a-uuid")
                        .header("Authorization", ownerToken))
                .andExpect(status().isBadRequest());
    }

    @Test
    void cancelDuringCountdownSucceeds() throws Exception {
        UUID id = trigger();

        mockMvc.perform(put("/api/v1/emergency/{id}/cancel", id)
                        .header("Authorization", ownerToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reason\":\"false alarm\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("CANCELLED"))
                .andExpect(jsonPath("$.cancellationReason").value("false alarm"));
    }

    @Test
    void acknowledgeTwiceReturnsTheSameRecord() throws Exception {
        UUID id = activeEmergency();

        mockMvc.perform(post("/api/v1/emergency/{id}/acknowledge", id)
                        .header("Authorization", contactToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\":\"Calling an ambulance\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.duplicate").value(false))
                .andExpect(jsonPath("$.escalationStopped").value(true))
                .andExpect(jsonPath("$.acknowledgment.contactId").value(PRIMARY_CONTACT_ID));

        mockMvc.perform(post("/api/v1/emergency/{id}/acknowledge", id)
                        .header("Authorization", contactToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.duplicate").value(true))
                .andExpect(jsonPath("$.acknowledgment.message").value("Calling an ambulance"));

        mockMvc.perform(post("/api/v1/emergency/{id}/acknowledge", id)
                        .header("Authorization", strangerToken))
                .andExpect(status().isForbidden());

        mockMvc.perform(get("/api/v1/emergency/{id}", id)
                        .header("Authorization", ownerToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ACTIVE"))
                .andExpect(jsonPath("$.acknowledgments", hasSize(1)))
                .andExpect(jsonPath("$.escalation.stopped").value(true));
    }

    @Test
    void resolveThenAcknowledgeIsAConflict() throws Exception {
        UUID id = activeEmergency();

        mockMvc.perform(put("/api/v1/emergency/{id}/resolve", id)
                        .header("Authorization", ownerToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"notes\":\"All good\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("RESOLVED"));

        mockMvc.perform(post("/api/v1/emergency/{id}/acknowledge", id)
                        .header("Authorization", contactToken))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.currentStatus").value("RESOLVED"));

        mockMvc.perform(put("/api/v1/emergency/{id}/resolve", id)
                        .header("Authorization", ownerToken))
                .andExpect(status().isConflict());
    }

    @Test
    void historyAndNotificationsBelongToTheOwner() throws Exception {
        UUID id = activeEmergency();

        mockMvc.perform(get("/api/v1/emergency/history")
                        .header("Authorization", ownerToken)
                        .param("page", "1")
                        .param("pageSize", "10")
                        .param("status", "ACTIVE"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(1))
                .andExpect(jsonPath("$.emergencies[0].id").value(id.toString()));

        mockMvc.perform(get("/api/v1/emergency/history")
                        .header("Authorization", ownerToken)
                        .param("pageSize", "500"))
                .andExpect(status().isBadRequest());

        mockMvc.perform(get("/api/v1/emergency/{id}/notifications", id)
                        .header("Authorization", ownerToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].kind").value("ALERT"))
                .andExpect(jsonPath("$[0].recipientId").value(PRIMARY_CONTACT_ID));

        mockMvc.perform(get("/api/v1/emergency/{id}/notifications", id)
                        .header("Authorization", contactToken))
                .andExpect(status().isForbidden());
    }

    @Test
    void autoTriggerRequiresPairedDeviceToken() throws Exception {
        String body = objectMapper.writeValueAsString(AutoTriggerRequest.builder()
                .deviceId("watch-1")
                .userId(OWNER_ID)
                .type(EmergencyType.FALL)
                .location(LocationDTO.builder().latitude(1.0).longitude(2.0).build())
                .confidence(0.97)
                .build());

        mockMvc.perform(post("/api/v1/emergency/auto-trigger")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isUnauthorized());

        mockMvc.perform(post("/api/v1/emergency/auto-trigger")
                        .header(EmergencyController.DEVICE_TOKEN_HEADER, ownerToken.substring("Bearer ".length()))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isUnauthorized());

        mockMvc.perform(post("/api/v1/emergency/auto-trigger")
                        .header(EmergencyController.DEVICE_TOKEN_HEADER,
                                jwtTokenProvider.generateDeviceToken("watch-2", OWNER_ID))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isForbidden());

        mockMvc.perform(post("/api/v1/emergency/auto-trigger")
                        .header(EmergencyController.DEVICE_TOKEN_HEADER,
                                jwtTokenProvider.generateDeviceToken("watch-1", OWNER_ID))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.autoTriggered").value(true))
                .andExpect(jsonPath("$.countdownSeconds").value(30));
    }

    @Test
    void deviceTokenIsNotAUserCredential() throws Exception {
        String deviceToken = jwtTokenProvider.generateDeviceToken("watch-1", OWNER_ID);

        mockMvc.perform(get("/api/v1/emergency/history")
                        .header("Authorization", "Bearer " + deviceToken))
                .andExpect(status().isUnauthorized());
    }
}
