package com.example.homemic_backend.controller;

import com.example.homemic_backend.config.AppPropertiesConfig;
import com.example.homemic_backend.exception.NotFoundException;
import com.example.homemic_backend.model.PrivacySettings;
import com.example.homemic_backend.model.PrivacyZone;
import com.example.homemic_backend.model.QuietHours;
import com.example.homemic_backend.service.PrivacyDecision;
import com.example.homemic_backend.service.PrivacyService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.time.LocalTime;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = PrivacyController.class)
@AutoConfigureMockMvc(addFilters = false)
@Import(AppPropertiesConfig.class)
class PrivacyControllerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private PrivacyService privacyService;

    @Test
    void muteTakesDurationInMinutesFromTheQuery() throws Exception {
        when(privacyService.mute("kitchen", 30, null))
                .thenReturn(new PrivacyZone("kitchen", null, NOW, NOW.plusSeconds(1800)));

        mockMvc.perform(post("/api/privacy/mute/kitchen").param("duration_minutes", "30"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.node_id").value("kitchen"))
                .andExpect(jsonPath("$.active").value(true));

        verify(privacyService).mute("kitchen", 30, null);
    }

    @Test
    void muteWithoutDurationIsIndefinite() throws Exception {
        when(privacyService.mute(eq("kitchen"), isNull(), eq("guests")))
                .thenReturn(new PrivacyZone("kitchen", "guests", NOW, null));

        mockMvc.perform(post("/api/privacy/mute/kitchen").param("reason", "guests"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.reason").value("guests"));
    }

    @Test
    void nonPositiveDurationIs400() throws Exception {
        when(privacyService.mute("kitchen", 0, null))
                .thenThrow(new IllegalArgumentException("duration_minutes must be positive"));

        mockMvc.perform(post("/api/privacy/mute/kitchen").param("duration_minutes", "0"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void nonNumericDurationIs400() throws Exception {
        mockMvc.perform(post("/api/privacy/mute/kitchen").param("duration_minutes", "soon"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(privacyService);
    }

    @Test
    void muteUnknownNodeIs404() throws Exception {
        when(privacyService.mute(anyString(), any(), any())).thenThrow(new NotFoundException("Node", "garage"));

        mockMvc.perform(post("/api/privacy/mute/garage").param("duration_minutes", "5"))
                .andExpect(status().isNotFound());
    }

    @Test
    void unmuteReportsClosedZones() throws Exception {
        when(privacyService.unmute("kitchen")).thenReturn(1);

        mockMvc.perform(post("/api/privacy/unmute/kitchen"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.node_id").value("kitchen"))
                .andExpect(jsonPath("$.zones_deactivated").value(1));
    }

    @Test
    void muteAllAndUnmuteAll() throws Exception {
        PrivacySettings settings = new PrivacySettings();
        settings.mute("away", NOW);
        when(privacyService.muteAll(null)).thenReturn(settings);
        when(privacyService.unmuteAll()).thenReturn(2);

        mockMvc.perform(post("/api/privacy/mute-all"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.global_mute").value(true))
                .andExpect(jsonPath("$.reason").value("away"));
        mockMvc.perform(post("/api/privacy/unmute-all"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.global_mute").value(false))
                .andExpect(jsonPath("$.zones_deactivated").value(2));
    }

    @Test
    void statusShowsMuteReason() throws Exception {
        when(privacyService.status("kitchen")).thenReturn(new PrivacyService.PrivacyStatus(
                "kitchen", true, PrivacyDecision.Reason.NODE_MUTED, "guests", NOW.plusSeconds(60), false));

        mockMvc.perform(get("/api/privacy/status/kitchen"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.muted").value(true))
                .andExpect(jsonPath("$.detail").value("guests"))
                .andExpect(jsonPath("$.global_mute").value(false));
    }

    @Test
    void quietHoursAcceptWrappingWindow() throws Exception {
        when(privacyService.addQuietHours(LocalTime.of(22, 0), LocalTime.of(7, 0), "night", true))
                .thenReturn(new QuietHours("night", LocalTime.of(22, 0), LocalTime.of(7, 0)));

        mockMvc.perform(post("/api/privacy/quiet-hours")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"start\":\"22:00\",\"end\":\"07:00\",\"label\":\"night\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.label").value("night"));
    }

    @Test
    void quietHoursWithoutStartIs400() throws Exception {
        mockMvc.perform(post("/api/privacy/quiet-hours")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"end\":\"07:00\"}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(privacyService);
    }
}
