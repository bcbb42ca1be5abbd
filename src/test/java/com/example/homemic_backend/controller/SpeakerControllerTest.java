package com.example.homemic_backend.controller;

import com.example.homemic_backend.config.AppPropertiesConfig;
import com.example.homemic_backend.exception.NotFoundException;
import com.example.homemic_backend.model.Speaker;
import com.example.homemic_backend.service.SpeakerService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.UUID;

import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = SpeakerController.class)
@AutoConfigureMockMvc(addFilters = false)
@Import(AppPropertiesConfig.class)
class SpeakerControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private SpeakerService speakerService;

    @Test
    void createAndList() throws Exception {
        when(speakerService.create("Ana", "#ff0000")).thenReturn(new Speaker("Ana", "#ff0000"));
        when(speakerService.list()).thenReturn(List.of(new Speaker("Ana", "#ff0000")));

        mockMvc.perform(post("/api/speakers")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Ana\",\"color\":\"#ff0000\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.name").value("Ana"));
        mockMvc.perform(get("/api/speakers"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].color").value("#ff0000"));
    }

    @Test
    void missingNameIs400() throws Exception {
        mockMvc.perform(post("/api/speakers")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"color\":\"#00ff00\"}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(speakerService);
    }

    @Test
    void deleteReturnsNoContent() throws Exception {
        UUID id = UUID.randomUUID();

        mockMvc.perform(delete("/api/speakers/{id}", id))
                .andExpect(status().isNoContent());

        verify(speakerService).delete(id);
    }

    @Test
    void deletingUnknownSpeakerIs404() throws Exception {
        UUID id = UUID.randomUUID();
        doThrow(new NotFoundException("Speaker", id)).when(speakerService).delete(id);

        mockMvc.perform(delete("/api/speakers/{id}", id))
                .andExpect(status().isNotFound());
    }
}
