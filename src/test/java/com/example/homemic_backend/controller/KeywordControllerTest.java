package com.example.homemic_backend.controller;

import com.example.homemic_backend.config.AppPropertiesConfig;
import com.example.homemic_backend.exception.NotFoundException;
import com.example.homemic_backend.model.Keyword;
import com.example.homemic_backend.service.KeywordService;
import com.example.homemic_backend.util.KeywordPriority;
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
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = KeywordController.class)
@AutoConfigureMockMvc(addFilters = false)
@Import(AppPropertiesConfig.class)
class KeywordControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private KeywordService keywordService;

    @Test
    void createReadsSnakeCaseBody() throws Exception {
        when(keywordService.create("fire alarm", "safety", KeywordPriority.HIGH, true))
                .thenReturn(new Keyword("fire alarm", "safety", KeywordPriority.HIGH, true));

        mockMvc.perform(post("/api/keywords")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"phrase\":\"fire alarm\",\"category\":\"safety\",\"priority\":\"high\",\"case_sensitive\":true}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.phrase").value("fire alarm"))
                .andExpect(jsonPath("$.priority").value("high"))
                .andExpect(jsonPath("$.case_sensitive").value(true));
    }

    @Test
    void blankPhraseIs400() throws Exception {
        mockMvc.perform(post("/api/keywords")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"phrase\":\" \"}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(keywordService);
    }

    @Test
    void toggleAndReset() throws Exception {
        UUID id = UUID.randomUUID();
        Keyword keyword = new Keyword("help", null, KeywordPriority.MEDIUM, false);
        keyword.setEnabled(false);
        when(keywordService.setEnabled(id, false)).thenReturn(keyword);
        when(keywordService.reset(id)).thenReturn(keyword);

        mockMvc.perform(put("/api/keywords/{id}/enabled", id).param("enabled", "false"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.enabled").value(false));
        mockMvc.perform(post("/api/keywords/{id}/reset", id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.detection_count").value(0));
    }

    @Test
    void listAndDelete() throws Exception {
        UUID id = UUID.randomUUID();
        when(keywordService.list()).thenReturn(List.of(new Keyword("help", null, KeywordPriority.LOW, false)));

        mockMvc.perform(get("/api/keywords"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].phrase").value("help"));
        mockMvc.perform(delete("/api/keywords/{id}", id))
                .andExpect(status().isNoContent());

        verify(keywordService).delete(id);
    }

    @Test
    void deletingUnknownKeywordIs404() throws Exception {
        UUID id = UUID.randomUUID();
        doThrow(new NotFoundException("Keyword", id)).when(keywordService).delete(id);

        mockMvc.perform(delete("/api/keywords/{id}", id))
                .andExpect(status().isNotFound());
    }
}
