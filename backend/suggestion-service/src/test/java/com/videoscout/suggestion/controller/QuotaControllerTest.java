package com.videoscout.suggestion.controller;

import com.videoscout.suggestion.client.YouTubeApiClient;
import com.videoscout.suggestion.dto.QuotaCostEstimate;
import com.videoscout.suggestion.dto.QuotaStatus;
import com.videoscout.suggestion.service.QuotaLedgerService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(QuotaController.class)
@ActiveProfiles("test")
class QuotaControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private QuotaLedgerService quotaLedgerService;

    @MockBean
    private YouTubeApiClient youTubeApiClient;

    @Test
    @DisplayName("GET /api/v1/quota - 쿼터 상태와 가용성")
    void getStatus() throws Exception {
        when(quotaLedgerService.status()).thenReturn(QuotaStatus.builder()
                .used(9_990)
                .limit(10_000)
                .remaining(10)
                .build());
        when(youTubeApiClient.isConfigured()).thenReturn(true);
        when(youTubeApiClient.isHalted()).thenReturn(false);

        mockMvc.perform(get("/api/v1/quota"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.quota.used").value(9_990))
                .andExpect(jsonPath("$.available").value(true));
    }

    @Test
    @DisplayName("인증 오류로 중단되면 사용 불가")
    void haltedClientIsUnavailable() throws Exception {
        when(quotaLedgerService.status()).thenReturn(QuotaStatus.builder().limit(10_000).remaining(10_000).build());
        when(youTubeApiClient.isConfigured()).thenReturn(true);
        when(youTubeApiClient.isHalted()).thenReturn(true);

        mockMvc.perform(get("/api/v1/quota"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.halted").value(true))
                .andExpect(jsonPath("$.available").value(false));
    }

    @Test
    @DisplayName("GET /estimate - 비용 추정")
    void estimate() throws Exception {
        when(quotaLedgerService.estimateSuggestionCost(3, 2, 120)).thenReturn(QuotaCostEstimate.builder()
                .channelCount(3)
                .topicCount(2)
                .estimatedVideos(120)
                .totalCost(1_010)
                .hints(List.of())
                .build());

        mockMvc.perform(get("/api/v1/quota/estimate")
                        .param("channels", "3")
                        .param("topics", "2")
                        .param("videos", "120"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalCost").value(1_010));
    }

    @Test
    @DisplayName("음수 입력은 400")
    void estimateRejectsNegative() throws Exception {
        mockMvc.perform(get("/api/v1/quota/estimate").param("channels", "-1"))
                .andExpect(status().isBadRequest());

        verify(quotaLedgerService, never()).estimateSuggestionCost(anyInt(), anyInt(), anyInt());
    }

    @Test
    @DisplayName("POST /resume - 중단 해제")
    void resume() throws Exception {
        when(youTubeApiClient.isHalted()).thenReturn(true, false);

        mockMvc.perform(post("/api/v1/quota/resume"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.resumed").value(true))
                .andExpect(jsonPath("$.halted").value(false));

        verify(youTubeApiClient).resumeAfterAuthFailure();
    }
}
