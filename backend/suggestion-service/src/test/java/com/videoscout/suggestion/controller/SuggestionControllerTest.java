package com.videoscout.suggestion.controller;

import com.videoscout.suggestion.config.SuggestionProperties;
import com.videoscout.suggestion.dto.SuggestionActionResult;
import com.videoscout.suggestion.dto.SuggestionResult;
import com.videoscout.suggestion.entity.SuggestionStatus;
import com.videoscout.suggestion.exception.InvalidSuggestionStateException;
import com.videoscout.suggestion.exception.SuggestionNotFoundException;
import com.videoscout.suggestion.exception.SuggestionPersistenceException;
import com.videoscout.suggestion.service.SuggestionService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * SuggestionController 단위 테스트
 */
@WebMvcTest(SuggestionController.class)
@Import(SuggestionProperties.class)
@ActiveProfiles("test")
class SuggestionControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private SuggestionService suggestionService;

    @Test
    @DisplayName("POST /generate - 임계치 미지정 시 기본값 사용")
    void generateWithDefaultThreshold() throws Exception {
        when(suggestionService.generate("alice", 5.0)).thenReturn(SuggestionResult.builder()
                .success(true)
                .message("Generated 0 new suggestions from 0 videos discovered")
                .build());

        mockMvc.perform(post("/api/v1/suggestions/generate").header("X-User-Id", "alice"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true));

        verify(suggestionService).generate("alice", 5.0);
    }

    @Test
    @DisplayName("POST /generate - 범위를 벗어난 임계치는 400")
    void generateRejectsOutOfRangeThreshold() throws Exception {
        mockMvc.perform(post("/api/v1/suggestions/generate")
                        .header("X-User-Id", "alice")
                        .param("threshold", "12.5"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("INVALID_REQUEST"));

        verify(suggestionService, never()).generate(anyString(), anyDouble());
    }

    @Test
    @DisplayName("사용자 헤더 누락 시 400")
    void missingUserHeader() throws Exception {
        mockMvc.perform(post("/api/v1/suggestions/generate"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("MISSING_HEADER"));
    }

    @Test
    @DisplayName("저장소 장애는 503")
    void persistenceFailureMapsTo503() throws Exception {
        when(suggestionService.generate(eq("alice"), anyDouble()))
                .thenThrow(new SuggestionPersistenceException("store down", new RuntimeException("down")));

        mockMvc.perform(post("/api/v1/suggestions/generate").header("X-User-Id", "alice"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.success").value(false));
    }

    @Test
    @DisplayName("GET - 대기 추천 페이지 조회")
    void listPending() throws Exception {
        when(suggestionService.getPendingSuggestions("alice", 0, 20))
                .thenReturn(new PageImpl<>(List.of(), PageRequest.of(0, 20), 0));

        mockMvc.perform(get("/api/v1/suggestions").header("X-User-Id", "alice"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.page").value(0))
                .andExpect(jsonPath("$.totalElements").value(0))
                .andExpect(jsonPath("$.hasNext").value(false));
    }

    @Test
    @DisplayName("POST /{id}/approve - 승인")
    void approve() throws Exception {
        when(suggestionService.approve("alice", 7L)).thenReturn(SuggestionActionResult.builder()
                .suggestionId(7L)
                .status(SuggestionStatus.APPROVED)
                .message("Video added to your library")
                .build());

        mockMvc.perform(post("/api/v1/suggestions/7/approve").header("X-User-Id", "alice"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("APPROVED"));
    }

    @Test
    @DisplayName("없는 추천은 404")
    void approveUnknownSuggestion() throws Exception {
        when(suggestionService.approve("alice", 99L)).thenThrow(new SuggestionNotFoundException(99L));

        mockMvc.perform(post("/api/v1/suggestions/99/approve").header("X-User-Id", "alice"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("SUGGESTION_NOT_FOUND"));
    }

    @Test
    @DisplayName("거절된 추천 승인은 409")
    void approveDeniedSuggestion() throws Exception {
        when(suggestionService.approve("alice", 3L)).thenThrow(
                InvalidSuggestionStateException.transition(3L, SuggestionStatus.DENIED, SuggestionStatus.APPROVED));

        mockMvc.perform(post("/api/v1/suggestions/3/approve").header("X-User-Id", "alice"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("INVALID_SUGGESTION_STATE"));
    }

    @Test
    @DisplayName("숫자가 아닌 id는 400")
    void nonNumericId() throws Exception {
        mockMvc.perform(post("/api/v1/suggestions/abc/deny").header("X-User-Id", "alice"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("INVALID_REQUEST"));
    }

    @Test
    @DisplayName("POST /cleanup - 정리 건수 반환")
    void cleanup() throws Exception {
        when(suggestionService.cleanupExpired()).thenReturn(4);

        mockMvc.perform(post("/api/v1/suggestions/cleanup"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.removed").value(4));
    }
}
