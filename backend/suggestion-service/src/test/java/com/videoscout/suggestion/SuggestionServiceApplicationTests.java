package com.videoscout.suggestion;

import com.videoscout.suggestion.client.YouTubeApiClient;
import com.videoscout.suggestion.scheduler.QuotaResetScheduler;
import com.videoscout.suggestion.service.SuggestionService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.ActiveProfiles;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 스프링 컨텍스트 로드 테스트
 * 테스트 프로필에서는 스케줄러가 비활성화됩니다.
 */
@SpringBootTest
@ActiveProfiles("test")
class SuggestionServiceApplicationTests {

    @Autowired
    private ApplicationContext context;

    @Autowired
    private SuggestionService suggestionService;

    @Autowired
    private YouTubeApiClient youTubeApiClient;

    @Test
    void contextLoads() {
        assertThat(suggestionService).isNotNull();
        assertThat(youTubeApiClient.isConfigured()).isTrue();
        assertThat(context.getBeanNamesForType(QuotaResetScheduler.class)).isEmpty();
    }
}
