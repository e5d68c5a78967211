package com.videoscout.suggestion.service;

import com.videoscout.suggestion.client.YouTubeApiClient;
import com.videoscout.suggestion.config.SuggestionProperties;
import com.videoscout.suggestion.dto.ApiErrorType;
import com.videoscout.suggestion.dto.BulkResult;
import com.videoscout.suggestion.dto.CandidateVideo;
import com.videoscout.suggestion.dto.ChannelUpdateRequest;
import com.videoscout.suggestion.dto.DiscoveryResult;
import com.videoscout.suggestion.dto.TopicSearchHit;
import com.videoscout.suggestion.entity.Topic;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;

/**
 * 이중 경로 영상 탐색.
 *
 * 추적 채널 업데이트와 토픽 검색을 병렬로 실행합니다. 각 경로는 best-effort로, 한쪽이 실패해도
 * 다른 쪽 결과는 그대로 사용됩니다. 호출 스레드가 인터럽트되면 두 작업을 모두 취소합니다.
 */
@Service
@Slf4j
public class VideoDiscoveryService {

    private final YouTubeApiClient youTubeApiClient;
    private final ChannelTrackingService channelTrackingService;
    private final TopicService topicService;
    private final SuggestionProperties.Curation curation;
    private final AsyncTaskExecutor discoveryExecutor;
    private final Clock clock;

    public VideoDiscoveryService(YouTubeApiClient youTubeApiClient,
                                 ChannelTrackingService channelTrackingService,
                                 TopicService topicService,
                                 SuggestionProperties properties,
                                 @Qualifier("discoveryExecutor") AsyncTaskExecutor discoveryExecutor,
                                 Clock clock) {
        this.youTubeApiClient = youTubeApiClient;
        this.channelTrackingService = channelTrackingService;
        this.topicService = topicService;
        this.curation = properties.getCuration();
        this.discoveryExecutor = discoveryExecutor;
        this.clock = clock;
    }

    /**
     * 두 탐색 경로를 병렬 실행하고 결과를 모읍니다.
     *
     * @throws CancellationException 호출 스레드가 인터럽트된 경우
     */
    public DiscoveryResult discover(String userId) {
        Future<BulkResult<CandidateVideo>> channelTask =
                submitOrRunInline("channel updates", () -> fetchChannelUpdates(userId));
        Future<BulkResult<TopicSearchHit>> topicTask;
        try {
            topicTask = submitOrRunInline("topic search", () -> fetchTopicMatches(userId));
        } catch (CancellationException e) {
            channelTask.cancel(true);
            throw e;
        }

        BulkResult<CandidateVideo> channelResult = await(channelTask, "channel updates", channelTask, topicTask);
        BulkResult<TopicSearchHit> topicResult = await(topicTask, "topic search", channelTask, topicTask);

        List<String> warnings = new ArrayList<>();
        boolean quotaExhausted = channelResult.quotaExhausted() || topicResult.quotaExhausted();
        if (quotaExhausted) {
            warnings.add("YouTube API quota reached; some channels or topics were not checked.");
        }
        if (hasAuthFailure(channelResult) || hasAuthFailure(topicResult)) {
            warnings.add("YouTube API access is not authorized; discovery was skipped.");
        }
        int failed = channelResult.failures().size() + topicResult.failures().size();
        if (failed > 0 && !quotaExhausted) {
            warnings.add(failed + " channel or topic lookups failed; some suggestions may be missing.");
        }

        log.info("Discovery for user {}: {} channel videos ({} channels), {} topic videos ({} topics), quotaExhausted={}",
                userId, channelResult.items().size(), channelResult.completedInputs().size(),
                topicResult.items().size(), topicResult.completedInputs().size(), quotaExhausted);

        return DiscoveryResult.builder()
                .channelVideos(channelResult.items())
                .topicHits(topicResult.items())
                .channelsChecked(channelResult.completedInputs().size())
                .topicsSearched(topicResult.completedInputs().size())
                .failedItems(failed)
                .quotaExhausted(quotaExhausted)
                .warnings(warnings)
                .build();
    }

    /**
     * 재확인 주기가 된 추적 채널의 신규 영상 조회.
     * 조회가 완료된 채널만 마지막 확인 시각을 갱신합니다.
     */
    public BulkResult<CandidateVideo> fetchChannelUpdates(String userId) {
        try {
            List<ChannelUpdateRequest> due = channelTrackingService.getChannelsDueForCheck(userId);
            if (due.isEmpty()) {
                log.debug("No tracked channels due for check for user {}", userId);
                return BulkResult.empty();
            }

            LocalDateTime now = LocalDateTime.now(clock);
            BulkResult<CandidateVideo> result = youTubeApiClient.bulkChannelUpdates(
                    due, now.minusDays(curation.getLookbackDays()), curation.getMaxResultsPerChannel());

            if (!result.completedInputs().isEmpty()) {
                try {
                    channelTrackingService.markChecked(userId, result.completedInputs(), now);
                } catch (Exception e) {
                    log.warn("Failed to update last check date for user {}: {}", userId, e.getMessage());
                }
            }
            return result;
        } catch (CancellationException e) {
            throw e;
        } catch (Exception e) {
            log.error("Channel update discovery failed for user {}: {}", userId, e.getMessage(), e);
            return BulkResult.empty();
        }
    }

    /**
     * 사용자 토픽 키워드 검색 (lookback 기간 내 게시물)
     */
    public BulkResult<TopicSearchHit> fetchTopicMatches(String userId) {
        try {
            List<String> queries = topicService.getUserTopics(userId).stream()
                    .map(Topic::getName)
                    .filter(name -> name != null && !name.isBlank())
                    .distinct()
                    .toList();
            if (queries.isEmpty()) {
                log.debug("No topics configured for user {}", userId);
                return BulkResult.empty();
            }

            LocalDateTime publishedAfter = LocalDateTime.now(clock).minusDays(curation.getLookbackDays());
            return youTubeApiClient.bulkTopicSearch(queries, publishedAfter, curation.getMaxResultsPerTopic());
        } catch (CancellationException e) {
            throw e;
        } catch (Exception e) {
            log.error("Topic discovery failed for user {}: {}", userId, e.getMessage(), e);
            return BulkResult.empty();
        }
    }

    /**
     * 실행자가 포화 상태면 호출 스레드에서 직접 실행합니다.
     */
    private <T> Future<BulkResult<T>> submitOrRunInline(String name, Supplier<BulkResult<T>> task) {
        try {
            Callable<BulkResult<T>> callable = task::get;
            return discoveryExecutor.submit(callable);
        } catch (RejectedExecutionException e) {
            log.warn("Discovery executor rejected '{}', running on caller thread: {}", name, e.getMessage());
            return CompletableFuture.completedFuture(task.get());
        }
    }

    private <T> BulkResult<T> await(Future<BulkResult<T>> task, String name, Future<?>... all) {
        try {
            return task.get();
        } catch (InterruptedException e) {
            for (Future<?> future : all) {
                future.cancel(true);
            }
            Thread.currentThread().interrupt();
            throw new CancellationException("Discovery cancelled");
        } catch (CancellationException e) {
            log.warn("Discovery task '{}' was cancelled", name);
            return BulkResult.empty();
        } catch (ExecutionException e) {
            log.error("Discovery task '{}' failed: {}", name, e.getCause() != null ? e.getCause().getMessage() : e.getMessage(), e);
            return BulkResult.empty();
        }
    }

    private static boolean hasAuthFailure(BulkResult<?> result) {
        return result.failures().stream().anyMatch(f -> f.errorType() == ApiErrorType.AUTH_FAILURE);
    }
}
