package com.videoscout.suggestion.service;

import com.videoscout.suggestion.config.SuggestionProperties;
import com.videoscout.suggestion.dto.CandidateOrigin;
import com.videoscout.suggestion.dto.CandidateVideo;
import com.videoscout.suggestion.dto.DiscoveryResult;
import com.videoscout.suggestion.dto.SourcedCandidate;
import com.videoscout.suggestion.dto.SuggestionActionResult;
import com.videoscout.suggestion.dto.SuggestionAnalytics;
import com.videoscout.suggestion.dto.SuggestionDto;
import com.videoscout.suggestion.dto.SuggestionResult;
import com.videoscout.suggestion.dto.VideoScore;
import com.videoscout.suggestion.entity.Suggestion;
import com.videoscout.suggestion.entity.SuggestionStatus;
import com.videoscout.suggestion.entity.Topic;
import com.videoscout.suggestion.entity.Video;
import com.videoscout.suggestion.exception.InvalidSuggestionStateException;
import com.videoscout.suggestion.exception.SuggestionNotFoundException;
import com.videoscout.suggestion.exception.SuggestionPersistenceException;
import com.videoscout.suggestion.repository.SuggestionRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.CancellationException;
import java.util.concurrent.Future;
import java.util.function.Supplier;

/**
 * 추천 큐레이션.
 *
 * 생성 흐름: 대기 큐 한도 확인 → 이중 경로 탐색 → 통합 → 점수 → 임계치 필터 → 기존 활성 추천 제외
 * → 점수 내림차순 상위 N개 → 추천 단위 트랜잭션 저장 → 요약 반환.
 *
 * 개별 후보의 저장 실패는 건너뛰고, 저장소 자체 장애는 배치를 중단하고 실패로 보고합니다.
 * 생성 전 조회 단계의 저장소 장애는 SuggestionPersistenceException으로 올라갑니다.
 * 취소가 감지되면 이후 후보는 저장하지 않습니다.
 */
@Service
@Slf4j
public class SuggestionService {

    private final VideoDiscoveryService videoDiscoveryService;
    private final SourceConsolidator sourceConsolidator;
    private final SuggestionScorer suggestionScorer;
    private final SuggestionPersistenceService persistenceService;
    private final VideoCatalogService videoCatalogService;
    private final TopicService topicService;
    private final ChannelTrackingService channelTrackingService;
    private final LibraryService libraryService;
    private final QuotaLedgerService quotaLedgerService;
    private final NotificationService notificationService;
    private final SuggestionRepository suggestionRepository;
    private final SuggestionProperties.Curation curation;
    private final AsyncTaskExecutor generationExecutor;
    private final Clock clock;

    public SuggestionService(VideoDiscoveryService videoDiscoveryService,
                             SourceConsolidator sourceConsolidator,
                             SuggestionScorer suggestionScorer,
                             SuggestionPersistenceService persistenceService,
                             VideoCatalogService videoCatalogService,
                             TopicService topicService,
                             ChannelTrackingService channelTrackingService,
                             LibraryService libraryService,
                             QuotaLedgerService quotaLedgerService,
                             NotificationService notificationService,
                             SuggestionRepository suggestionRepository,
                             SuggestionProperties properties,
                             @Qualifier("generationExecutor") AsyncTaskExecutor generationExecutor,
                             Clock clock) {
        this.videoDiscoveryService = videoDiscoveryService;
        this.sourceConsolidator = sourceConsolidator;
        this.suggestionScorer = suggestionScorer;
        this.persistenceService = persistenceService;
        this.videoCatalogService = videoCatalogService;
        this.topicService = topicService;
        this.channelTrackingService = channelTrackingService;
        this.libraryService = libraryService;
        this.quotaLedgerService = quotaLedgerService;
        this.notificationService = notificationService;
        this.suggestionRepository = suggestionRepository;
        this.curation = properties.getCuration();
        this.generationExecutor = generationExecutor;
        this.clock = clock;
    }

    // ========================================
    // 생성
    // ========================================

    /**
     * 추천 생성.
     *
     * @throws CancellationException 실행 스레드가 인터럽트된 경우 (저장 전 또는 저장 도중)
     */
    public SuggestionResult generate(String userId, double threshold) {
        long startedAt = System.currentTimeMillis();
        log.info("Generating suggestions for user {} (threshold {})", userId, threshold);

        long activeCount = readStore(() -> persistenceService.countActiveSuggestions(userId));
        if (activeCount >= curation.getMaxPending()) {
            log.info("User {} has {} pending suggestions (limit {}), refusing generation",
                    userId, activeCount, curation.getMaxPending());
            notificationService.notifyWarning("You have too many pending suggestions. "
                    + "Please review some before requesting more.");
            return SuggestionResult.builder()
                    .success(false)
                    .message("Too many pending suggestions (" + activeCount + "). Review existing suggestions first.")
                    .apiUsage(quotaLedgerService.status())
                    .processingTimeMs(System.currentTimeMillis() - startedAt)
                    .build();
        }

        DiscoveryResult discovery = videoDiscoveryService.discover(userId);

        List<Topic> topics = topicService.getUserTopics(userId);
        List<String> topicNames = topics.stream().map(Topic::getName).toList();
        Map<String, Integer> ratings = channelTrackingService.getUserRatings(userId);

        List<SourcedCandidate> candidates = sourceConsolidator.consolidate(
                discovery.getChannelVideos(), discovery.getTopicHits(), ratings);

        List<VideoScore> scored = candidates.stream()
                .map(candidate -> suggestionScorer.score(candidate, topicNames, ratings))
                .toList();

        List<VideoScore> qualified = scored.stream()
                .filter(score -> score.getTotal() >= threshold)
                .toList();

        Set<String> activeVideoIds = readStore(() -> persistenceService.findActiveVideoIds(userId));
        List<VideoScore> selected = qualified.stream()
                .filter(score -> !activeVideoIds.contains(score.getCandidate().getVideoId()))
                .sorted(Comparator.comparingDouble(VideoScore::getTotal).reversed()
                        .thenComparing(score -> score.getCandidate().getVideoId()))
                .limit(curation.getMaxPerRequest())
                .toList();

        SuggestionResult result = SuggestionResult.builder()
                .success(true)
                .totalDiscovered(candidates.size())
                .trackedChannelCount(countOrigin(candidates, CandidateOrigin.TRACKED_CHANNEL))
                .topicSearchCount(countOrigin(candidates, CandidateOrigin.TOPIC_SEARCH))
                .dualSourceCount(countOrigin(candidates, CandidateOrigin.BOTH))
                .duplicatesMerged(discovery.getChannelVideos().size() + discovery.getTopicHits().size() - candidates.size())
                .alreadySuggested(qualified.size() - (int) qualified.stream()
                        .filter(score -> !activeVideoIds.contains(score.getCandidate().getVideoId())).count())
                .belowThreshold(scored.size() - qualified.size())
                .quotaExhausted(discovery.isQuotaExhausted())
                .warnings(new ArrayList<>(discovery.getWarnings()))
                .build();

        checkCancelled();
        persistSelected(userId, selected, topics, result);

        // 평균과 분포는 임계치와 무관하게 점수가 매겨진 모든 후보 기준
        List<Double> allScores = scored.stream().map(VideoScore::getTotal).toList();
        result.setAverageScore(allScores.stream().mapToDouble(Double::doubleValue).average().orElse(0.0));
        result.setScoreDistribution(distribution(allScores));
        result.setApiUsage(quotaLedgerService.status());
        result.setProcessingTimeMs(System.currentTimeMillis() - startedAt);

        if (result.isSuccess()) {
            result.setMessage(String.format("Generated %d new suggestions from %d videos discovered",
                    result.getSuggestions().size(), candidates.size()));
            if (!result.getSuggestions().isEmpty()) {
                notificationService.notifySuccess(result.getMessage());
            } else if (discovery.isQuotaExhausted()) {
                notificationService.notifyWarning("No new suggestions: the daily YouTube quota was reached.");
            } else {
                notificationService.notifyInfo("No new suggestions found. Try adding more topics or channels.");
            }
        }

        log.info("Suggestion generation for user {} finished in {}ms: created={}, discovered={}, qualified={}, "
                        + "alreadySuggested={}, persistenceFailures={}, quotaExhausted={}",
                userId, result.getProcessingTimeMs(), result.getSuggestions().size(), candidates.size(),
                qualified.size(), result.getAlreadySuggested(), result.getPersistenceFailures(),
                result.isQuotaExhausted());
        return result;
    }

    /**
     * 생성 요청을 별도 실행자에서 수행합니다. 반환된 Future를 cancel(true)하면 진행 중인 API 호출까지 인터럽트됩니다.
     */
    public Future<SuggestionResult> generateAsync(String userId, double threshold) {
        return generationExecutor.submit(() -> generate(userId, threshold));
    }

    private void persistSelected(String userId, List<VideoScore> selected, List<Topic> topics,
                                 SuggestionResult result) {
        int failures = 0;
        for (VideoScore score : selected) {
            checkCancelled();
            String videoId = score.getCandidate().getVideoId();
            try {
                Video video;
                try {
                    video = ensureVideo(score.getCandidate().getVideo());
                } catch (DataIntegrityViolationException e) {
                    failures++;
                    log.warn("Skipping suggestion for video {}: video could not be stored: {}", videoId, e.getMessage());
                    continue;
                }
                List<Long> topicIds = topics.stream()
                        .filter(topic -> score.getReasonTopics().contains(topic.getName()))
                        .map(Topic::getId)
                        .toList();

                Optional<Suggestion> saved = topicIds.isEmpty()
                        ? persistenceService.insertSuggestion(userId, video, score.getReason())
                        : persistenceService.insertSuggestionWithTopics(userId, video, score.getReason(), topicIds);

                if (saved.isPresent()) {
                    result.getSuggestions().add(SuggestionDto.created(saved.get(),
                            score.getCandidate().getVideo(), score.getTotal(), curation.getExpiryDays()));
                } else {
                    result.setAlreadySuggested(result.getAlreadySuggested() + 1);
                }
            } catch (CancellationException e) {
                throw e;
            } catch (DataAccessResourceFailureException | CannotCreateTransactionException e) {
                log.error("Storage unavailable while saving suggestions for user {}: {}", userId, e.getMessage(), e);
                result.setSuccess(false);
                result.setMessage("Suggestions could not be saved right now. Please try again later.");
                result.getWarnings().add("Saving stopped after " + result.getSuggestions().size() + " suggestions.");
                notificationService.notifyWarning("Suggestions could not be saved right now.");
                break;
            } catch (DataIntegrityViolationException e) {
                // 동시 생성 요청이 같은 추천을 먼저 저장한 경우 (active_key 제약)
                log.debug("Suggestion for video {} lost a concurrent insert: {}", videoId, e.getMessage());
                result.setAlreadySuggested(result.getAlreadySuggested() + 1);
            } catch (RuntimeException e) {
                failures++;
                log.warn("Skipping suggestion for video {}: {}", videoId, e.getMessage());
            }
        }
        result.setPersistenceFailures(failures);
        if (failures > 0) {
            result.getWarnings().add(failures + " suggestions could not be saved and were skipped.");
        }
    }

    /**
     * 영상 upsert. 동시 요청이 같은 영상을 먼저 넣었으면 한 번 더 조회해 기존 행을 사용합니다.
     */
    private Video ensureVideo(CandidateVideo candidate) {
        try {
            return videoCatalogService.ensureVideoExists(candidate);
        } catch (DataIntegrityViolationException e) {
            log.debug("Concurrent upsert for video {}, re-reading: {}", candidate.getVideoId(), e.getMessage());
            return videoCatalogService.ensureVideoExists(candidate);
        }
    }

    // ========================================
    // 승인 / 거절 / 정리
    // ========================================

    /**
     * 추천 승인. 이미 라이브러리에 있는 영상이면 승인만 기록하고 다른 메시지를 반환합니다.
     */
    @Transactional
    public SuggestionActionResult approve(String userId, Long suggestionId) {
        Suggestion suggestion = load(userId, suggestionId);

        if (suggestion.getStatus() == SuggestionStatus.APPROVED) {
            return SuggestionActionResult.builder()
                    .suggestionId(suggestionId)
                    .status(SuggestionStatus.APPROVED)
                    .unchanged(true)
                    .message("Suggestion was already approved")
                    .build();
        }
        if (suggestion.getStatus() == SuggestionStatus.DENIED) {
            throw InvalidSuggestionStateException.transition(suggestionId, SuggestionStatus.DENIED, SuggestionStatus.APPROVED);
        }
        requireActive(suggestion);

        Video video = suggestion.getVideo();
        boolean alreadyInLibrary = libraryService.isInLibrary(userId, video);
        suggestion.approve(LocalDateTime.now(clock));
        suggestionRepository.save(suggestion);

        // 라이브러리 추가는 별도 트랜잭션: 실패해도 승인은 유지
        boolean libraryFailed = false;
        try {
            if (!alreadyInLibrary) {
                libraryService.addToLibrary(userId, video);
            }
        } catch (RuntimeException e) {
            libraryFailed = true;
            log.warn("Suggestion {} approved but video {} could not be added to the library of user {}: {}",
                    suggestionId, video.getYoutubeVideoId(), userId, e.getMessage());
        }

        log.info("User {} approved suggestion {} (video {}, alreadyInLibrary={}, libraryFailed={})",
                userId, suggestionId, video.getYoutubeVideoId(), alreadyInLibrary, libraryFailed);
        String message;
        if (libraryFailed) {
            message = "Suggestion approved, but the video could not be added to your library";
        } else if (alreadyInLibrary) {
            message = "Video is already in your library";
        } else {
            message = "Video added to your library";
        }
        return SuggestionActionResult.builder()
                .suggestionId(suggestionId)
                .status(SuggestionStatus.APPROVED)
                .alreadyInLibrary(alreadyInLibrary)
                .libraryUpdateFailed(libraryFailed)
                .message(message)
                .build();
    }

    @Transactional
    public SuggestionActionResult deny(String userId, Long suggestionId) {
        Suggestion suggestion = load(userId, suggestionId);

        if (suggestion.getStatus() == SuggestionStatus.DENIED) {
            return SuggestionActionResult.builder()
                    .suggestionId(suggestionId)
                    .status(SuggestionStatus.DENIED)
                    .unchanged(true)
                    .message("Suggestion was already denied")
                    .build();
        }
        if (suggestion.getStatus() == SuggestionStatus.APPROVED) {
            throw InvalidSuggestionStateException.transition(suggestionId, SuggestionStatus.APPROVED, SuggestionStatus.DENIED);
        }
        requireActive(suggestion);

        suggestion.deny(LocalDateTime.now(clock));
        suggestionRepository.save(suggestion);

        log.info("User {} denied suggestion {}", userId, suggestionId);
        return SuggestionActionResult.builder()
                .suggestionId(suggestionId)
                .status(SuggestionStatus.DENIED)
                .message("Suggestion dismissed")
                .build();
    }

    public int cleanupExpired() {
        return persistenceService.cleanupExpired();
    }

    // ========================================
    // 조회
    // ========================================

    /**
     * 만료되지 않은 대기 추천 (최신순)
     */
    @Transactional(readOnly = true)
    public Page<SuggestionDto> getPendingSuggestions(String userId, int page, int size) {
        int pageSize = Math.max(1, Math.min(size, 100));
        return suggestionRepository.findActive(userId, persistenceService.expiryCutoff(),
                        PageRequest.of(Math.max(0, page), pageSize))
                .map(suggestion -> SuggestionDto.from(suggestion, curation.getExpiryDays()));
    }

    @Transactional(readOnly = true)
    public SuggestionAnalytics getAnalytics(String userId) {
        LocalDateTime cutoff = persistenceService.expiryCutoff();
        return SuggestionAnalytics.builder()
                .total(suggestionRepository.countByUserId(userId))
                .approved(suggestionRepository.countByUserIdAndStatus(userId, SuggestionStatus.APPROVED))
                .denied(suggestionRepository.countByUserIdAndStatus(userId, SuggestionStatus.DENIED))
                .pending(suggestionRepository.countActive(userId, cutoff))
                .expired(suggestionRepository.countExpired(userId, cutoff))
                .lastGeneratedAt(suggestionRepository.findLastCreatedAt(userId).orElse(null))
                .build();
    }

    private Suggestion load(String userId, Long suggestionId) {
        return suggestionRepository.findByIdAndUserId(suggestionId, userId)
                .orElseThrow(() -> new SuggestionNotFoundException(suggestionId));
    }

    private void requireActive(Suggestion suggestion) {
        if (Boolean.TRUE.equals(suggestion.getDeleted()) || suggestion.isExpired(persistenceService.expiryCutoff())) {
            throw InvalidSuggestionStateException.expired(suggestion.getId());
        }
    }

    /**
     * 저장소 장애는 요청 전체 실패로 올립니다.
     */
    private static <T> T readStore(Supplier<T> query) {
        try {
            return query.get();
        } catch (DataAccessResourceFailureException | CannotCreateTransactionException e) {
            throw new SuggestionPersistenceException("Suggestion store unavailable", e);
        }
    }

    private static int countOrigin(List<SourcedCandidate> candidates, CandidateOrigin origin) {
        return (int) candidates.stream().filter(c -> c.getOrigin() == origin).count();
    }

    private static Map<String, Integer> distribution(List<Double> scores) {
        Map<String, Integer> buckets = new TreeMap<>();
        for (double score : scores) {
            int floor = (int) Math.floor(score);
            buckets.merge(floor + "-" + (floor + 1), 1, Integer::sum);
        }
        return buckets;
    }

    private static void checkCancelled() {
        if (Thread.currentThread().isInterrupted()) {
            throw new CancellationException("Suggestion generation cancelled");
        }
    }
}
