package com.videoscout.suggestion.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.videoscout.suggestion.config.YouTubeApiProperties;
import com.videoscout.suggestion.dto.ApiErrorType;
import com.videoscout.suggestion.dto.ApiResult;
import com.videoscout.suggestion.dto.BulkResult;
import com.videoscout.suggestion.dto.CandidateVideo;
import com.videoscout.suggestion.dto.ChannelUpdateRequest;
import com.videoscout.suggestion.dto.TopicSearchHit;
import com.videoscout.suggestion.service.NotificationService;
import com.videoscout.suggestion.service.QuotaLedgerService;
import com.videoscout.suggestion.util.IsoDurationParser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.Exceptions;

import java.net.URI;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * YouTube Data API v3 client.
 *
 * The only component that talks to YouTube. Every network call goes through the same path:
 * auth check, quota reservation, concurrency permit, blocking request, classification, ledger record.
 * Errors are returned as {@link ApiResult} values and never retried here.
 *
 * Cache hits (search results and per-video details) skip both the network and the quota check.
 */
@Component
@Slf4j
public class YouTubeApiClient {

    static final String OP_SEARCH_CHANNEL = "search.channel";
    static final String OP_SEARCH_TOPIC = "search.topic";
    static final String OP_VIDEO_DETAILS = "videos.list";

    private static final int MAX_RESULTS_PER_CALL = 50;
    private static final DateTimeFormatter RFC3339 = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss'Z'");

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final YouTubeApiProperties properties;
    private final QuotaLedgerService quotaLedger;
    private final NotificationService notificationService;

    private final Semaphore concurrencyGate;
    private final ResponseCache<List<CandidateVideo>> searchCache;
    private final ResponseCache<CandidateVideo> videoCache;
    private final AtomicBoolean authHalted = new AtomicBoolean(false);

    public YouTubeApiClient(@Qualifier("youTubeWebClient") WebClient webClient,
                            ObjectMapper objectMapper,
                            YouTubeApiProperties properties,
                            QuotaLedgerService quotaLedger,
                            NotificationService notificationService) {
        this.webClient = webClient;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.quotaLedger = quotaLedger;
        this.notificationService = notificationService;
        this.concurrencyGate = new Semaphore(Math.max(1, properties.getMaxConcurrentRequests()), true);
        this.searchCache = new ResponseCache<>("youtube-search", properties.getCacheTtl(),
                properties.getSearchCacheMaxEntries());
        this.videoCache = new ResponseCache<>("youtube-videos", properties.getCacheTtl(),
                properties.getVideoCacheMaxEntries());
        log.info("YouTubeApiClient initialized: permits={}, cacheTtl={}, durationFilters={}, keyConfigured={}",
                properties.getMaxConcurrentRequests(), properties.getCacheTtl(),
                properties.getDurationFilters(), isConfigured());
    }

    // ========================================
    // 단건 검색
    // ========================================

    /**
     * 채널의 신규 영상 검색 (since 이후 게시, 최신순)
     */
    public ApiResult<List<CandidateVideo>> searchByChannel(String channelId, LocalDateTime since, int maxResults) {
        int max = clampMaxResults(maxResults);
        String cacheKey = "channel:" + channelId + ":" + formatTimestamp(since) + ":" + max;
        return searchWithFilters(OP_SEARCH_CHANNEL, cacheKey, max, (filter, perFilter) ->
                searchUri(perFilter, filter)
                        .queryParam("channelId", channelId)
                        .queryParam("order", "date")
                        .queryParamIfPresent("publishedAfter", Optional.ofNullable(since).map(this::formatTimestamp)));
    }

    /**
     * 키워드 검색 (관련도순)
     */
    public ApiResult<List<CandidateVideo>> searchByTopic(String query, LocalDateTime publishedAfter, int maxResults) {
        if (query == null || query.isBlank()) {
            return ApiResult.failure(ApiErrorType.INVALID_REQUEST, "Empty search query");
        }
        int max = clampMaxResults(maxResults);
        String normalized = query.trim().toLowerCase();
        String cacheKey = "topic:" + normalized + ":" + formatTimestamp(publishedAfter) + ":" + max;
        return searchWithFilters(OP_SEARCH_TOPIC, cacheKey, max, (filter, perFilter) ->
                searchUri(perFilter, filter)
                        .queryParam("q", query.trim())
                        .queryParam("order", "relevance")
                        .queryParamIfPresent("publishedAfter",
                                Optional.ofNullable(publishedAfter).map(this::formatTimestamp)));
    }

    /**
     * 영상 상세 조회. batch 크기 단위로 나누어 호출하고, 쿼터가 소진되면 남은 배치를 건너뛰고
     * 지금까지 받은 결과를 반환합니다. 결과 순서는 입력 id 순서를 따릅니다.
     */
    public ApiResult<List<CandidateVideo>> getDetails(List<String> videoIds) {
        if (videoIds == null || videoIds.isEmpty()) {
            return ApiResult.ok(List.of());
        }
        Set<String> uniqueIds = new LinkedHashSet<>();
        for (String id : videoIds) {
            if (id != null && !id.isBlank()) {
                uniqueIds.add(id);
            }
        }

        Map<String, CandidateVideo> found = new LinkedHashMap<>();
        List<String> missing = new ArrayList<>();
        for (String id : uniqueIds) {
            Optional<CandidateVideo> cached = videoCache.get(id);
            if (cached.isPresent()) {
                found.put(id, cached.get());
            } else {
                missing.add(id);
            }
        }

        int batchSize = Math.max(1, Math.min(properties.getDetailBatchSize(), MAX_RESULTS_PER_CALL));
        ApiResult<List<CandidateVideo>> lastFailure = null;
        for (int start = 0; start < missing.size(); start += batchSize) {
            List<String> chunk = missing.subList(start, Math.min(start + batchSize, missing.size()));
            URI uri = UriComponentsBuilder.fromHttpUrl(properties.getBaseUrl() + "/videos")
                    .queryParam("part", "snippet,contentDetails,statistics")
                    .queryParam("id", String.join(",", chunk))
                    .queryParam("key", properties.getApiKey())
                    .encode()
                    .build()
                    .toUri();

            ApiResult<List<CandidateVideo>> result =
                    execute(OP_VIDEO_DETAILS, properties.getDetailCost(), uri, this::parseVideoItems);
            if (result.isSuccess()) {
                for (CandidateVideo video : result.data()) {
                    videoCache.put(video.getVideoId(), video);
                    found.put(video.getVideoId(), video);
                }
                continue;
            }

            lastFailure = result;
            if (result.errorType() == ApiErrorType.QUOTA_EXCEEDED || result.errorType() == ApiErrorType.AUTH_FAILURE) {
                log.warn("Stopping detail lookup after {} of {} ids: {}", found.size(), uniqueIds.size(),
                        result.errorMessage());
                break;
            }
            log.warn("Detail batch of {} ids failed ({}), continuing", chunk.size(), result.errorType());
        }

        List<CandidateVideo> ordered = new ArrayList<>();
        for (String id : uniqueIds) {
            CandidateVideo video = found.get(id);
            if (video != null) {
                ordered.add(video);
            }
        }

        if (lastFailure == null) {
            return ApiResult.ok(ordered);
        }
        if (ordered.isEmpty()) {
            return ApiResult.failure(lastFailure.errorType(), lastFailure.errorMessage());
        }
        return ApiResult.partial(ordered, lastFailure.errorType(), lastFailure.errorMessage());
    }

    // ========================================
    // 대량 조회
    // ========================================

    /**
     * 추적 채널 일괄 업데이트 조회.
     * 최저 등급(1점) 채널은 건너뛰고, 쿼터 소진 시 중단하며 그 외 오류는 기록 후 계속합니다.
     *
     * @param defaultSince 한 번도 확인하지 않은 채널의 조회 시작 시각
     */
    public BulkResult<CandidateVideo> bulkChannelUpdates(List<ChannelUpdateRequest> requests,
                                                          LocalDateTime defaultSince,
                                                          int maxPerChannel) {
        List<CandidateVideo> items = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        List<BulkResult.Failure> failures = new ArrayList<>();
        List<String> completed = new ArrayList<>();
        boolean quotaExhausted = false;

        for (ChannelUpdateRequest request : requests) {
            checkCancelled();
            if (request.isLowestTier()) {
                log.debug("Skipping 1-star channel {}", request.channelId());
                continue;
            }

            LocalDateTime since = request.lastCheck() != null ? request.lastCheck() : defaultSince;
            ApiResult<List<CandidateVideo>> result = searchByChannel(request.channelId(), since, maxPerChannel);

            if (result.hasData()) {
                for (CandidateVideo video : result.data()) {
                    if (seen.add(video.getVideoId())) {
                        items.add(video);
                    }
                }
            }
            if (result.isSuccess()) {
                completed.add(request.channelId());
                continue;
            }

            failures.add(new BulkResult.Failure(request.channelId(), result.errorType(), result.errorMessage()));
            if (result.errorType() == ApiErrorType.QUOTA_EXCEEDED) {
                quotaExhausted = true;
                log.warn("Quota exhausted during channel updates; returning {} videos from {} channels",
                        items.size(), completed.size());
                break;
            }
            if (result.errorType() == ApiErrorType.AUTH_FAILURE) {
                break;
            }
            log.warn("Channel update failed for {} ({}): {}", request.channelName(), result.errorType(),
                    result.errorMessage());
        }

        return new BulkResult<>(items, failures, completed, quotaExhausted);
    }

    /**
     * 토픽 일괄 검색. 영상 id 기준으로 중복 제거하며 처음 받은 영상 데이터를 유지하고,
     * 같은 영상을 찾은 토픽 이름은 모두 모읍니다.
     */
    public BulkResult<TopicSearchHit> bulkTopicSearch(List<String> queries, LocalDateTime publishedAfter,
                                                      int maxPerTopic) {
        Map<String, CandidateVideo> videos = new LinkedHashMap<>();
        Map<String, Set<String>> topicsByVideo = new LinkedHashMap<>();
        List<BulkResult.Failure> failures = new ArrayList<>();
        List<String> completed = new ArrayList<>();
        boolean quotaExhausted = false;

        for (String query : queries) {
            checkCancelled();
            ApiResult<List<CandidateVideo>> result = searchByTopic(query, publishedAfter, maxPerTopic);

            if (result.hasData()) {
                for (CandidateVideo video : result.data()) {
                    videos.putIfAbsent(video.getVideoId(), video);
                    topicsByVideo.computeIfAbsent(video.getVideoId(), k -> new LinkedHashSet<>()).add(query);
                }
            }
            if (result.isSuccess()) {
                completed.add(query);
                continue;
            }

            failures.add(new BulkResult.Failure(query, result.errorType(), result.errorMessage()));
            if (result.errorType() == ApiErrorType.QUOTA_EXCEEDED) {
                quotaExhausted = true;
                log.warn("Quota exhausted during topic search; returning {} videos from {} topics",
                        videos.size(), completed.size());
                break;
            }
            if (result.errorType() == ApiErrorType.AUTH_FAILURE) {
                break;
            }
            log.warn("Topic search failed for '{}' ({}): {}", query, result.errorType(), result.errorMessage());
        }

        List<TopicSearchHit> hits = new ArrayList<>();
        videos.forEach((id, video) -> hits.add(new TopicSearchHit(video, topicsByVideo.get(id))));
        return new BulkResult<>(hits, failures, completed, quotaExhausted);
    }

    // ========================================
    // 상태
    // ========================================

    public boolean isConfigured() {
        return properties.getApiKey() != null && !properties.getApiKey().isBlank();
    }

    public boolean isHalted() {
        return authHalted.get();
    }

    /**
     * 인증 오류로 중단된 클라이언트를 재개합니다 (설정 수정 후 운영자가 호출).
     */
    public void resumeAfterAuthFailure() {
        if (authHalted.compareAndSet(true, false)) {
            log.info("YouTube API client resumed after auth failure");
        }
    }

    // ========================================
    // 내부 구현
    // ========================================

    @FunctionalInterface
    private interface SearchUriFactory {
        UriComponentsBuilder create(String durationFilter, int maxResults);
    }

    private ApiResult<List<CandidateVideo>> searchWithFilters(String operation, String cacheKey, int maxResults,
                                                             SearchUriFactory uriFactory) {
        List<String> filters = properties.getDurationFilters() == null || properties.getDurationFilters().isEmpty()
                ? Collections.<String>singletonList(null)
                : properties.getDurationFilters();
        String fullKey = cacheKey + ":" + filters;

        Optional<List<CandidateVideo>> cached = searchCache.get(fullKey);
        if (cached.isPresent()) {
            return ApiResult.ok(cached.get());
        }

        int perFilter = Math.max(1, (int) Math.ceil((double) maxResults / filters.size()));
        Map<String, CandidateVideo> collected = new LinkedHashMap<>();
        ApiResult<List<CandidateVideo>> failure = null;

        for (String filter : filters) {
            URI uri = uriFactory.create(filter, perFilter)
                    .queryParam("key", properties.getApiKey())
                    .encode()
                    .build()
                    .toUri();
            ApiResult<List<CandidateVideo>> result = execute(operation, properties.getSearchCost(), uri,
                    this::parseSearchItems);
            if (result.isSuccess()) {
                result.data().forEach(video -> collected.putIfAbsent(video.getVideoId(), video));
                continue;
            }
            failure = result;
            if (result.errorType() == ApiErrorType.QUOTA_EXCEEDED || result.errorType() == ApiErrorType.AUTH_FAILURE) {
                break;
            }
        }

        if (collected.isEmpty() && failure != null) {
            return failure;
        }

        List<CandidateVideo> enriched = enrich(new ArrayList<>(collected.values()));
        if (failure != null) {
            return ApiResult.partial(enriched, failure.errorType(), failure.errorMessage());
        }
        searchCache.put(fullKey, enriched);
        return ApiResult.ok(enriched);
    }

    private UriComponentsBuilder searchUri(int maxResults, String durationFilter) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(properties.getBaseUrl() + "/search")
                .queryParam("part", "snippet")
                .queryParam("type", "video")
                .queryParam("maxResults", maxResults);
        if (durationFilter != null && !durationFilter.isBlank()) {
            builder.queryParam("videoDuration", durationFilter);
        }
        return builder;
    }

    /**
     * 검색 결과에 상세 정보(길이, 조회수 등)를 병합합니다. 실패해도 검색 결과는 그대로 반환합니다.
     */
    private List<CandidateVideo> enrich(List<CandidateVideo> searchResults) {
        if (searchResults.isEmpty()) {
            return searchResults;
        }
        ApiResult<List<CandidateVideo>> details = getDetails(searchResults.stream().map(CandidateVideo::getVideoId).toList());
        if (!details.hasData()) {
            log.debug("Detail enrichment unavailable ({}); returning {} unenriched results",
                    details.errorType(), searchResults.size());
            return searchResults;
        }
        Map<String, CandidateVideo> byId = new LinkedHashMap<>();
        details.data().forEach(video -> byId.put(video.getVideoId(), video));

        List<CandidateVideo> merged = new ArrayList<>(searchResults.size());
        for (CandidateVideo video : searchResults) {
            CandidateVideo detail = byId.get(video.getVideoId());
            merged.add(detail != null ? video.enrichWith(detail) : video);
        }
        return merged;
    }

    /**
     * 단일 네트워크 호출: 인증 확인 → 쿼터 예약 → 동시성 게이트 → 호출 → 분류 → 기록
     */
    private <T> ApiResult<T> execute(String operation, int cost, URI uri, Function<JsonNode, T> parser) {
        if (!isConfigured()) {
            return ApiResult.failure(ApiErrorType.AUTH_FAILURE, "YouTube API key is not configured");
        }
        if (authHalted.get()) {
            return ApiResult.failure(ApiErrorType.AUTH_FAILURE, "YouTube API access halted after authentication failure");
        }
        if (!quotaLedger.tryReserve(cost)) {
            log.warn("Quota unavailable for {} (cost {})", operation, cost);
            notificationService.notifyQuotaLimit(QuotaLedgerService.RESOURCE_NAME, quotaLedger.status().getResetsAt());
            return ApiResult.failure(ApiErrorType.QUOTA_EXCEEDED, "Daily quota exhausted");
        }

        try {
            concurrencyGate.acquire();
        } catch (InterruptedException e) {
            quotaLedger.release(cost);
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted waiting for API permit");
        }

        long start = System.nanoTime();
        try {
            String body = webClient.get()
                    .uri(uri)
                    .retrieve()
                    .bodyToMono(String.class)
                    .block(Duration.ofSeconds(properties.getTimeoutSeconds()));

            T data;
            try {
                data = parser.apply(objectMapper.readTree(body == null ? "{}" : body));
            } catch (Exception e) {
                // provider already charged for the call
                quotaLedger.record(cost, operation, false, elapsedMs(start), "Unparseable response: " + e.getMessage(), 0);
                return ApiResult.failure(ApiErrorType.TRANSIENT, "Unexpected response from YouTube");
            }
            quotaLedger.record(cost, operation, true, elapsedMs(start), null, countItems(data));
            return ApiResult.ok(data);
        } catch (WebClientResponseException e) {
            return classify(operation, e, elapsedMs(start));
        } catch (RuntimeException e) {
            if (isInterruption(e)) {
                quotaLedger.record(0, operation, false, elapsedMs(start), "Cancelled", 0);
                Thread.currentThread().interrupt();
                throw new CancellationException("API call cancelled");
            }
            quotaLedger.record(0, operation, false, elapsedMs(start), e.getMessage(), 0);
            log.warn("YouTube {} failed: {}", operation, e.getMessage());
            return ApiResult.failure(ApiErrorType.TRANSIENT, "YouTube is not reachable right now");
        } finally {
            concurrencyGate.release();
            quotaLedger.release(cost);
        }
    }

    private <T> ApiResult<T> classify(String operation, WebClientResponseException e, long durationMs) {
        int status = e.getStatusCode().value();
        String detail = status + " " + e.getStatusText() + ": " + providerReason(e);
        quotaLedger.record(0, operation, false, durationMs, detail, 0);

        switch (status) {
            case 403 -> {
                log.warn("YouTube quota exceeded on {}: {}", operation, detail);
                notificationService.notifyQuotaLimit(QuotaLedgerService.RESOURCE_NAME, quotaLedger.status().getResetsAt());
                return ApiResult.failure(ApiErrorType.QUOTA_EXCEEDED, "YouTube quota exceeded");
            }
            case 400 -> {
                log.warn("Invalid YouTube request on {}: {}", operation, detail);
                return ApiResult.failure(ApiErrorType.INVALID_REQUEST, "Invalid request");
            }
            case 401 -> {
                if (authHalted.compareAndSet(false, true)) {
                    log.error("YouTube API authentication failed on {}; halting API access: {}", operation, detail);
                    notificationService.notifyError("YouTube API authentication failed. Check the API key configuration.");
                }
                return ApiResult.failure(ApiErrorType.AUTH_FAILURE, "YouTube API authentication failed");
            }
            default -> {
                log.warn("YouTube {} returned {}", operation, detail);
                return ApiResult.failure(ApiErrorType.TRANSIENT, "YouTube request failed (" + status + ")");
            }
        }
    }

    private String providerReason(WebClientResponseException e) {
        try {
            JsonNode error = objectMapper.readTree(e.getResponseBodyAsString()).path("error");
            String reason = error.path("errors").path(0).path("reason").asText("");
            return reason.isEmpty() ? error.path("message").asText("") : reason;
        } catch (Exception parseError) {
            return "";
        }
    }

    private List<CandidateVideo> parseSearchItems(JsonNode root) {
        List<CandidateVideo> videos = new ArrayList<>();
        for (JsonNode item : root.path("items")) {
            String videoId = item.path("id").path("videoId").asText(null);
            if (videoId == null || videoId.isBlank()) {
                continue;
            }
            videos.add(snippetToVideo(videoId, item.path("snippet")).build());
        }
        return videos;
    }

    private List<CandidateVideo> parseVideoItems(JsonNode root) {
        List<CandidateVideo> videos = new ArrayList<>();
        for (JsonNode item : root.path("items")) {
            String videoId = item.path("id").asText(null);
            if (videoId == null || videoId.isBlank()) {
                continue;
            }
            JsonNode statistics = item.path("statistics");
            videos.add(snippetToVideo(videoId, item.path("snippet"))
                    .durationSeconds(IsoDurationParser.toSeconds(item.path("contentDetails").path("duration").asText(null)))
                    .viewCount(statistics.path("viewCount").asLong(0))
                    .likeCount(statistics.path("likeCount").asLong(0))
                    .commentCount(statistics.path("commentCount").asLong(0))
                    .build());
        }
        return videos;
    }

    private CandidateVideo.CandidateVideoBuilder snippetToVideo(String videoId, JsonNode snippet) {
        return CandidateVideo.builder()
                .videoId(videoId)
                .title(snippet.path("title").asText(""))
                .channelId(snippet.path("channelId").asText(null))
                .channelName(snippet.path("channelTitle").asText(null))
                .publishedAt(parseTimestamp(snippet.path("publishedAt").asText(null)))
                .description(snippet.path("description").asText(""))
                .thumbnailUrl(bestThumbnail(snippet.path("thumbnails")));
    }

    private String bestThumbnail(JsonNode thumbnails) {
        for (String size : List.of("high", "medium", "default")) {
            String url = thumbnails.path(size).path("url").asText(null);
            if (url != null && !url.isBlank()) {
                return url;
            }
        }
        return null;
    }

    private LocalDateTime parseTimestamp(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value).withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime();
        } catch (DateTimeParseException e) {
            log.debug("Unparseable publishedAt '{}'", value);
            return null;
        }
    }

    private String formatTimestamp(LocalDateTime value) {
        return value == null ? "any" : value.format(RFC3339);
    }

    private static int clampMaxResults(int maxResults) {
        return Math.max(1, Math.min(MAX_RESULTS_PER_CALL, maxResults));
    }

    private static Integer countItems(Object data) {
        return data instanceof List<?> list ? list.size() : null;
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }

    private static boolean isInterruption(Throwable e) {
        if (Thread.currentThread().isInterrupted()) {
            return true;
        }
        Throwable unwrapped = Exceptions.unwrap(e);
        for (Throwable t = unwrapped; t != null; t = t.getCause()) {
            if (t instanceof InterruptedException) {
                return true;
            }
        }
        return false;
    }

    private static void checkCancelled() {
        if (Thread.currentThread().isInterrupted()) {
            throw new CancellationException("Bulk fetch cancelled");
        }
    }
}
