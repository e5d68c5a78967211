package com.videoscout.suggestion.service;

import com.videoscout.suggestion.dto.CandidateOrigin;
import com.videoscout.suggestion.dto.CandidateVideo;
import com.videoscout.suggestion.dto.SourcedCandidate;
import com.videoscout.suggestion.dto.TopicSearchHit;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Merges channel-update and topic-search results into one candidate per video id.
 *
 * The merge is order-independent: origins combine to BOTH when a video appears in both lists,
 * topic names are unioned, and when the two copies of a video differ the tracked-channel copy is kept.
 */
@Component
public class SourceConsolidator {

    public List<SourcedCandidate> consolidate(List<CandidateVideo> channelVideos,
                                              List<TopicSearchHit> topicHits,
                                              Map<String, Integer> ratings) {
        Map<String, Entry> entries = new LinkedHashMap<>();

        for (CandidateVideo video : channelVideos) {
            Entry entry = entries.computeIfAbsent(video.getVideoId(), id -> new Entry());
            if (entry.channelCopy == null) {
                entry.channelCopy = video;
            }
            entry.origin = entry.origin == null ? CandidateOrigin.TRACKED_CHANNEL
                    : entry.origin.merge(CandidateOrigin.TRACKED_CHANNEL);
        }

        for (TopicSearchHit hit : topicHits) {
            Entry entry = entries.computeIfAbsent(hit.video().getVideoId(), id -> new Entry());
            if (entry.topicCopy == null) {
                entry.topicCopy = hit.video();
            }
            entry.topics.addAll(hit.topics());
            entry.origin = entry.origin == null ? CandidateOrigin.TOPIC_SEARCH
                    : entry.origin.merge(CandidateOrigin.TOPIC_SEARCH);
        }

        Map<String, Integer> ratingSnapshot = ratings != null ? ratings : Map.of();
        List<SourcedCandidate> result = new ArrayList<>(entries.size());
        for (Entry entry : entries.values()) {
            CandidateVideo video = entry.channelCopy != null ? entry.channelCopy : entry.topicCopy;
            result.add(SourcedCandidate.builder()
                    .video(video)
                    .origin(entry.origin)
                    .matchedTopics(Collections.unmodifiableSet(entry.topics))
                    .ratingSnapshot(video.getChannelId() != null ? ratingSnapshot.get(video.getChannelId()) : null)
                    .build());
        }
        return result;
    }

    private static final class Entry {
        private CandidateVideo channelCopy;
        private CandidateVideo topicCopy;
        private CandidateOrigin origin;
        private final Set<String> topics = new TreeSet<>();
    }
}
