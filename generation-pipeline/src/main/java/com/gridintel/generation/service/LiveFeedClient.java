package com.gridintel.generation.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.gridintel.generation.config.GenerationPipelineProperties;
import com.gridintel.generation.exception.FeedFetchException;
import com.gridintel.generation.model.GenerationFeedResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.time.Clock;
import java.util.OptionalDouble;

/**
 * Thin client over the grid operator's public load-graph JSON feeds.
 *
 * Both endpoints sit behind a CDN, so every request carries a cache-busting
 * query parameter. There is no retry: a failed generation fetch aborts the run
 * and the scheduler simply tries again on the next tick.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class LiveFeedClient {

    private final RestTemplate restTemplate;
    private final GenerationPipelineProperties properties;
    private final Clock clock;

    /**
     * Fetch the per-unit generation table.
     *
     * @throws FeedFetchException on any network, HTTP or decoding failure
     */
    public GenerationFeedResponse fetchGeneration() {
        String url = cacheBusted(properties.getFeed().getGenerationUrl());
        log.debug("Fetching generation feed: {}", url);
        try {
            GenerationFeedResponse response = restTemplate.getForObject(url, GenerationFeedResponse.class);
            if (response == null) {
                throw new FeedFetchException("Generation feed returned an empty body");
            }
            return response;
        } catch (RestClientException e) {
            throw new FeedFetchException("Generation feed fetch failed: " + e.getMessage(), e);
        }
    }

    /**
     * Fetch the current system load in MW. Empty when the feed is unreachable
     * or does not carry {@code records[0].curr_load}.
     */
    public OptionalDouble fetchDemandMw() {
        String url = cacheBusted(properties.getFeed().getDemandUrl());
        try {
            JsonNode root = restTemplate.getForObject(url, JsonNode.class);
            JsonNode records = root == null ? null : root.get("records");
            if (records == null || !records.isArray() || records.isEmpty()) {
                log.warn("Demand feed has no 'records' array, skipping demand capture");
                return OptionalDouble.empty();
            }
            JsonNode load = records.get(0).get("curr_load");
            if (load == null || load.asText().isBlank()) {
                log.warn("Demand feed has no 'curr_load' value, skipping demand capture");
                return OptionalDouble.empty();
            }
            return OptionalDouble.of(Double.parseDouble(load.asText().replace(",", "").trim()));
        } catch (RestClientException e) {
            log.warn("Failed to fetch demand feed: {}", e.getMessage());
        } catch (NumberFormatException e) {
            log.warn("Failed to parse demand value: {}", e.getMessage());
        }
        return OptionalDouble.empty();
    }

    private String cacheBusted(String baseUrl) {
        return UriComponentsBuilder.fromHttpUrl(baseUrl)
                .queryParam("_", clock.millis() / 1000)
                .toUriString();
    }
}
