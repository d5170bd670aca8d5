package com.gridintel.generation.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.List;

/**
 * Raw DTO for the live generation feed.
 * Each row is positional: [0] HTML fuel label, [2] unit name, [4] net power.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class GenerationFeedResponse {

    @JsonProperty("aaData")
    private List<List<String>> rows;
}
