package com.sommerph.zkpipeline.model.artifact;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Structured form of a subject's {@code metadata.json}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SubjectMetadata {

    private String address;
    private List<Double> features;
    private Double score;
    @JsonProperty("scaled_score")
    private Long scaledScore;
    private Long timestamp;
    @JsonProperty("model_version")
    private String modelVersion;

}
