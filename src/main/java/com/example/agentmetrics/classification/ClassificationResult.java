package com.example.agentmetrics.classification;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ClassificationResult {
    public static final int NEUTRAL_SATISFACTION = 3;
    public static final String DEFAULT_CATEGORY = "geral";
    public static final String DEFAULT_SUMMARY = "Classificação automática";

    private List<String> topics;
    /** positivo, negativo or neutro */
    private String sentiment;
    /** 1 to 5 */
    private Integer satisfaction;
    private String category;
    /** baixa, média or alta */
    private String complexity;
    private List<String> keywords;
    private String summary;

    public int ratingOrDefault() {
        if (satisfaction == null) {
            return NEUTRAL_SATISFACTION;
        }
        return Math.max(1, Math.min(5, satisfaction));
    }

    public String categoryOrDefault() {
        return category == null || category.isBlank() ? DEFAULT_CATEGORY : category;
    }

    public String summaryOrDefault() {
        return summary == null || summary.isBlank() ? DEFAULT_SUMMARY : summary;
    }

    public List<String> topicsOrEmpty() {
        return topics == null ? List.of() : topics;
    }

    public List<String> keywordsOrEmpty() {
        return keywords == null ? List.of() : keywords;
    }
}
