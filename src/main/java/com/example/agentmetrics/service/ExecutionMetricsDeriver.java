package com.example.agentmetrics.service;

import com.example.agentmetrics.event.ExecutionEvent;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Fills in token counts and cost when a producer did not report them. Only absent values
 * are filled, so deriving an already derived event returns it unchanged.
 */
@Component
public class ExecutionMetricsDeriver {

    static final String DEFAULT_MODEL = "gpt-4o-mini";
    private static final double ONE_MILLION = 1_000_000d;
    private static final Price UNKNOWN_MODEL_PRICE = new Price(1.0, 3.0);

    // USD per 1M tokens
    private static final Map<String, Price> PRICING = Map.of(
            "gpt-5", new Price(15.0, 60.0),
            "gpt-5-mini", new Price(2.0, 8.0),
            "gpt-4.1", new Price(10.0, 30.0),
            "gpt-4o", new Price(5.0, 15.0),
            "gpt-4o-mini", new Price(0.15, 0.60),
            "claude-opus-4.1", new Price(15.0, 75.0),
            "claude-sonnet-4", new Price(3.0, 15.0),
            "claude-sonnet-3.7", new Price(3.0, 15.0),
            "claude-3.5-sonnet", new Price(3.0, 15.0)
    );

    public ExecutionEvent derive(ExecutionEvent event) {
        ExecutionEvent derived = event;
        if (isMissing(derived.getInputTokens())) {
            derived = derived.withInputTokens(estimateTokens(derived.getInputText()));
        }
        if (isMissing(derived.getOutputTokens())) {
            derived = derived.withOutputTokens(estimateTokens(derived.getOutputText()));
        }
        if (derived.getCostEstimate() == null) {
            String model = derived.getModel() == null ? DEFAULT_MODEL : derived.getModel();
            derived = derived.withCostEstimate(calculateCost(model, derived.getInputTokens(), derived.getOutputTokens()));
        }
        return derived;
    }

    /**
     * Roughly four characters per token.
     */
    public static int estimateTokens(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        return text.codePointCount(0, text.length()) / 4;
    }

    public double calculateCost(String model, int inputTokens, int outputTokens) {
        Price price = PRICING.getOrDefault(model, UNKNOWN_MODEL_PRICE);
        return inputTokens / ONE_MILLION * price.input() + outputTokens / ONE_MILLION * price.output();
    }

    private static boolean isMissing(Integer tokens) {
        return tokens == null || tokens == 0;
    }

    private record Price(double input, double output) {}
}
