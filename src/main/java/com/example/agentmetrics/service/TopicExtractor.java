package com.example.agentmetrics.service;

import org.springframework.stereotype.Component;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Keyword based topic detection over a single message. Vocabulary is the Portuguese
 * heavy-equipment support domain the platform serves.
 */
@Component
public class TopicExtractor {

    static final int MAX_KEYWORDS = 10;

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.UNICODE_CHARACTER_CLASS;

    private static final Map<String, Pattern> TOPIC_PATTERNS = new LinkedHashMap<>();

    static {
        TOPIC_PATTERNS.put("freios", topic("freio|freios|frenagem|pastilha|disco|tambor"));
        TOPIC_PATTERNS.put("motor", topic("motor|motores|arranque|partida|combustão"));
        TOPIC_PATTERNS.put("hidráulico", topic("hidráulico|hidráulica|óleo|fluido|pressão"));
        TOPIC_PATTERNS.put("elétrico", topic("elétrico|elétrica|bateria|alternador|fiação"));
        TOPIC_PATTERNS.put("pneu", topic("pneu|pneus|roda|rodas|pressão|calibragem"));
        TOPIC_PATTERNS.put("manutenção", topic("manutenção|manutenções|preventiva|corretiva|revisão"));
        TOPIC_PATTERNS.put("peças", topic("peça|peças|componente|componentes|reposição"));
        TOPIC_PATTERNS.put("problema", topic("problema|problemas|defeito|defeitos|falha|falhas"));
        TOPIC_PATTERNS.put("configuração", topic("configuração|configurar|ajuste|calibração"));
    }

    private static final Set<String> STOP_WORDS = Set.of(
            "a", "o", "e", "de", "da", "do", "em", "um", "uma", "para", "com", "não", "que", "se", "por");

    private static final Pattern WORD = Pattern.compile("\\b\\w{3,}\\b", FLAGS);

    private static Pattern topic(String alternatives) {
        return Pattern.compile("\\b(?:" + alternatives + ")\\b", FLAGS);
    }

    public List<String> extractTopics(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        String lower = text.toLowerCase(Locale.ROOT);
        return TOPIC_PATTERNS.entrySet().stream()
                .filter(e -> e.getValue().matcher(lower).find())
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
    }

    /**
     * Most frequent words first; ties keep first-seen order.
     */
    public List<String> extractKeywords(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        Map<String, Integer> counts = new LinkedHashMap<>();
        Matcher matcher = WORD.matcher(text.toLowerCase(Locale.ROOT));
        while (matcher.find()) {
            String word = matcher.group();
            if (!STOP_WORDS.contains(word)) {
                counts.merge(word, 1, Integer::sum);
            }
        }
        return counts.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed())
                .limit(MAX_KEYWORDS)
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
    }
}
