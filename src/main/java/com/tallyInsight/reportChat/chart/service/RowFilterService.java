package com.tallyInsight.reportChat.chart.service;

import com.tallyInsight.reportChat.normalizer.model.NormalizedRow;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Narrows report rows to the ones a question names.
 *
 * Ambiguity resolves to the full row set: only an explicit label match or a non-empty
 * "only" selection ever removes rows.
 */
@Slf4j
@Service
public class RowFilterService {

    private static final Pattern FULL_REPORT = Pattern.compile("\\b(full|complete|entire|everything|whole|all)\\b");
    private static final Pattern ONLY = Pattern.compile("\\bonly\\b");
    private static final Pattern SEGMENT_SEPARATOR = Pattern.compile("[,;&]|\\band\\b");
    private static final int MIN_PARTIAL_MATCH_LENGTH = 4;

    static final Set<String> NOISE_WORDS = Set.of(
            "show", "display", "plot", "graph", "chart", "pie", "bar", "line", "area",
            "me", "the", "a", "an", "of", "in", "from", "for", "my", "to", "with",
            "balance", "sheet", "profit", "loss", "stock", "summary",
            "only", "just", "give", "compare", "comparison", "vs", "versus", "between",
            "please", "draw", "visualize", "visualise", "as", "by", "wise", "report");

    private final LabelSelector labelSelector;
    private final boolean labelSelectorEnabled;

    public RowFilterService(LabelSelector labelSelector,
                            @Value("${report-chat.filter.label-selector-enabled:true}") boolean labelSelectorEnabled) {
        this.labelSelector = labelSelector;
        this.labelSelectorEnabled = labelSelectorEnabled;
    }

    /**
     * @param rows Report rows
     * @param question Question text
     * @param correlationId Correlation ID for logging
     * @return Rows to visualize, in report order; never empty unless {@code rows} is
     */
    public List<NormalizedRow> filter(List<NormalizedRow> rows, String question, String correlationId) {
        log.debug("Step ROW_FILTER - correlationId: {}", correlationId);
        if (rows == null || rows.isEmpty() || question == null || question.isBlank()) {
            return rows == null ? List.of() : rows;
        }
        String q = question.toLowerCase(Locale.ROOT);

        if (FULL_REPORT.matcher(q).find()) {
            log.info("Full report requested - correlationId: {}, rows: {}", correlationId, rows.size());
            return rows;
        }

        List<String> labels = rows.stream()
                .map(NormalizedRow::getLabel)
                .filter(Objects::nonNull)
                .distinct()
                .toList();

        Set<String> explicit = extractExplicitLabels(q, labels);
        if (!explicit.isEmpty()) {
            log.info("Explicit labels matched - correlationId: {}, labels: {}", correlationId, explicit);
            return keep(rows, explicit);
        }

        if (ONLY.matcher(q).find() && labelSelectorEnabled) {
            Set<String> selected = selectLabels(question, labels, correlationId);
            if (!selected.isEmpty()) {
                log.info("Selector picked labels - correlationId: {}, labels: {}", correlationId, selected);
                return keep(rows, selected);
            }
            log.info("Selector returned no labels, keeping all rows - correlationId: {}", correlationId);
        }

        return rows;
    }

    Set<String> extractExplicitLabels(String question, List<String> labels) {
        Map<String, String> byNormalized = new LinkedHashMap<>();
        for (String label : labels) {
            byNormalized.putIfAbsent(normalize(label), label);
        }

        Set<String> matched = new LinkedHashSet<>();
        for (String segment : SEGMENT_SEPARATOR.split(question)) {
            String cleaned = stripNoise(normalize(segment));
            if (cleaned.isEmpty()) {
                continue;
            }

            String exact = byNormalized.get(cleaned);
            if (exact != null) {
                matched.add(exact);
                continue;
            }

            if (cleaned.length() < MIN_PARTIAL_MATCH_LENGTH) {
                continue;
            }
            for (Map.Entry<String, String> candidate : byNormalized.entrySet()) {
                String normalizedLabel = candidate.getKey();
                if (!normalizedLabel.isEmpty()
                        && (normalizedLabel.contains(cleaned) || cleaned.contains(normalizedLabel))) {
                    matched.add(candidate.getValue());
                    break;
                }
            }
        }
        return matched;
    }

    private Set<String> selectLabels(String question, List<String> labels, String correlationId) {
        try {
            Set<String> allowed = Set.copyOf(labels);
            return labelSelector.select(question, labels).stream()
                    .filter(allowed::contains)
                    .collect(Collectors.toCollection(LinkedHashSet::new));
        } catch (RuntimeException e) {
            log.warn("Label selection failed, keeping all rows - correlationId: {}, error: {}",
                    correlationId, e.getMessage());
            return Set.of();
        }
    }

    private static List<NormalizedRow> keep(List<NormalizedRow> rows, Set<String> labels) {
        List<NormalizedRow> kept = new ArrayList<>();
        for (NormalizedRow row : rows) {
            if (row.getLabel() != null && labels.contains(row.getLabel())) {
                kept.add(row);
            }
        }
        return kept;
    }

    static String normalize(String text) {
        if (text == null) {
            return "";
        }
        return text.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9 ]", "")
                .replaceAll("\\s+", " ")
                .trim();
    }

    private static String stripNoise(String segment) {
        return Arrays.stream(segment.split(" "))
                .filter(word -> !word.isEmpty() && !NOISE_WORDS.contains(word))
                .collect(Collectors.joining(" "));
    }
}
