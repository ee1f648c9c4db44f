package com.tallyInsight.reportChat.normalizer.shape;

import com.tallyInsight.reportChat.normalizer.model.NormalizedRow;
import com.tallyInsight.reportChat.normalizer.model.NormalizedTable;
import com.tallyInsight.reportChat.normalizer.model.ReportField;
import com.tallyInsight.reportChat.normalizer.model.ReportSection;
import com.tallyInsight.reportChat.normalizer.util.ExportTree;
import com.tallyInsight.reportChat.normalizer.util.ScalarParser;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Last resort for unknown layouts: walks the whole tree and guesses a label and a value for every
 * map it meets.
 *
 * For each map node, nested maps become rows when both a label and a value are found; maps inside
 * lists become rows when either is found, with {@code <parentKey>_<index>} as the synthesized label.
 * The walk then descends into children, bounded by the configured depth.
 */
public class GenericFallbackShapeRecognizer implements ShapeRecognizer {

    static final List<String> NAME_LIKE_KEYS = List.of(
            "DSPDISPNAME", "DSPACCNAME", "NAME", "LEDGERNAME", "ACCNAME",
            "STOCK", "ITEM", "RATIO", "PARTY", "GROUP");

    private final int maxDepth;

    public GenericFallbackShapeRecognizer(int maxDepth) {
        this.maxDepth = maxDepth;
    }

    @Override
    public String getShapeName() {
        return "generic";
    }

    @Override
    public boolean supports(Map<String, Object> envelope) {
        return true;
    }

    @Override
    public NormalizedTable extract(Map<String, Object> envelope) {
        List<NormalizedRow> rows = new ArrayList<>();
        walk(envelope, "", 0, rows);
        return NormalizedTable.of(ReportField.DEFAULT_COLUMNS, rows);
    }

    private void walk(Object node, String parentKey, int depth, List<NormalizedRow> rows) {
        if (depth > maxDepth) {
            return;
        }
        String section = sectionHint(parentKey);

        Map<String, Object> map = ExportTree.asMap(node);
        if (map != null) {
            for (Object child : map.values()) {
                Map<String, Object> childMap = ExportTree.asMap(child);
                if (childMap == null) {
                    continue;
                }
                Guess guess = guess(childMap, section);
                if (guess.label() != null && guess.value() != null) {
                    rows.add(row(section, guess.label(), guess.value()));
                }
            }

            for (Map.Entry<String, Object> entry : map.entrySet()) {
                if (!ExportTree.isList(entry.getValue())) {
                    continue;
                }
                List<Object> items = ExportTree.asList(entry.getValue());
                for (int i = 0; i < items.size(); i++) {
                    Map<String, Object> item = ExportTree.asMap(items.get(i));
                    if (item == null) {
                        continue;
                    }
                    Guess guess = guess(item, section);
                    if (guess.label() == null && guess.value() == null) {
                        continue;
                    }
                    String label = guess.label() != null ? guess.label() : entry.getKey() + "_" + i;
                    rows.add(row(section, label, guess.value()));
                }
            }

            for (Map.Entry<String, Object> entry : map.entrySet()) {
                Object child = entry.getValue();
                if (child instanceof Map<?, ?> || child instanceof List<?>) {
                    walk(child, entry.getKey(), depth + 1, rows);
                }
            }
        } else if (node instanceof List<?> list) {
            for (Object item : list) {
                if (item instanceof Map<?, ?> || item instanceof List<?>) {
                    walk(item, parentKey, depth + 1, rows);
                }
            }
        }
    }

    private String sectionHint(String parentKey) {
        String key = parentKey == null ? "" : parentKey.toUpperCase(Locale.ROOT);
        if (key.contains("RATIO")) {
            return ReportSection.RATIO_ANALYSIS;
        }
        if (key.contains("STOCK") || key.contains("ITEM")) {
            return ReportSection.STOCK_SUMMARY;
        }
        return ReportSection.AUTO;
    }

    private Guess guess(Map<String, Object> candidate, String section) {
        String label = null;
        for (Map.Entry<String, Object> field : candidate.entrySet()) {
            String key = field.getKey() == null ? "" : field.getKey().toUpperCase(Locale.ROOT);
            if (NAME_LIKE_KEYS.stream().anyMatch(key::contains)) {
                label = ExportTree.nonBlankText(field.getValue());
                if (label != null) {
                    break;
                }
            }
        }

        if (label == null) {
            for (Object field : candidate.values()) {
                if (field instanceof CharSequence) {
                    label = ExportTree.nonBlankText(field);
                    if (label != null) {
                        break;
                    }
                }
            }
        }

        // ratio values read like "17.22 : 1"; only the leading number counts
        boolean ratio = ReportSection.RATIO_ANALYSIS.equals(section);
        Double value = null;
        for (Object field : candidate.values()) {
            value = ratio ? ScalarParser.parseRatio(field) : ScalarParser.parse(field);
            if (value != null) {
                break;
            }
        }
        return new Guess(label, value);
    }

    private NormalizedRow row(String section, String label, Double value) {
        return NormalizedRow.builder()
                .section(section)
                .label(label)
                .value(value)
                .build();
    }

    private record Guess(String label, Double value) {}
}
