package com.tallyInsight.reportChat.normalizer.service;

import com.tallyInsight.reportChat.normalizer.model.NormalizedRow;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Rebuilds group totals that the export left blank.
 *
 * Hierarchical exports lose their parent/child structure when flattened, so a group header with
 * no amount is given the sum of every other row whose label contains the header's label
 * (case-insensitive). Rows are updated in place and in order, so a header filled earlier counts
 * towards a later one. A header with no matching rows stays null.
 *
 * Substring containment can match an unrelated sibling ("Loans" inside "Loans and Advances").
 */
@Slf4j
@Component
public class ParentAggregator {

    /**
     * Fills null values in place.
     *
     * @param rows Rows to update
     * @return The same list, for chaining
     */
    public List<NormalizedRow> aggregate(List<NormalizedRow> rows) {
        if (rows == null) {
            return null;
        }

        int filled = 0;
        for (NormalizedRow parent : rows) {
            if (parent.getValue() != null || parent.getLabel() == null) {
                continue;
            }

            String parentLabel = parent.getLabel().toLowerCase(Locale.ROOT);
            double total = 0;
            boolean found = false;
            for (NormalizedRow child : rows) {
                if (child == parent || child.getValue() == null || child.getLabel() == null) {
                    continue;
                }
                String childLabel = child.getLabel().toLowerCase(Locale.ROOT);
                if (!childLabel.equals(parentLabel) && childLabel.contains(parentLabel)) {
                    total += child.getValue();
                    found = true;
                }
            }

            if (found && Double.isFinite(total)) {
                parent.setValue(total);
                filled++;
            }
        }

        log.debug("Parent aggregation filled {} of {} rows", filled, rows.size());
        return rows;
    }
}
