package com.tallyInsight.reportChat.report.repository;

import java.util.Map;
import java.util.Optional;

/**
 * Transport to the accounting backend: one raw export per (company, report) request.
 */
public interface ReportSource {

    /**
     * @param companyName Company as known to the backend
     * @param reportName Backend report name (an alias, not necessarily canonical)
     * @return Deserialized export tree, empty if the backend has none
     */
    Optional<Map<String, Object>> fetch(String companyName, String reportName);
}
