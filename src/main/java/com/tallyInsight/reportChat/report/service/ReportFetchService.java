package com.tallyInsight.reportChat.report.service;

import com.tallyInsight.reportChat.intent.util.ReportTypePatterns;
import com.tallyInsight.reportChat.report.repository.ReportSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Fetches the raw export for a canonical report name.
 *
 * Some reports are published under several backend names; they are tried in order and the first
 * export carrying an {@code ENVELOPE} wins. Nothing is cached.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReportFetchService {

    static final String ENVELOPE = "ENVELOPE";

    private static final Map<String, List<String>> BACKEND_ALIASES = Map.of(
            ReportTypePatterns.PROFIT_AND_LOSS, List.of("ProfitAndLoss", "Trading & Profit & Loss", "Profit & Loss A/c")
    );

    private final ReportSource reportSource;

    /**
     * @param companyName Active company
     * @param reportName Canonical report name
     * @param correlationId Correlation ID for logging
     * @return Raw export, empty when no alias produced one
     */
    public Optional<Map<String, Object>> fetch(String companyName, String reportName, String correlationId) {
        log.debug("Step FETCH_REPORT - correlationId: {}", correlationId);

        for (String candidate : backendNames(reportName)) {
            Optional<Map<String, Object>> export = reportSource.fetch(companyName, candidate);
            if (export.isPresent() && export.get().get(ENVELOPE) != null) {
                log.info("Report fetched - correlationId: {}, report: {}, backendName: {}",
                        correlationId, reportName, candidate);
                return export;
            }
            log.debug("No export under backend name - correlationId: {}, backendName: {}", correlationId, candidate);
        }

        log.info("Report not available - correlationId: {}, company: {}, report: {}", correlationId, companyName, reportName);
        return Optional.empty();
    }

    static List<String> backendNames(String reportName) {
        return BACKEND_ALIASES.getOrDefault(reportName, List.of(reportName));
    }
}
