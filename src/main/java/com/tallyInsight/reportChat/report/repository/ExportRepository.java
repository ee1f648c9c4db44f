package com.tallyInsight.reportChat.report.repository;

import com.fasterxml.jackson.databind.JsonNode;
import com.tallyInsight.reportChat.report.util.ExportFileLoader;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Report exports stored as JSON files on the classpath, one file per report.
 *
 * Each file holds an array of exports; {@code _id} is the company name and the export tree sits
 * beside it (usually under {@code ENVELOPE}). Files are re-read on every call so a report always
 * reflects the file as it is now.
 */
@Repository
public class ExportRepository implements ReportSource {

    private static final Logger log = LoggerFactory.getLogger(ExportRepository.class);

    static final String ID = "_id";

    // Backend report names (aliases included) to export files in resources/data
    private static final Map<String, String> REPORT_TO_FILE_MAP = Map.ofEntries(
        Map.entry("Balance Sheet", "data/balanceSheet.json"),
        Map.entry("Trading & Profit & Loss", "data/profitAndLoss.json"),
        Map.entry("Profit & Loss A/c", "data/profitAndLoss.json"),
        Map.entry("Stock Summary", "data/stockSummary.json"),
        Map.entry("Bills Receivable", "data/billsReceivable.json"),
        Map.entry("Bills Payable", "data/billsPayable.json"),
        Map.entry("Day Book", "data/dayBook.json"),
        Map.entry("Cash Flow", "data/cashFlow.json"),
        Map.entry("Sales Register", "data/salesRegister.json"),
        Map.entry("Statistics", "data/statistics.json"),
        Map.entry("Ratio Analysis", "data/ratioAnalysis.json")
    );

    private final Map<String, String> reportFiles;

    public ExportRepository() {
        this(REPORT_TO_FILE_MAP);
    }

    ExportRepository(Map<String, String> reportFiles) {
        this.reportFiles = reportFiles;
    }

    @Override
    public Optional<Map<String, Object>> fetch(String companyName, String reportName) {
        String filePath = reportFiles.get(reportName);
        if (filePath == null) {
            log.warn("Unknown report: {}", reportName);
            return Optional.empty();
        }
        if (companyName == null || companyName.isBlank()) {
            return Optional.empty();
        }

        JsonNode exports = ExportFileLoader.loadAsJsonNodeOrNull(filePath);
        if (exports == null) {
            return Optional.empty();
        }
        if (!exports.isArray()) {
            log.error("Export file {} does not contain an array", filePath);
            return Optional.empty();
        }

        for (JsonNode export : exports) {
            JsonNode idNode = export.get(ID);
            if (idNode != null && companyName.trim().equalsIgnoreCase(idNode.asText())) {
                return Optional.of(toDocument(export));
            }
        }

        log.debug("No export found - company: {}, report: {}", companyName, reportName);
        return Optional.empty();
    }

    /**
     * Companies that have at least one export, in file order.
     */
    public List<String> findCompanies() {
        Set<String> companies = new LinkedHashSet<>();
        for (String filePath : new LinkedHashSet<>(reportFiles.values())) {
            JsonNode exports = ExportFileLoader.loadAsJsonNodeOrNull(filePath);
            if (exports == null || !exports.isArray()) {
                continue;
            }
            for (JsonNode export : exports) {
                JsonNode idNode = export.get(ID);
                if (idNode != null && !idNode.asText().isBlank()) {
                    companies.add(idNode.asText());
                }
            }
        }
        return List.copyOf(companies);
    }

    // Document keeps key order, which the columnar recognizer depends on
    private Document toDocument(JsonNode export) {
        return Document.parse(export.toString());
    }
}
