package com.tallyInsight.reportChat.report.service;

import com.tallyInsight.reportChat.intent.util.QueryText;
import com.tallyInsight.reportChat.intent.util.ReportTypePatterns;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Report lookup by keyword patterns over the normalized question.
 */
@Slf4j
@Service
public class KeywordReportNameResolver implements ReportNameResolver {

    @Override
    public Optional<String> resolve(String question) {
        Optional<String> report = ReportTypePatterns.infer(QueryText.normalize(question));
        log.debug("Report resolved - report: {}", report.orElse(null));
        return report;
    }
}
