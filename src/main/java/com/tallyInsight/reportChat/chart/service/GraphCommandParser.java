package com.tallyInsight.reportChat.chart.service;

import com.tallyInsight.reportChat.chart.model.ChartType;
import com.tallyInsight.reportChat.chart.model.GraphCommand;
import com.tallyInsight.reportChat.report.exception.NoCompanySelectedException;
import com.tallyInsight.reportChat.report.exception.ReportNotFoundException;
import com.tallyInsight.reportChat.report.service.ReportNameResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Reads chart type and report name from a question.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GraphCommandParser {

    private static final Pattern PIE = Pattern.compile("\\bpie\\b");
    private static final Pattern LINE = Pattern.compile("\\b(line|trend)\\b");
    private static final Pattern AREA = Pattern.compile("\\barea\\b");

    private final ReportNameResolver reportNameResolver;

    /**
     * @param question Question text
     * @param companyName Active company, may be null
     * @return Parsed command
     * @throws NoCompanySelectedException when no company is active
     * @throws ReportNotFoundException when the question names no known report
     */
    public GraphCommand parse(String question, String companyName) {
        if (companyName == null || companyName.isBlank()) {
            throw new NoCompanySelectedException("No company selected. Select a company first, e.g. \"use <company name>\".");
        }

        String reportName = reportNameResolver.resolve(question)
                .orElseThrow(() -> new ReportNotFoundException("Unable to determine report. Please rephrase your question."));

        GraphCommand command = new GraphCommand(chartTypeOf(question), reportName, companyName);
        log.debug("Graph command parsed - chartType: {}, report: {}", command.getChartType(), command.getReportName());
        return command;
    }

    static ChartType chartTypeOf(String question) {
        String q = question == null ? "" : question.toLowerCase(Locale.ROOT);
        if (PIE.matcher(q).find()) {
            return ChartType.PIE;
        }
        if (LINE.matcher(q).find()) {
            return ChartType.LINE;
        }
        if (AREA.matcher(q).find()) {
            return ChartType.AREA;
        }
        return ChartType.BAR;
    }
}
