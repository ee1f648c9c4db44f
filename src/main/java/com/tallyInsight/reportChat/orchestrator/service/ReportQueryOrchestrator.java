package com.tallyInsight.reportChat.orchestrator.service;

import com.tallyInsight.reportChat.chart.model.ChartSpec;
import com.tallyInsight.reportChat.chart.model.GraphCommand;
import com.tallyInsight.reportChat.chart.service.ChartService;
import com.tallyInsight.reportChat.chart.service.RowFilterService;
import com.tallyInsight.reportChat.gateway.dto.QueryResponse;
import com.tallyInsight.reportChat.gateway.model.RequestContext;
import com.tallyInsight.reportChat.intent.model.Intent;
import com.tallyInsight.reportChat.intent.model.IntentResult;
import com.tallyInsight.reportChat.normalizer.model.NormalizedRow;
import com.tallyInsight.reportChat.normalizer.model.NormalizedTable;
import com.tallyInsight.reportChat.normalizer.service.ReportNormalizationService;
import com.tallyInsight.reportChat.intent.service.IntentClassificationService;
import com.tallyInsight.reportChat.chart.service.GraphCommandParser;
import com.tallyInsight.reportChat.report.exception.NoCompanySelectedException;
import com.tallyInsight.reportChat.report.exception.ReportNotFoundException;
import com.tallyInsight.reportChat.report.service.ReportFetchService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Orchestrator service - owns the question workflow.
 *
 * Workflow steps:
 * CLASSIFY -> (IF COMPANY_SELECTION -> RESPOND)
 * -> PARSE_COMMAND -> FETCH -> NORMALIZE -> PRUNE -> (GRAPH | TABLE | VALUE | SUMMARY) -> RESPOND
 *
 * Missing company, unknown report and failures along the way come back as error responses;
 * nothing is thrown to the gateway.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReportQueryOrchestrator {

    private final IntentClassificationService intentClassificationService;
    private final GraphCommandParser graphCommandParser;
    private final ReportFetchService reportFetchService;
    private final ReportNormalizationService reportNormalizationService;
    private final RowFilterService rowFilterService;
    private final ChartService chartService;
    private final RowRanker rowRanker;
    private final TableViewBuilder tableViewBuilder;

    /**
     * Answers a report question.
     *
     * @param requestContext Request context with question, active company and history
     * @return Response shaped by the classified intent
     */
    public QueryResponse process(RequestContext requestContext) {
        String correlationId = requestContext.getCorrelationId();
        String question = requestContext.getQuestion();
        log.info("Starting orchestration - correlationId: {}", correlationId);

        IntentResult intent = null;
        try {
            // Step 1: CLASSIFY
            intent = intentClassificationService.classify(question, requestContext.getHistory(), correlationId);

            if (intent.getIntent() == Intent.COMPANY_SELECTION) {
                return selectCompany(intent, correlationId);
            }

            // Step 2: PARSE_COMMAND
            log.debug("Step PARSE_COMMAND - correlationId: {}", correlationId);
            GraphCommand command = graphCommandParser.parse(question, requestContext.getActiveCompany());

            // Step 3: FETCH
            Optional<Map<String, Object>> export = reportFetchService.fetch(
                    command.getCompanyName(), command.getReportName(), correlationId);
            if (export.isEmpty()) {
                return QueryResponse.error(QueryResponse.REPORT_NOT_FOUND,
                        "No '" + command.getReportName() + "' export for " + command.getCompanyName(),
                        intent, correlationId);
            }

            // Step 4: NORMALIZE
            log.debug("Step NORMALIZE - correlationId: {}", correlationId);
            NormalizedTable table = reportNormalizationService.normalize(export.get());

            // Step 5: PRUNE
            List<NormalizedRow> rows = new ArrayList<>(table.getRows());
            rows.removeIf(row -> !row.hasAnyNumeric());
            log.info("Report rows ready - correlationId: {}, report: {}, shape: {}, rows: {}",
                    correlationId, command.getReportName(), table.getShape(), rows.size());

            QueryResponse response = QueryResponse.builder()
                    .status(QueryResponse.STATUS_OK)
                    .outputType(intent.getIntent())
                    .intent(intent)
                    .command(command)
                    .reportUsed(command.getReportName())
                    .companyName(command.getCompanyName())
                    .correlationId(correlationId)
                    .build();

            // Step 6: ANSWER
            switch (intent.getIntent()) {
                case GRAPH -> answerGraph(response, table.getColumns(), rows, question, command, correlationId);
                case TABLE -> answerTable(response, table.getColumns(), rows, question, command);
                case VALUE -> answerValue(response, table.getColumns(), rows, question, command, correlationId);
                default -> answerSummary(response, table.getColumns(), rows, command);
            }
            return response;

        } catch (NoCompanySelectedException e) {
            log.info("No company selected - correlationId: {}", correlationId);
            return QueryResponse.error(QueryResponse.NO_COMPANY_SELECTED, e.getMessage(), intent, correlationId);
        } catch (ReportNotFoundException e) {
            log.info("Report not resolved - correlationId: {}", correlationId);
            return QueryResponse.error(QueryResponse.REPORT_NOT_FOUND, e.getMessage(), intent, correlationId);
        } catch (RuntimeException e) {
            log.error("Error in orchestration - correlationId: {}", correlationId, e);
            return QueryResponse.error(QueryResponse.PROCESSING_ERROR,
                    "The question could not be answered. Please try again.", intent, correlationId);
        }
    }

    private QueryResponse selectCompany(IntentResult intent, String correlationId) {
        String company = intent.getCompanyName();
        if (company == null || company.isBlank()) {
            return QueryResponse.error(QueryResponse.NO_COMPANY_SELECTED,
                    "Could not read a company name. Try \"use <company name>\".", intent, correlationId);
        }
        log.info("Company selected - correlationId: {}, company: {}", correlationId, company);
        return QueryResponse.builder()
                .status(QueryResponse.STATUS_OK)
                .outputType(Intent.COMPANY_SELECTION)
                .intent(intent)
                .companyName(company)
                .message("Active company set to " + company)
                .correlationId(correlationId)
                .build();
    }

    private void answerGraph(QueryResponse response, List<String> columns, List<NormalizedRow> rows,
                             String question, GraphCommand command, String correlationId) {
        response.setTable(tableViewBuilder.build(columns, rows, command.getReportName()));
        if (rows.isEmpty()) {
            response.setMessage("The report has no numeric rows to plot.");
            return;
        }
        ChartSpec spec = chartService.render(rows, question, command, correlationId);
        response.setChartSpec(spec);
    }

    private void answerTable(QueryResponse response, List<String> columns, List<NormalizedRow> rows,
                             String question, GraphCommand command) {
        List<NormalizedRow> ranked = rowRanker.topN(rows, question, command.getReportName());
        response.setTable(tableViewBuilder.build(columns, ranked, command.getReportName()));
    }

    private void answerValue(QueryResponse response, List<String> columns, List<NormalizedRow> rows,
                             String question, GraphCommand command, String correlationId) {
        if (rowRanker.isSuperlative(question)) {
            Optional<NormalizedRow> extreme = rowRanker.pickExtreme(rows, question, command.getReportName());
            if (extreme.isPresent()) {
                response.setValueRows(List.of(extreme.get()));
                return;
            }
        }

        List<NormalizedRow> matched = rowFilterService.filter(rows, question, correlationId);
        if (!matched.isEmpty() && matched.size() < rows.size()) {
            response.setValueRows(matched);
            return;
        }

        // nothing named explicitly: show the whole report instead of guessing a row
        response.setValueRows(List.of());
        response.setTable(tableViewBuilder.build(columns, rows, command.getReportName()));
        response.setMessage("No single row matched the question; showing the full report.");
    }

    private void answerSummary(QueryResponse response, List<String> columns, List<NormalizedRow> rows,
                               GraphCommand command) {
        response.setOutputType(Intent.SUMMARY);
        response.setTable(tableViewBuilder.build(columns, rows, command.getReportName()));
        response.setMessage(command.getReportName() + " for " + command.getCompanyName()
                + ": " + rows.size() + " rows");
    }
}
