package com.tallyInsight.reportChat.gateway.service;

import com.tallyInsight.reportChat.gateway.dto.CompanyResponse;
import com.tallyInsight.reportChat.gateway.dto.QueryRequest;
import com.tallyInsight.reportChat.gateway.dto.QueryResponse;
import com.tallyInsight.reportChat.gateway.exception.MissingSessionIdException;
import com.tallyInsight.reportChat.gateway.model.ConversationContext;
import com.tallyInsight.reportChat.gateway.model.RequestContext;
import com.tallyInsight.reportChat.intent.model.Intent;
import com.tallyInsight.reportChat.normalizer.model.NormalizedTable;
import com.tallyInsight.reportChat.normalizer.service.ReportNormalizationService;
import com.tallyInsight.reportChat.orchestrator.service.ReportQueryOrchestrator;
import com.tallyInsight.reportChat.report.repository.ExportRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Gateway service - session handling around the orchestrator.
 *
 * Responsibilities:
 * - Validate the X-Session-ID header
 * - Generate the correlationId
 * - Snapshot the conversation (active company, recent questions) into the request context
 * - Apply a company selection and record the question after the orchestrator answers
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReportQueryService {

    private final CorrelationIdService correlationIdService;
    private final ConversationService conversationService;
    private final ReportQueryOrchestrator reportQueryOrchestrator;
    private final ReportNormalizationService reportNormalizationService;
    private final ExportRepository exportRepository;

    /**
     * @param request Question
     * @param sessionIdHeader Session ID from the HTTP header
     * @return Orchestrator response
     * @throws MissingSessionIdException if the header is missing or blank
     */
    public QueryResponse processQuery(QueryRequest request, String sessionIdHeader) {
        String sessionId = extractAndValidateSessionId(sessionIdHeader);
        String correlationId = correlationIdService.generateCorrelationId();
        ConversationContext conversation = conversationService.getOrCreate(sessionId);

        RequestContext context;
        synchronized (conversation) {
            context = RequestContext.builder()
                    .correlationId(correlationId)
                    .sessionId(sessionId)
                    .question(request.getQuestion())
                    .activeCompany(conversation.getActiveCompany())
                    .history(List.copyOf(conversation.getRecentTurns()))
                    .receivedAt(Instant.now())
                    .build();
        }

        log.info("Report question received - correlationId: {}, sessionId: {}, activeCompany: {}, turns: {}",
                correlationId, sessionId, context.getActiveCompany(), context.getHistory().size());

        QueryResponse response = reportQueryOrchestrator.process(context);

        synchronized (conversation) {
            if (QueryResponse.STATUS_OK.equals(response.getStatus())
                    && response.getOutputType() == Intent.COMPANY_SELECTION) {
                conversation.setActiveCompany(response.getCompanyName());
            }
            conversation.recordTurn(request.getQuestion());
            conversationService.update(conversation);
        }
        return response;
    }

    /**
     * Normalizes an export posted directly, without a session.
     */
    public NormalizedTable normalize(Map<String, Object> export) {
        String correlationId = correlationIdService.generateCorrelationId();
        log.debug("Step NORMALIZE - correlationId: {}", correlationId);
        NormalizedTable table = reportNormalizationService.normalize(export);
        log.info("Export normalized on request - correlationId: {}, shape: {}, rows: {}",
                correlationId, table.getShape(), table.getRows().size());
        return table;
    }

    public CompanyResponse describeCompanies(String sessionIdHeader) {
        String sessionId = extractAndValidateSessionId(sessionIdHeader);
        ConversationContext conversation = conversationService.find(sessionId);
        return CompanyResponse.builder()
                .activeCompany(conversation != null ? conversation.getActiveCompany() : null)
                .companies(exportRepository.findCompanies())
                .build();
    }

    public void resetSession(String sessionIdHeader) {
        String sessionId = extractAndValidateSessionId(sessionIdHeader);
        conversationService.invalidate(sessionId);
    }

    private String extractAndValidateSessionId(String sessionIdHeader) {
        if (sessionIdHeader == null || sessionIdHeader.isBlank()) {
            log.error("Missing sessionId header");
            throw new MissingSessionIdException("Session ID header is required");
        }
        return sessionIdHeader.trim();
    }
}
