package com.tallyInsight.reportChat.gateway.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Request context passed from the gateway to the orchestrator.
 * Active company and history are snapshots; the orchestrator never writes them back.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RequestContext {

    /**
     * Correlation ID for request tracking
     */
    private String correlationId;

    /**
     * Session ID from the X-Session-ID header
     */
    private String sessionId;

    private String question;

    /**
     * Company selected earlier in the session, null if none yet
     */
    private String activeCompany;

    /**
     * Up to three earlier questions, oldest first
     */
    private List<String> history;

    private Instant receivedAt;
}
