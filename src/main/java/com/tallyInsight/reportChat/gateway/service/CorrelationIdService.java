package com.tallyInsight.reportChat.gateway.service;

import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Generates correlation IDs that tag every log line of one question.
 */
@Service
public class CorrelationIdService {

    public String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }
}
