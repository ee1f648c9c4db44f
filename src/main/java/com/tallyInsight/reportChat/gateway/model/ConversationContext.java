package com.tallyInsight.reportChat.gateway.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Conversation state per session: the active company and the last few questions.
 * TTL: 30 minutes idle time.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ConversationContext {

    public static final int MAX_TURNS = 3;

    private String sessionId;

    /**
     * Company used for report fetches, null until the user selects one
     */
    private String activeCompany;

    /**
     * Most recent questions, oldest first, at most {@link #MAX_TURNS}
     */
    @Builder.Default
    private List<String> recentTurns = new ArrayList<>();

    private Instant createdAt;

    private Instant lastAccessedAt;

    public void recordTurn(String question) {
        recentTurns.add(question);
        while (recentTurns.size() > MAX_TURNS) {
            recentTurns.remove(0);
        }
    }

    public boolean hasActiveCompany() {
        return activeCompany != null && !activeCompany.isBlank();
    }

    public void touch() {
        this.lastAccessedAt = Instant.now();
    }
}
