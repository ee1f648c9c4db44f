package com.tallyInsight.reportChat.gateway.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.tallyInsight.reportChat.gateway.model.ConversationContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;

/**
 * Conversation service - keeps per-session state in a Caffeine cache.
 *
 * Responsibilities:
 * - Get or create the conversation for a session ID
 * - Store the active company and recent questions
 * - Expire idle conversations after 30 minutes
 */
@Slf4j
@Service
public class ConversationService {

    private static final Duration CONVERSATION_TTL = Duration.ofMinutes(30);

    private final Cache<String, ConversationContext> conversationCache = Caffeine.newBuilder()
            .expireAfterAccess(CONVERSATION_TTL)
            .maximumSize(10_000)
            .removalListener((String key, ConversationContext value, RemovalCause cause) -> {
                if (value != null) {
                    log.debug("Conversation removed - sessionId: {}, activeCompany: {}, cause: {}",
                            key, value.getActiveCompany(), cause);
                }
            })
            .build();

    /**
     * @param sessionId Session ID from the X-Session-ID header
     * @return Existing conversation, touched, or a new empty one
     */
    public ConversationContext getOrCreate(String sessionId) {
        ConversationContext conversation = conversationCache.get(sessionId, id -> {
            log.info("Created new conversation - sessionId: {}", id);
            Instant now = Instant.now();
            return ConversationContext.builder()
                    .sessionId(id)
                    .createdAt(now)
                    .lastAccessedAt(now)
                    .build();
        });
        conversation.touch();
        return conversation;
    }

    /**
     * @return Conversation for the session, or null if none or expired
     */
    public ConversationContext find(String sessionId) {
        ConversationContext conversation = conversationCache.getIfPresent(sessionId);
        if (conversation != null) {
            conversation.touch();
        }
        return conversation;
    }

    public void update(ConversationContext conversation) {
        if (conversation == null || conversation.getSessionId() == null) {
            log.warn("Attempted to update null conversation or conversation without sessionId");
            return;
        }
        conversation.touch();
        conversationCache.put(conversation.getSessionId(), conversation);
        log.debug("Updated conversation - sessionId: {}, activeCompany: {}, turns: {}",
                conversation.getSessionId(), conversation.getActiveCompany(), conversation.getRecentTurns().size());
    }

    public void invalidate(String sessionId) {
        conversationCache.invalidate(sessionId);
        log.info("Invalidated conversation - sessionId: {}", sessionId);
    }

    public long getActiveConversationCount() {
        conversationCache.cleanUp();
        return conversationCache.estimatedSize();
    }
}
