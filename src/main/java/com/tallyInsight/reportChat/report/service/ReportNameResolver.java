package com.tallyInsight.reportChat.report.service;

import java.util.Optional;

/**
 * Maps a question to the canonical report it is about. Its answer is trusted without re-validation.
 */
public interface ReportNameResolver {

    Optional<String> resolve(String question);
}
