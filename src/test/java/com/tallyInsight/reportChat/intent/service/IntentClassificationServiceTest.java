package com.tallyInsight.reportChat.intent.service;

import com.tallyInsight.reportChat.intent.model.Intent;
import com.tallyInsight.reportChat.intent.model.IntentResult;
import com.tallyInsight.reportChat.intent.model.IntentSource;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class IntentClassificationServiceTest {

    @Mock
    private RuleBasedIntentClassifier ruleBasedClassifier;

    @Mock
    private IntentModelClassifier modelClassifier;

    @Test
    void classify_shouldReturnRuleMatchWithoutCallingModel() {
        IntentResult ruleResult = IntentResult.rule(Intent.TABLE, "Stock Summary");
        when(ruleBasedClassifier.classify(anyString(), anyString())).thenReturn(Optional.of(ruleResult));
        IntentClassificationService service = new IntentClassificationService(ruleBasedClassifier, modelClassifier, true);

        IntentResult result = service.classify("top 5 items", List.of(), "cid");

        assertThat(result).isSameAs(ruleResult);
        verifyNoInteractions(modelClassifier);
    }

    @Test
    void classify_shouldUseModelWhenRulesAreInconclusive() {
        when(ruleBasedClassifier.classify(anyString(), anyString())).thenReturn(Optional.empty());
        when(modelClassifier.classify(eq("tell me about stock"), anyList())).thenReturn(IntentResult.builder()
                .intent(Intent.SUMMARY)
                .confidence(0.9)
                .source(IntentSource.MODEL)
                .build());
        IntentClassificationService service = new IntentClassificationService(ruleBasedClassifier, modelClassifier, true);

        IntentResult result = service.classify("Tell me about stock", List.of(), "cid");

        assertThat(result.getSource()).isEqualTo(IntentSource.MODEL);
        assertThat(result.getConfidence()).isEqualTo(0.9);
        assertThat(result.getReportTypeHint()).isEqualTo("Stock Summary");
    }

    @Test
    void classify_shouldDefaultToSummaryWhenModelFails() {
        when(ruleBasedClassifier.classify(anyString(), anyString())).thenReturn(Optional.empty());
        when(modelClassifier.classify(anyString(), anyList())).thenThrow(new IllegalStateException("GROQ_API_KEY is not configured"));
        IntentClassificationService service = new IntentClassificationService(ruleBasedClassifier, modelClassifier, true);

        IntentResult result = service.classify("tell me about the balance sheet", null, "cid");

        assertThat(result.getIntent()).isEqualTo(Intent.SUMMARY);
        assertThat(result.getConfidence()).isEqualTo(0.5);
        assertThat(result.getSource()).isEqualTo(IntentSource.DEFAULT);
        assertThat(result.getReportTypeHint()).isEqualTo("Balance Sheet");
    }

    @Test
    void classify_shouldSkipModelWhenDisabled() {
        when(ruleBasedClassifier.classify(anyString(), anyString())).thenReturn(Optional.empty());
        IntentClassificationService service = new IntentClassificationService(ruleBasedClassifier, modelClassifier, false);

        IntentResult result = service.classify("hello", List.of(), "cid");

        assertThat(result.getIntent()).isEqualTo(Intent.SUMMARY);
        verify(modelClassifier, never()).classify(any(), any());
    }

    @Test
    void lastTurns_shouldKeepOnlyTheThreeMostRecent() {
        assertThat(IntentClassificationService.lastTurns(List.of("a", "b", "c", "d", "e"))).containsExactly("c", "d", "e");
        assertThat(IntentClassificationService.lastTurns(null)).isEmpty();
    }
}
