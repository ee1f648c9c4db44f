package com.tallyInsight.reportChat.gateway.controller;

import com.tallyInsight.reportChat.gateway.dto.CompanyResponse;
import com.tallyInsight.reportChat.gateway.dto.QueryRequest;
import com.tallyInsight.reportChat.gateway.dto.QueryResponse;
import com.tallyInsight.reportChat.gateway.service.ReportQueryService;
import com.tallyInsight.reportChat.normalizer.model.NormalizedTable;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.Map;

/**
 * Thin HTTP layer for report questions; business logic lives in {@link ReportQueryService}.
 */
@RestController
@RequestMapping("/api/v1/reports")
@CrossOrigin(origins = {"http://localhost:5173", "http://localhost:3000"})
@RequiredArgsConstructor
public class ReportQueryController {

    private static final String SESSION_ID_HEADER = "X-Session-ID";

    private final ReportQueryService reportQueryService;

    /**
     * Handle preflight OPTIONS requests for CORS.
     */
    @RequestMapping(method = RequestMethod.OPTIONS)
    public ResponseEntity<Void> options() {
        return ResponseEntity.ok().build();
    }

    @PostMapping("/query")
    public ResponseEntity<QueryResponse> query(
            @Valid @RequestBody QueryRequest request,
            @RequestHeader(value = SESSION_ID_HEADER, required = false) String sessionIdHeader) {
        return ResponseEntity.ok(reportQueryService.processQuery(request, sessionIdHeader));
    }

    /**
     * Normalizes a raw export body into rows.
     */
    @PostMapping("/normalize")
    public ResponseEntity<NormalizedTable> normalize(@RequestBody Map<String, Object> export) {
        return ResponseEntity.ok(reportQueryService.normalize(export));
    }

    @GetMapping("/company")
    public ResponseEntity<CompanyResponse> company(
            @RequestHeader(value = SESSION_ID_HEADER, required = false) String sessionIdHeader) {
        return ResponseEntity.ok(reportQueryService.describeCompanies(sessionIdHeader));
    }

    @PostMapping("/session/reset")
    public ResponseEntity<Map<String, String>> resetSession(
            @RequestHeader(value = SESSION_ID_HEADER, required = false) String sessionIdHeader) {
        reportQueryService.resetSession(sessionIdHeader);

        Map<String, String> response = new HashMap<>();
        response.put("status", "success");
        response.put("message", "Session cleared");
        return ResponseEntity.ok(response);
    }
}
