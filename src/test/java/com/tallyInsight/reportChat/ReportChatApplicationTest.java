package com.tallyInsight.reportChat;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.greaterThan;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@TestPropertySource(properties = {
        "groq.api.key=",
        "report-chat.intent.model-fallback-enabled=false",
        "report-chat.filter.label-selector-enabled=false"
})
class ReportChatApplicationTest {

    private static final String SESSION_HEADER = "X-Session-ID";

    @Autowired
    private MockMvc mockMvc;

    private void ask(String sessionId, String question) throws Exception {
        mockMvc.perform(post("/api/v1/reports/query")
                        .header(SESSION_HEADER, sessionId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"question\": \"" + question + "\"}"))
                .andExpect(status().isOk());
    }

    @Test
    void query_shouldRequireCompanyBeforeReports() throws Exception {
        mockMvc.perform(post("/api/v1/reports/query")
                        .header(SESSION_HEADER, "it-no-company")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"question\": \"plot the balance sheet\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("error"))
                .andExpect(jsonPath("$.error_code").value("NO_COMPANY_SELECTED"));
    }

    @Test
    void query_shouldChartBalanceSheetOfSelectedCompany() throws Exception {
        ask("it-graph", "use Demo Enterprises");

        mockMvc.perform(post("/api/v1/reports/query")
                        .header(SESSION_HEADER, "it-graph")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"question\": \"plot the balance sheet\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ok"))
                .andExpect(jsonPath("$.output_type").value("graph"))
                .andExpect(jsonPath("$.report_used").value("Balance Sheet"))
                .andExpect(jsonPath("$.company_name").value("Demo Enterprises"))
                .andExpect(jsonPath("$.vega_spec['$schema']").value("https://vega.github.io/schema/vega-lite/v5.json"))
                .andExpect(jsonPath("$.vega_spec.data.values.length()").value(greaterThan(0)));

        mockMvc.perform(get("/api/v1/reports/company").header(SESSION_HEADER, "it-graph"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.active_company").value("Demo Enterprises"));
    }

    @Test
    void query_shouldListTopStockItems() throws Exception {
        ask("it-table", "use Sharma Traders Pvt Ltd");

        mockMvc.perform(post("/api/v1/reports/query")
                        .header(SESSION_HEADER, "it-table")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"question\": \"show top 3 stock items\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.output_type").value("table"))
                .andExpect(jsonPath("$.report_used").value("Stock Summary"))
                .andExpect(jsonPath("$.table.row_count").value(3));
    }

    @Test
    void normalize_shouldFlattenPostedExport() throws Exception {
        mockMvc.perform(post("/api/v1/reports/normalize")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"ENVELOPE": {
                                  "STATNAME": [{"DSPDISPNAME": "Ledgers"}, {"DSPDISPNAME": "Payment"}],
                                  "STATVALUE": [{"STATDIRECT": "42"}, {"STATDIRECT": "7"}]
                                }}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.rows.length()").value(2));
    }
}
