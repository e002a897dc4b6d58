package com.esports.scraper.controller;

import com.esports.scraper.config.PipelineConfiguration;
import com.esports.scraper.model.PageTemplate;
import com.esports.scraper.parser.PageParserRegistry;
import com.esports.scraper.service.merge.ConflictPolicy;
import com.esports.scraper.service.pipeline.CancellationSignal;
import com.esports.scraper.service.pipeline.EntryPoint;
import com.esports.scraper.service.pipeline.ExtractionPipeline;
import com.esports.scraper.service.pipeline.NoDataExtractedException;
import com.esports.scraper.service.pipeline.OutputFormat;
import com.esports.scraper.service.pipeline.RunError;
import com.esports.scraper.service.pipeline.RunOptions;
import com.esports.scraper.service.pipeline.RunResult;
import com.esports.scraper.service.pipeline.RunSummary;
import com.esports.scraper.service.pipeline.TargetState;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ExtractionController.class)
@Import(PipelineConfiguration.class)
class ExtractionControllerTest {

    private static final String MATCHES = "https://www.vlr.gg/event/matches/2095/champions-tour-2024-americas-stage-2";

    @Autowired
    private MockMvc mvc;

    @MockBean
    private ExtractionPipeline pipeline;

    @MockBean
    private PageParserRegistry parsers;

    @Test
    void testRunAppliesOverrides() throws Exception {
        RunSummary summary = new RunSummary(1, 2, 1, List.of(), Map.of(MATCHES, TargetState.PARSED), false);
        when(pipeline.run(anyList(), any(RunOptions.class), any(CancellationSignal.class)))
                .thenReturn(new RunResult(List.of(), summary, OutputFormat.TABLE,
                        List.of(Map.of("id", "match:353177"))));

        mvc.perform(post("/api/extraction/runs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "entryPoints": [
                                    { "path": "/event/matches/2095/champions-tour-2024-americas-stage-2", "pages": 2 }
                                  ],
                                  "retryLimit": 5,
                                  "maxConcurrency": 2,
                                  "fetchDetails": false,
                                  "conflictPolicy": "LAST_SEEN"
                                }
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.summary.totalFetched").value(1))
                .andExpect(jsonPath("$.summary.incompleteCount").value(1))
                .andExpect(jsonPath("$.format").value("TABLE"))
                .andExpect(jsonPath("$.rows[0].id").value("match:353177"))
                .andExpect(jsonPath("$.records").doesNotExist());

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<EntryPoint>> entries = ArgumentCaptor.forClass(List.class);
        ArgumentCaptor<RunOptions> options = ArgumentCaptor.forClass(RunOptions.class);
        verify(pipeline).run(entries.capture(), options.capture(), any(CancellationSignal.class));
        assertEquals(List.of(new EntryPoint("/event/matches/2095/champions-tour-2024-americas-stage-2",
                PageTemplate.MATCH_LISTING, 2)), entries.getValue());
        assertEquals(5, options.getValue().fetchPolicy().retryLimit());
        assertEquals(2, options.getValue().maxConcurrency());
        assertEquals(false, options.getValue().fetchDetails());
        assertEquals(ConflictPolicy.LAST_SEEN, options.getValue().conflictPolicy());
    }

    @Test
    void testInvalidOptionsAreRejected() throws Exception {
        mvc.perform(post("/api/extraction/runs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"maxConcurrency\": 0, \"retryLimit\": 11}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("BAD_REQUEST"))
                .andExpect(jsonPath("$.details.length()").value(2));

        verify(pipeline, never()).run(anyList(), any(RunOptions.class), any(CancellationSignal.class));
    }

    @Test
    void testDetailTemplateIsNotAnEntryPoint() throws Exception {
        mvc.perform(post("/api/extraction/runs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"entryPoints\": [{\"path\": \"/353177/x\", \"template\": \"MATCH_DETAIL\"}]}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void testRunWithoutDataIsBadGateway() throws Exception {
        RunSummary summary = new RunSummary(0, 0, 0,
                List.of(new RunError(MATCHES, "TIMEOUT", "TIMEOUT for " + MATCHES + ": no response")),
                Map.of(MATCHES, TargetState.FAILED), false);
        when(pipeline.run(anyList(), any(RunOptions.class), any(CancellationSignal.class)))
                .thenThrow(new NoDataExtractedException(summary));

        mvc.perform(post("/api/extraction/runs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.error").value("NO_DATA_EXTRACTED"))
                .andExpect(jsonPath("$.summary.errors[0].kind").value("TIMEOUT"));
    }

    @Test
    void testTemplatesListing() throws Exception {
        when(parsers.templates()).thenReturn(EnumSet.of(PageTemplate.MATCH_DETAIL, PageTemplate.MATCH_LISTING));

        mvc.perform(get("/api/extraction/templates"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].key").value("match-listing"))
                .andExpect(jsonPath("$[1].key").value("match-detail"))
                .andExpect(jsonPath("$[1].defaultRenderMode").value("BROWSER"))
                .andExpect(jsonPath("$[1].pageType").value("DETAIL"));
    }
}
