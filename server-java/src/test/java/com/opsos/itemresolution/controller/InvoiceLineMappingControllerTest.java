package com.opsos.itemresolution.controller;

import com.opsos.itemresolution.config.ResolutionSettings;
import com.opsos.itemresolution.exception.InvoiceLockedException;
import com.opsos.itemresolution.exception.RecordNotFoundException;
import com.opsos.itemresolution.matching.ConfidenceBucket;
import com.opsos.itemresolution.model.InvoiceLine;
import com.opsos.itemresolution.service.InvoiceLineMappingService;
import com.opsos.itemresolution.service.ResolutionContext;
import com.opsos.itemresolution.service.SuggestionService;
import com.opsos.itemresolution.service.SuggestionService.SuggestionGroup;
import com.opsos.itemresolution.service.SuggestionService.SuggestionReport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class InvoiceLineMappingControllerTest {

    @Mock
    private SuggestionService suggestionService;

    @Mock
    private InvoiceLineMappingService mappingService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        InvoiceLineMappingController controller =
                new InvoiceLineMappingController(suggestionService, mappingService, ResolutionSettings.DEFAULTS);
        mockMvc = MockMvcBuilders.standaloneSetup(controller).build();
    }

    @Test
    void suggestionsFilteredByBucket() throws Exception {
        SuggestionGroup likely = new SuggestionGroup("org-1", 7L, "grey goose", "Grey Goose", null,
                List.of(), List.of(), ConfidenceBucket.LIKELY);
        SuggestionGroup unknown = new SuggestionGroup("org-1", 7L, "mystery", "Mystery", null,
                List.of(), List.of(), ConfidenceBucket.DEFINITE_NEW);
        when(suggestionService.generateSuggestions(any(ResolutionContext.class)))
                .thenReturn(new SuggestionReport(List.of(likely, unknown), 2, 0, 10));

        mockMvc.perform(get("/api/invoice-lines/suggestions").param("org", "org-1").param("bucket", "likely"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.lines_scanned").value(2))
                .andExpect(jsonPath("$.groups.length()").value(1))
                .andExpect(jsonPath("$.groups[0].normalizedDescription").value("grey goose"))
                .andExpect(jsonPath("$.groups[0].bucket").value("likely"));
    }

    @Test
    void unknownBucketIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/invoice-lines/suggestions").param("bucket", "sure-thing"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Unknown bucket: sure-thing"));

        verify(suggestionService, never()).generateSuggestions(any(ResolutionContext.class));
    }

    @Test
    void mapLineReturnsMappedLine() throws Exception {
        InvoiceLine line = new InvoiceLine();
        line.setId(11L);
        line.setInvoiceId(3L);
        line.setDescription("Lime Juice 32oz");
        line.setItemId(100L);
        when(mappingService.mapLine(11L, 100L)).thenReturn(line);

        mockMvc.perform(post("/api/invoice-lines/11/map")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"item_id\": 100}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.item_id").value(100))
                .andExpect(jsonPath("$.invoice_id").value(3));
    }

    @Test
    void mapLineWithoutItemIsRejectedBeforeService() throws Exception {
        mockMvc.perform(post("/api/invoice-lines/11/map")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest());

        verify(mappingService, never()).mapLine(any(), any());
    }

    @Test
    void lockedInvoiceIsConflict() throws Exception {
        when(mappingService.mapLine(11L, 100L)).thenThrow(new InvoiceLockedException(3L));

        mockMvc.perform(post("/api/invoice-lines/11/map")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"item_id\": 100}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("Invoice 3 is approved and locked"));
    }

    @Test
    void unmapMissingLineIsNotFound() throws Exception {
        when(mappingService.unmapLine(99L)).thenThrow(new RecordNotFoundException("Invoice line", 99L));

        mockMvc.perform(post("/api/invoice-lines/99/unmap"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Invoice line not found: 99"));
    }
}
