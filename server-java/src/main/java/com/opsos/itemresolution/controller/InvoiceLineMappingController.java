package com.opsos.itemresolution.controller;

import com.opsos.itemresolution.config.ResolutionSettings;
import com.opsos.itemresolution.dto.MapInvoiceLineRequest;
import com.opsos.itemresolution.exception.InvoiceLockedException;
import com.opsos.itemresolution.exception.RecordNotFoundException;
import com.opsos.itemresolution.matching.ConfidenceBucket;
import com.opsos.itemresolution.model.InvoiceLine;
import com.opsos.itemresolution.service.InvoiceLineMappingService;
import com.opsos.itemresolution.service.ResolutionContext;
import com.opsos.itemresolution.service.SuggestionService;
import com.opsos.itemresolution.service.SuggestionService.SuggestionGroup;
import com.opsos.itemresolution.service.SuggestionService.SuggestionReport;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@RestController
@RequestMapping("/api/invoice-lines")
public class InvoiceLineMappingController {

    private static final Logger logger = LoggerFactory.getLogger(InvoiceLineMappingController.class);

    private final SuggestionService suggestionService;
    private final InvoiceLineMappingService mappingService;
    private final ResolutionSettings settings;

    public InvoiceLineMappingController(SuggestionService suggestionService,
                                        InvoiceLineMappingService mappingService,
                                        ResolutionSettings settings) {
        this.suggestionService = suggestionService;
        this.mappingService = mappingService;
        this.settings = settings;
    }

    @GetMapping("/suggestions")
    public ResponseEntity<?> getSuggestions(@RequestParam(value = "org", required = false) String organizationId,
                                            @RequestParam(value = "bucket", required = false) String bucket) {
        ConfidenceBucket filter;
        try {
            filter = bucket != null ? ConfidenceBucket.valueOf(bucket.toUpperCase(Locale.ROOT)) : null;
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", "Unknown bucket: " + bucket));
        }
        try {
            SuggestionReport report = suggestionService.generateSuggestions(ResolutionContext.of(organizationId, settings));
            List<SuggestionGroup> groups = report.groups().stream()
                    .filter(group -> filter == null || group.bucket() == filter)
                    .toList();

            Map<String, Object> response = new HashMap<>();
            response.put("lines_scanned", report.linesScanned());
            response.put("parse_failures", report.parseFailures());
            response.put("groups", groups);
            return ResponseEntity.ok(response);
        } catch (Exception e) {
            logger.error("[InvoiceLineMappingController] Suggestion listing failed", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(Map.of("error", "Failed to build suggestions: " + e.getMessage()));
        }
    }

    @PostMapping("/{lineId}/map")
    public ResponseEntity<?> mapLine(@PathVariable Long lineId,
                                     @Valid @RequestBody MapInvoiceLineRequest request) {
        try {
            return ResponseEntity.ok(toResponse(mappingService.mapLine(lineId, request.getItemId())));
        } catch (RecordNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
        } catch (InvoiceLockedException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    @PostMapping("/{lineId}/unmap")
    public ResponseEntity<?> unmapLine(@PathVariable Long lineId) {
        try {
            return ResponseEntity.ok(toResponse(mappingService.unmapLine(lineId)));
        } catch (RecordNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
        } catch (InvoiceLockedException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
        }
    }

    private Map<String, Object> toResponse(InvoiceLine line) {
        Map<String, Object> map = new HashMap<>();
        map.put("id", line.getId());
        map.put("invoice_id", line.getInvoiceId());
        map.put("description", line.getDescription());
        map.put("vendor_item_code", line.getVendorItemCode());
        map.put("item_id", line.getItemId());
        return map;
    }
}
