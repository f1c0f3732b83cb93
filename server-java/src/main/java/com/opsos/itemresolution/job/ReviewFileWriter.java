package com.opsos.itemresolution.job;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.opsos.itemresolution.exception.ResolutionJobException;
import com.opsos.itemresolution.matching.ConfidenceBucket;
import com.opsos.itemresolution.service.SuggestionService.SuggestionGroup;
import com.opsos.itemresolution.service.SuggestionService.SuggestionReport;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Writes the grouped suggestion file a reviewer works through, biggest groups first.
 */
@Component
public class ReviewFileWriter {

    static final Comparator<SuggestionGroup> REVIEW_ORDER = Comparator
            .comparingInt(SuggestionGroup::lineCount).reversed()
            .thenComparing(SuggestionGroup::vendorId, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(SuggestionGroup::normalizedDescription);

    private final ObjectMapper objectMapper;

    public ReviewFileWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Path write(SuggestionReport report, Path output) {
        List<SuggestionGroup> ordered = report.groups().stream()
                .sorted(REVIEW_ORDER)
                .collect(Collectors.toList());

        Map<String, Object> totals = new LinkedHashMap<>();
        totals.put("lines_scanned", report.linesScanned());
        totals.put("parse_failures", report.parseFailures());
        totals.put("groups", ordered.size());
        totals.put("lines_grouped", ordered.stream().mapToInt(SuggestionGroup::lineCount).sum());
        for (Map.Entry<ConfidenceBucket, Long> entry : report.groupsByBucket().entrySet()) {
            totals.put(entry.getKey().code(), entry.getValue());
        }

        Map<String, Object> document = new LinkedHashMap<>();
        document.put("generated_at", LocalDateTime.now().toString());
        document.put("totals", totals);
        document.put("groups", ordered);

        try {
            Path parent = output.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(output.toFile(), document);
            return output;
        } catch (IOException e) {
            throw new ResolutionJobException("Could not write review file " + output, e);
        }
    }
}
