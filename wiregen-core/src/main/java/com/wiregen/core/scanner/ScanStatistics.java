package com.wiregen.core.scanner;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Statistics collected while extracting metadata from a snapshot.
 *
 * <p>Gives visibility into how much of the input could be analysed; files and types that
 * failed are also reported as diagnostics.
 *
 * @param filesScanned source units examined
 * @param filesParsed source units parsed successfully
 * @param filesFailed source units that could not be parsed
 * @param typesExtracted type declarations turned into descriptors
 * @param typesFailed type declarations skipped because extraction failed
 * @param errorCounts error category to number of occurrences
 * @param topErrors first error details (at most {@value #MAX_TOP_ERRORS})
 */
public record ScanStatistics(
    int filesScanned,
    int filesParsed,
    int filesFailed,
    int typesExtracted,
    int typesFailed,
    Map<String, Integer> errorCounts,
    List<String> topErrors
) {
    public static final int MAX_TOP_ERRORS = 10;

    public ScanStatistics {
        errorCounts = errorCounts == null ? Map.of() : Map.copyOf(errorCounts);
        topErrors = topErrors == null ? List.of() : List.copyOf(topErrors);
    }

    public static ScanStatistics empty() {
        return new ScanStatistics(0, 0, 0, 0, 0, Map.of(), List.of());
    }

    /**
     * Share of scanned files that parsed, as a percentage. 100 when nothing was scanned.
     */
    public double getParseSuccessRate() {
        if (filesScanned == 0) {
            return 100.0;
        }
        return (filesParsed * 100.0) / filesScanned;
    }

    public boolean hasFailures() {
        return filesFailed > 0 || typesFailed > 0;
    }

    /**
     * Mutable builder used during one extraction.
     */
    public static class Builder {
        private int filesScanned;
        private int filesParsed;
        private int filesFailed;
        private int typesExtracted;
        private int typesFailed;
        private final Map<String, Integer> errorCounts = new HashMap<>();
        private final List<String> topErrors = new ArrayList<>();

        public Builder incrementFilesScanned() {
            filesScanned++;
            return this;
        }

        public Builder incrementFilesParsed() {
            filesParsed++;
            return this;
        }

        public Builder incrementFilesFailed() {
            filesFailed++;
            return this;
        }

        public Builder incrementTypesExtracted() {
            typesExtracted++;
            return this;
        }

        public Builder incrementTypesFailed() {
            typesFailed++;
            return this;
        }

        public Builder addError(String errorType, String errorDetail) {
            errorCounts.merge(errorType, 1, Integer::sum);
            if (topErrors.size() < MAX_TOP_ERRORS) {
                topErrors.add(errorDetail);
            }
            return this;
        }

        public ScanStatistics build() {
            return new ScanStatistics(filesScanned, filesParsed, filesFailed, typesExtracted, typesFailed,
                errorCounts, topErrors);
        }
    }
}
