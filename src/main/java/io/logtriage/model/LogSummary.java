package io.logtriage.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record LogSummary(
        @JsonProperty("total_entries") int totalEntries,
        @JsonProperty("entries_by_level") Map<LogLevel, Integer> entriesByLevel,
        @JsonProperty("entries_by_service") Map<String, Integer> entriesByService,
        @JsonProperty("known_services") List<String> knownServices,
        @JsonProperty("first_timestamp") String firstTimestamp,
        @JsonProperty("last_timestamp") String lastTimestamp,
        @JsonProperty("unparseable_timestamps") int unparseableTimestamps
) {
    public LogSummary {
        entriesByLevel = entriesByLevel == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(entriesByLevel));
        entriesByService = entriesByService == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(entriesByService));
        knownServices = knownServices == null ? List.of() : List.copyOf(knownServices);
    }
}
