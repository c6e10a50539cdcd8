package com.flagship.split_ledger.report.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;

@Value
@Builder
@Jacksonized
public class AllocationPreviewRequest {

    @NotNull(message = "Participants are required")
    @JsonProperty("people")
    List<@NotBlank(message = "Participant names must not be blank") String> participants;

    @JsonProperty("allocations")
    Map<String, Double> allocations;
}
