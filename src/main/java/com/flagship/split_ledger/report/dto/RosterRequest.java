package com.flagship.split_ledger.report.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Request DTO for participant and instrument changes.
 *
 * Name and cashback rate are only read by the operations that need them;
 * the services validate them.
 */
@Value
@Builder
@Jacksonized
public class RosterRequest {

    @Valid
    @NotNull(message = "Ledger is required")
    @JsonProperty("ledger")
    LedgerSnapshot ledger;

    @JsonProperty("name")
    String name;

    @JsonProperty("cashback_rate")
    Double cashbackRate;
}
