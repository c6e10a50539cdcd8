package com.flagship.split_ledger.report.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.split_ledger.ledger.Instrument;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class InstrumentDto {

    @NotBlank(message = "Instrument name is required")
    @JsonProperty("name")
    String name;

    @NotNull(message = "Cashback rate is required")
    @DecimalMin(value = "0.0", message = "Cashback rate must be between 0 and 1")
    @DecimalMax(value = "1.0", message = "Cashback rate must be between 0 and 1")
    @JsonProperty("cashback_rate")
    Double cashbackRate;

    public Instrument toDomain() {
        return new Instrument(name, cashbackRate);
    }

    public static InstrumentDto from(Instrument instrument) {
        return InstrumentDto.builder()
            .name(instrument.getName())
            .cashbackRate(instrument.getCashbackRate())
            .build();
    }
}
