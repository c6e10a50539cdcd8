package com.flagship.split_ledger.report.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.split_ledger.ledger.Ledger;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.LinkedHashSet;
import java.util.List;

/**
 * Wire form of a complete ledger, carried in every request since nothing is
 * stored between requests.
 */
@Value
@Builder
@Jacksonized
public class LedgerSnapshot {

    @JsonProperty("version")
    Integer version;

    @NotNull(message = "Participants are required")
    @JsonProperty("people")
    List<@NotBlank(message = "Participant name must not be blank") String> participants;

    @Valid
    @JsonProperty("cards")
    List<InstrumentDto> instruments;

    @Valid
    @JsonProperty("expenses")
    List<ExpenseDto> expenses;

    @JsonProperty("apply_cashback_as_discount")
    Boolean applyCashbackAsDiscount;

    /**
     * Converts to the domain ledger. Duplicate participant names collapse to
     * their first occurrence.
     */
    public Ledger toDomain() {
        Ledger.LedgerBuilder builder = Ledger.builder()
            .version(version != null ? version : Ledger.CURRENT_VERSION)
            .participants(new LinkedHashSet<>(participants))
            .applyCashbackAsDiscount(applyCashbackAsDiscount == null || applyCashbackAsDiscount);
        if (instruments != null) {
            instruments.forEach(instrument -> builder.instrument(instrument.toDomain()));
        }
        if (expenses != null) {
            expenses.forEach(expense -> builder.expense(expense.toDomain()));
        }
        return builder.build();
    }

    public static LedgerSnapshot from(Ledger ledger) {
        return LedgerSnapshot.builder()
            .version(ledger.getVersion())
            .participants(ledger.getParticipants())
            .instruments(ledger.getInstruments().stream().map(InstrumentDto::from).toList())
            .expenses(ledger.getExpenses().stream().map(ExpenseDto::from).toList())
            .applyCashbackAsDiscount(ledger.isApplyCashbackAsDiscount())
            .build();
    }
}
