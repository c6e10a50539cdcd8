package com.flagship.split_ledger.report.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.split_ledger.ledger.ExpenseRecord;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;
import java.util.Map;

/**
 * Wire form of an expense record. Dates are ISO-8601 (YYYY-MM-DD).
 */
@Value
@Builder
@Jacksonized
public class ExpenseDto {

    @JsonProperty("id")
    String id;

    @NotNull(message = "Date is required")
    @JsonProperty("date")
    LocalDate date;

    @JsonProperty("payer")
    String payer;

    @JsonProperty("card")
    String instrument;

    @JsonProperty("merchant")
    String merchant;

    @JsonProperty("item")
    String item;

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0.0", message = "Amount must not be negative")
    @JsonProperty("amount")
    Double amount;

    @JsonProperty("allocations")
    Map<String, Double> allocations;

    @JsonProperty("notes")
    String notes;

    public ExpenseRecord toDomain() {
        return ExpenseRecord.builder()
            .id(id)
            .date(date)
            .payer(payer)
            .instrument(instrument)
            .merchant(merchant)
            .item(item)
            .amount(amount)
            .allocations(allocations == null ? Map.of() : allocations)
            .notes(notes == null ? "" : notes)
            .build();
    }

    public static ExpenseDto from(ExpenseRecord record) {
        return ExpenseDto.builder()
            .id(record.getId())
            .date(record.getDate())
            .payer(record.getPayer())
            .instrument(record.getInstrument())
            .merchant(record.getMerchant())
            .item(record.getItem())
            .amount(record.getAmount())
            .allocations(record.getAllocations())
            .notes(record.getNotes())
            .build();
    }
}
