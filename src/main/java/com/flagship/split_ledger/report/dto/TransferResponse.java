package com.flagship.split_ledger.report.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.split_ledger.settlement.Transfer;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class TransferResponse {

    @JsonProperty("from")
    String debtor;

    @JsonProperty("to")
    String creditor;

    @JsonProperty("amount")
    double amount;

    public static TransferResponse from(Transfer transfer) {
        return TransferResponse.builder()
            .debtor(transfer.getDebtor())
            .creditor(transfer.getCreditor())
            .amount(transfer.getAmount())
            .build();
    }
}
