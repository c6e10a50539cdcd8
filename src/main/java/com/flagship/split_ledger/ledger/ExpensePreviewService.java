package com.flagship.split_ledger.ledger;

import com.flagship.split_ledger.allocation.AllocationNormalizer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Computes what a draft record would contribute: cashback, split base and
 * the cost borne by each current participant.
 */
@Service
@RequiredArgsConstructor
public class ExpensePreviewService {

    private final AllocationNormalizer normalizer;

    public ExpensePreview preview(Ledger ledger, double amount, String instrument,
                                  Map<String, Double> allocations) {
        double rate = ledger.cashbackRateOf(instrument);
        boolean discount = ledger.isApplyCashbackAsDiscount();
        double base = LedgerAggregator.splitBase(amount, rate, discount);

        Map<String, Double> shares = normalizer.normalize(allocations, ledger.getParticipants());
        Map<String, Double> costs = new LinkedHashMap<>();
        shares.forEach((participant, share) -> costs.put(participant, base * share));

        return ExpensePreview.builder()
            .amount(amount)
            .cashbackRate(rate)
            .cashback(LedgerAggregator.cashbackOf(amount, rate))
            .multiplier(discount ? 1.0 - rate : 1.0)
            .splitBase(base)
            .shares(shares)
            .costs(Collections.unmodifiableMap(costs))
            .build();
    }
}
