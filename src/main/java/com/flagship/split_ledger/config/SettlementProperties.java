package com.flagship.split_ledger.config;

import com.flagship.split_ledger.settlement.SettlementBasis;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Settlement defaults applied when a request does not specify them.
 */
@Component
public class SettlementProperties {

    private final SettlementBasis defaultBasis;

    public SettlementProperties(@Value("${settlement.basis:NET}") SettlementBasis defaultBasis) {
        this.defaultBasis = defaultBasis;
    }

    public SettlementBasis getDefaultBasis() {
        return defaultBasis;
    }

    public SettlementBasis resolve(SettlementBasis requested) {
        return requested != null ? requested : defaultBasis;
    }
}
