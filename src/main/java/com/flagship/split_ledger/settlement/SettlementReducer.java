package com.flagship.split_ledger.settlement;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Reduces net balances to a list of point-to-point transfers.
 *
 * Greedy matching: creditors and debtors are each sorted by amount, largest
 * first (stable, so equal amounts keep input order). The largest remaining
 * debtor pays the largest remaining creditor the smaller of the two amounts,
 * and whichever side is exhausted advances. At most
 * {@code debtors + creditors - 1} transfers are produced.
 *
 * This is a heuristic. It does not search for the minimum number of transfers.
 *
 * Balances within epsilon of zero are treated as settled. Never throws.
 */
@Service
@Slf4j
public class SettlementReducer {

    public static final double DEFAULT_EPSILON = 1e-6;

    private final double defaultEpsilon;

    @Autowired
    public SettlementReducer(@Value("${settlement.epsilon:1e-6}") double defaultEpsilon) {
        this.defaultEpsilon = defaultEpsilon;
    }

    public SettlementReducer() {
        this(DEFAULT_EPSILON);
    }

    public double getDefaultEpsilon() {
        return defaultEpsilon;
    }

    public List<Transfer> settle(Map<String, Double> net) {
        return settle(net, defaultEpsilon);
    }

    /**
     * Computes settlement transfers.
     *
     * @param net balance per participant; positive is owed money, negative owes money
     * @param epsilon tolerance below which a balance or transfer is ignored
     * @return transfers in the order they were matched
     */
    public List<Transfer> settle(Map<String, Double> net, double epsilon) {
        List<Position> creditors = new ArrayList<>();
        List<Position> debtors = new ArrayList<>();
        for (Map.Entry<String, Double> entry : net.entrySet()) {
            Double balance = entry.getValue();
            if (balance == null) {
                continue;
            }
            if (balance > epsilon) {
                creditors.add(new Position(entry.getKey(), balance));
            } else if (balance < -epsilon) {
                debtors.add(new Position(entry.getKey(), -balance));
            }
        }

        // List.sort is stable: ties keep input order
        Comparator<Position> largestFirst = Comparator.comparingDouble((Position p) -> p.remaining).reversed();
        creditors.sort(largestFirst);
        debtors.sort(largestFirst);

        List<Transfer> transfers = new ArrayList<>();
        int i = 0;
        int j = 0;
        while (i < debtors.size() && j < creditors.size()) {
            Position debtor = debtors.get(i);
            Position creditor = creditors.get(j);

            double amount = Math.min(debtor.remaining, creditor.remaining);
            if (amount > epsilon) {
                transfers.add(new Transfer(debtor.participant, creditor.participant, amount));
            }
            debtor.remaining -= amount;
            creditor.remaining -= amount;

            if (debtor.remaining <= epsilon) {
                i++;
            }
            if (creditor.remaining <= epsilon) {
                j++;
            }
        }

        log.debug("Settlement computed: creditors={}, debtors={}, transfers={}, epsilon={}",
                creditors.size(), debtors.size(), transfers.size(), epsilon);
        return List.copyOf(transfers);
    }

    private static final class Position {
        private final String participant;
        private double remaining;

        private Position(String participant, double remaining) {
            this.participant = participant;
            this.remaining = remaining;
        }
    }
}
