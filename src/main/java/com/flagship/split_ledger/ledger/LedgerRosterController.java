package com.flagship.split_ledger.ledger;

import com.flagship.split_ledger.observability.LedgerMetrics;
import com.flagship.split_ledger.report.dto.LedgerSnapshot;
import com.flagship.split_ledger.report.dto.RosterRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.function.UnaryOperator;

/**
 * REST controller for participant and instrument changes.
 *
 * Takes a ledger snapshot and returns the updated snapshot, with every
 * record's allocations renormalized when the participant set changed.
 */
@RestController
@RequestMapping("/api/ledgers")
@RequiredArgsConstructor
@Slf4j
public class LedgerRosterController {

    private final LedgerRosterService rosterService;
    private final LedgerMetrics metrics;

    @PostMapping("/participants")
    public ResponseEntity<LedgerSnapshot> addParticipant(@Valid @RequestBody RosterRequest request) {
        return apply("add_participant", request,
            ledger -> rosterService.addParticipant(ledger, request.getName()));
    }

    @DeleteMapping("/participants/{name}")
    public ResponseEntity<LedgerSnapshot> removeParticipant(@PathVariable("name") String name,
                                                            @Valid @RequestBody RosterRequest request) {
        return apply("remove_participant", request,
            ledger -> rosterService.removeParticipant(ledger, name));
    }

    @PostMapping("/instruments")
    public ResponseEntity<LedgerSnapshot> addInstrument(@Valid @RequestBody RosterRequest request) {
        return apply("add_instrument", request,
            ledger -> rosterService.addInstrument(ledger, request.getName(), rateOf(request)));
    }

    /**
     * Updates an instrument. A blank or missing name in the body keeps the current name.
     */
    @PutMapping("/instruments/{name}")
    public ResponseEntity<LedgerSnapshot> updateInstrument(@PathVariable("name") String name,
                                                           @Valid @RequestBody RosterRequest request) {
        String newName = request.getName() == null || request.getName().isBlank() ? name : request.getName();
        return apply("update_instrument", request,
            ledger -> rosterService.updateInstrument(ledger, name, newName, rateOf(request)));
    }

    @DeleteMapping("/instruments/{name}")
    public ResponseEntity<LedgerSnapshot> removeInstrument(@PathVariable("name") String name,
                                                           @Valid @RequestBody RosterRequest request) {
        return apply("remove_instrument", request,
            ledger -> rosterService.removeInstrument(ledger, name));
    }

    private ResponseEntity<LedgerSnapshot> apply(String operation, RosterRequest request,
                                                 UnaryOperator<Ledger> change) {
        try {
            Ledger updated = change.apply(request.getLedger().toDomain());
            metrics.recordRosterChange(operation, "success");
            return ResponseEntity.ok(LedgerSnapshot.from(updated));
        } catch (IllegalArgumentException e) {
            metrics.recordRosterChange(operation, "rejected");
            log.warn("Roster change rejected: operation={}, error={}", operation, e.getMessage());
            throw e;
        }
    }

    private static double rateOf(RosterRequest request) {
        if (request.getCashbackRate() == null) {
            throw new IllegalArgumentException("Cashback rate is required");
        }
        return request.getCashbackRate();
    }
}
