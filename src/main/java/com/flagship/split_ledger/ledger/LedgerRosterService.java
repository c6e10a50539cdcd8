package com.flagship.split_ledger.ledger;

import com.flagship.split_ledger.allocation.AllocationNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Changes to a ledger's participants and instruments.
 *
 * Every operation returns a new ledger; the input is never modified.
 * Whenever the participant set changes, every record's allocations are
 * renormalized against the new set, so stored shares always cover exactly
 * the current participants.
 *
 * Invalid commands (blank or duplicate names, unknown names, rates outside
 * [0, 1]) are rejected with {@link IllegalArgumentException}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerRosterService {

    private final AllocationNormalizer normalizer;

    public Ledger addParticipant(Ledger ledger, String name) {
        String participant = requireName(name, "Participant name");
        if (ledger.hasParticipant(participant)) {
            throw new IllegalArgumentException("Participant already exists: " + participant);
        }

        List<String> participants = new ArrayList<>(ledger.getParticipants());
        participants.add(participant);

        log.info("Participant added: participant={}, participants={}", participant, participants.size());
        return renormalized(ledger, participants);
    }

    /**
     * Removes a participant and drops their raw share from every record.
     * Records they paid for are kept; their paid amounts stop counting
     * towards any participant.
     */
    public Ledger removeParticipant(Ledger ledger, String name) {
        if (!ledger.hasParticipant(name)) {
            throw new IllegalArgumentException("Participant not found: " + name);
        }

        List<String> participants = new ArrayList<>(ledger.getParticipants());
        participants.remove(name);

        log.info("Participant removed: participant={}, participants={}", name, participants.size());
        return renormalized(ledger, participants);
    }

    public Ledger addInstrument(Ledger ledger, String name, double cashbackRate) {
        String instrumentName = requireName(name, "Instrument name");
        if (ledger.hasInstrument(instrumentName)) {
            throw new IllegalArgumentException("Instrument already exists: " + instrumentName);
        }
        requireRate(cashbackRate);

        log.info("Instrument added: instrument={}, cashbackRate={}", instrumentName, cashbackRate);
        return ledger.toBuilder()
            .instrument(new Instrument(instrumentName, cashbackRate))
            .build();
    }

    /**
     * Renames and/or re-rates an instrument. Records charged to the old name
     * follow the rename.
     */
    public Ledger updateInstrument(Ledger ledger, String currentName, String newName, double cashbackRate) {
        if (!ledger.hasInstrument(currentName)) {
            throw new IllegalArgumentException("Instrument not found: " + currentName);
        }
        String instrumentName = requireName(newName, "Instrument name");
        if (!instrumentName.equals(currentName) && ledger.hasInstrument(instrumentName)) {
            throw new IllegalArgumentException("Instrument already exists: " + instrumentName);
        }
        requireRate(cashbackRate);

        List<Instrument> instruments = new ArrayList<>();
        for (Instrument instrument : ledger.getInstruments()) {
            instruments.add(Objects.equals(instrument.getName(), currentName)
                ? new Instrument(instrumentName, cashbackRate)
                : instrument);
        }
        List<ExpenseRecord> expenses = new ArrayList<>();
        for (ExpenseRecord record : ledger.getExpenses()) {
            expenses.add(currentName.equals(record.getInstrument())
                ? record.withInstrument(instrumentName)
                : record);
        }

        log.info("Instrument updated: instrument={}, newName={}, cashbackRate={}",
                currentName, instrumentName, cashbackRate);
        return ledger.toBuilder()
            .clearInstruments()
            .instruments(instruments)
            .clearExpenses()
            .expenses(expenses)
            .build();
    }

    /**
     * Removes an instrument. Records keep the historical name and from now on
     * earn no cashback.
     */
    public Ledger removeInstrument(Ledger ledger, String name) {
        if (!ledger.hasInstrument(name)) {
            throw new IllegalArgumentException("Instrument not found: " + name);
        }

        List<Instrument> instruments = ledger.getInstruments().stream()
            .filter(instrument -> !Objects.equals(instrument.getName(), name))
            .toList();

        log.info("Instrument removed: instrument={}", name);
        return ledger.toBuilder()
            .clearInstruments()
            .instruments(instruments)
            .build();
    }

    private Ledger renormalized(Ledger ledger, List<String> participants) {
        List<ExpenseRecord> expenses = new ArrayList<>();
        for (ExpenseRecord record : ledger.getExpenses()) {
            Map<String, Double> raw = new LinkedHashMap<>(record.getAllocations());
            raw.keySet().retainAll(participants);
            expenses.add(record.withAllocations(normalizer.normalize(raw, participants)));
        }
        return ledger.toBuilder()
            .clearParticipants()
            .participants(participants)
            .clearExpenses()
            .expenses(expenses)
            .build();
    }

    private static String requireName(String name, String label) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException(label + " is required");
        }
        return name.strip();
    }

    private static void requireRate(double cashbackRate) {
        if (Double.isNaN(cashbackRate) || cashbackRate < 0.0 || cashbackRate > 1.0) {
            throw new IllegalArgumentException("Cashback rate must be between 0 and 1: " + cashbackRate);
        }
    }
}
