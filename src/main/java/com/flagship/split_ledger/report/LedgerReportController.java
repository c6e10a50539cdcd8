package com.flagship.split_ledger.report;

import com.flagship.split_ledger.allocation.AllocationNormalizer;
import com.flagship.split_ledger.ledger.ExpensePreview;
import com.flagship.split_ledger.ledger.ExpensePreviewService;
import com.flagship.split_ledger.report.dto.AllocationPreviewRequest;
import com.flagship.split_ledger.report.dto.ExpensePreviewRequest;
import com.flagship.split_ledger.report.dto.ExpensePreviewResponse;
import com.flagship.split_ledger.report.dto.LedgerReportResponse;
import com.flagship.split_ledger.report.dto.PayerStatementResponse;
import com.flagship.split_ledger.report.dto.ReportRequest;
import com.flagship.split_ledger.report.dto.SettlementRequest;
import com.flagship.split_ledger.report.dto.TransferResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * REST controller for reports and previews.
 *
 * Stateless: every request carries the ledger snapshot it is computed
 * from, and nothing is stored.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class LedgerReportController {

    private final LedgerReportService reportService;
    private final ExpensePreviewService previewService;
    private final AllocationNormalizer normalizer;

    /**
     * Summary per participant plus the transfers that settle it.
     */
    @PostMapping("/reports")
    public ResponseEntity<LedgerReportResponse> report(@Valid @RequestBody ReportRequest request) {
        log.info("Received report request: start={}, end={}, basis={}",
                request.getStart(), request.getEnd(), request.getBasis());

        LedgerReport report = reportService.generate(
            request.getLedger().toDomain(),
            request.window(),
            request.getBasis(),
            request.getEpsilon()
        );
        return ResponseEntity.ok(LedgerReportResponse.from(report));
    }

    @PostMapping("/reports/statements")
    public ResponseEntity<List<PayerStatementResponse>> statements(@Valid @RequestBody ReportRequest request) {
        List<PayerStatementResponse> statements = reportService
            .statements(request.getLedger().toDomain(), request.window())
            .stream()
            .map(PayerStatementResponse::from)
            .toList();
        return ResponseEntity.ok(statements);
    }

    /**
     * Normalized shares for a raw allocation being edited.
     */
    @PostMapping("/allocations/preview")
    public ResponseEntity<Map<String, Double>> previewAllocation(
            @Valid @RequestBody AllocationPreviewRequest request) {
        return ResponseEntity.ok(normalizer.normalize(request.getAllocations(), request.getParticipants()));
    }

    @PostMapping("/expenses/preview")
    public ResponseEntity<ExpensePreviewResponse> previewExpense(
            @Valid @RequestBody ExpensePreviewRequest request) {
        ExpensePreview preview = previewService.preview(
            request.getLedger().toDomain(),
            request.getAmount(),
            request.getInstrument(),
            request.getAllocations()
        );
        return ResponseEntity.ok(ExpensePreviewResponse.from(preview));
    }

    @PostMapping("/settlements")
    public ResponseEntity<List<TransferResponse>> settle(@Valid @RequestBody SettlementRequest request) {
        List<TransferResponse> transfers = reportService
            .settle(request.getBalances(), request.getEpsilon())
            .stream()
            .map(TransferResponse::from)
            .toList();
        return ResponseEntity.ok(transfers);
    }
}
