package com.flagship.inventory_ledger.stock;

import com.flagship.inventory_ledger.stock.dto.StockAdjustmentRequest;
import com.flagship.inventory_ledger.stock.dto.StockLedgerEntryResponse;
import com.flagship.inventory_ledger.stock.dto.StockLedgerPageResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;

@RestController
@RequestMapping("/api/stock-ledger")
@RequiredArgsConstructor
public class StockLedgerController {

    private final StockLedgerService stockLedgerService;
    private final StockAdjustmentService adjustmentService;

    @GetMapping
    public StockLedgerPageResponse list(
            @RequestParam(name = "item_id", required = false) String itemId,
            @RequestParam(name = "reference_type", required = false) StockReferenceType referenceType,
            @RequestParam(name = "reference_id", required = false) String referenceId,
            @RequestParam(name = "search", required = false) String search,
            @RequestParam(name = "from_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate fromDate,
            @RequestParam(name = "to_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate toDate,
            @RequestParam(name = "offset", defaultValue = "0") int offset,
            @RequestParam(name = "limit", defaultValue = "50") int limit) {

        StockLedgerQuery query = StockLedgerQuery.builder()
            .itemId(itemId)
            .referenceType(referenceType)
            .referenceId(referenceId)
            .search(search)
            .fromDate(fromDate)
            .toDate(toDate)
            .offset(offset)
            .limit(limit)
            .build();
        return StockLedgerPageResponse.from(stockLedgerService.query(query));
    }

    @PostMapping("/adjustments")
    public ResponseEntity<StockLedgerEntryResponse> adjust(@Valid @RequestBody StockAdjustmentRequest request) {
        StockLedgerEntry entry = adjustmentService.adjust(
            request.getItemId(), request.getQuantityDelta(), request.getUnitPrice(), request.getReason());
        return ResponseEntity.status(HttpStatus.CREATED).body(StockLedgerEntryResponse.from(entry));
    }
}
