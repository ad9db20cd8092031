package com.flagship.inventory_ledger.ledger;

import com.flagship.inventory_ledger.ledger.dto.BalanceResponse;
import com.flagship.inventory_ledger.ledger.dto.FinancialLedgerPageResponse;
import com.flagship.inventory_ledger.party.PartyService;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;

@RestController
@RequestMapping("/api/financial-ledger")
@RequiredArgsConstructor
public class FinancialLedgerController {

    private final FinancialLedgerService ledgerService;
    private final PartyService partyService;

    @GetMapping
    public FinancialLedgerPageResponse list(
            @RequestParam(name = "counterparty_id", required = false) String counterpartyId,
            @RequestParam(name = "reference_type", required = false) FinancialReferenceType referenceType,
            @RequestParam(name = "search", required = false) String search,
            @RequestParam(name = "from_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate fromDate,
            @RequestParam(name = "to_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate toDate,
            @RequestParam(name = "offset", defaultValue = "0") int offset,
            @RequestParam(name = "limit", defaultValue = "50") int limit) {

        FinancialLedgerQuery query = FinancialLedgerQuery.builder()
            .counterpartyId(counterpartyId)
            .referenceType(referenceType)
            .search(search)
            .fromDate(fromDate)
            .toDate(toDate)
            .offset(offset)
            .limit(limit)
            .build();
        return FinancialLedgerPageResponse.from(ledgerService.query(query));
    }

    @GetMapping("/balance/{counterpartyId}")
    public BalanceResponse getBalance(@PathVariable("counterpartyId") String counterpartyId) {
        partyService.getCounterparty(counterpartyId);
        return BalanceResponse.from(ledgerService.getBalance(counterpartyId));
    }
}
