package com.flagship.inventory_ledger.party;

import com.flagship.inventory_ledger.party.dto.AccountResponse;
import com.flagship.inventory_ledger.party.dto.CounterpartyResponse;
import com.flagship.inventory_ledger.party.dto.CreateAccountRequest;
import com.flagship.inventory_ledger.party.dto.CreateCounterpartyRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class PartyController {

    private final PartyService partyService;

    @PostMapping("/counterparties")
    public ResponseEntity<CounterpartyResponse> createCounterparty(@Valid @RequestBody CreateCounterpartyRequest request) {
        Counterparty created = partyService.createCounterparty(request.getName(), request.getRole());
        return ResponseEntity.status(HttpStatus.CREATED).body(CounterpartyResponse.from(created));
    }

    @GetMapping("/counterparties/{id}")
    public CounterpartyResponse getCounterparty(@PathVariable("id") String id) {
        return CounterpartyResponse.from(partyService.getCounterparty(id));
    }

    @GetMapping("/counterparties")
    public List<CounterpartyResponse> listCounterparties(
            @RequestParam(name = "role", defaultValue = "SUPPLIER") CounterpartyRole role) {
        return partyService.listByRole(role).stream().map(CounterpartyResponse::from).toList();
    }

    @PostMapping("/accounts")
    public ResponseEntity<AccountResponse> createAccount(@Valid @RequestBody CreateAccountRequest request) {
        PaymentAccount created = partyService.createAccount(request.getName(), request.getAccountType());
        return ResponseEntity.status(HttpStatus.CREATED).body(AccountResponse.from(created));
    }

    @GetMapping("/accounts")
    public List<AccountResponse> listAccounts() {
        return partyService.listAccounts().stream().map(AccountResponse::from).toList();
    }
}
