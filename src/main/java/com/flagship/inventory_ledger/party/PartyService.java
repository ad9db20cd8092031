package com.flagship.inventory_ledger.party;

import com.flagship.inventory_ledger.common.CodeGenerator;
import com.flagship.inventory_ledger.common.CodePrefix;
import com.flagship.inventory_ledger.exception.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Registry of counterparties and payment accounts.
 *
 * These records are owned by the surrounding ERP; the engine only needs to
 * create them for its own tests and tooling and to validate references.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PartyService {

    private final CounterpartyRepository counterpartyRepository;
    private final PaymentAccountRepository accountRepository;
    private final CodeGenerator codeGenerator;

    @Transactional
    public Counterparty createCounterparty(String name, CounterpartyRole role) {
        requireName(name);
        if (role == null) {
            throw new IllegalArgumentException("Role is required");
        }
        String id = codeGenerator.generate(role.codePrefix(), counterpartyRepository::existsById);
        Counterparty created = counterpartyRepository.save(CounterpartyEntity.create(id, name.trim(), role)).toDomain();
        log.info("Registered {} {} ({})", role, id, created.getName());
        return created;
    }

    @Transactional
    public PaymentAccount createAccount(String name, AccountType accountType) {
        requireName(name);
        if (accountType == null) {
            throw new IllegalArgumentException("Account type is required");
        }
        String id = codeGenerator.generate(CodePrefix.ACCOUNT, accountRepository::existsById);
        PaymentAccount created = accountRepository.save(PaymentAccountEntity.create(id, name.trim(), accountType)).toDomain();
        log.info("Registered payment account {} ({})", id, created.getName());
        return created;
    }

    @Transactional(readOnly = true)
    public Counterparty getCounterparty(String id) {
        return counterpartyRepository.findById(id)
                .map(CounterpartyEntity::toDomain)
                .orElseThrow(() -> new ResourceNotFoundException("Counterparty", id));
    }

    /**
     * @throws ResourceNotFoundException if the id is unknown
     * @throws IllegalArgumentException if the counterparty is not a supplier
     */
    @Transactional(readOnly = true)
    public Counterparty requireSupplier(String id) {
        Counterparty counterparty = getCounterparty(id);
        if (!counterparty.isSupplier()) {
            throw new IllegalArgumentException("Counterparty " + id + " is not a supplier");
        }
        return counterparty;
    }

    @Transactional(readOnly = true)
    public PaymentAccount requireAccount(String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Payment account id is required");
        }
        return accountRepository.findById(id)
                .map(PaymentAccountEntity::toDomain)
                .orElseThrow(() -> new ResourceNotFoundException("Payment account", id));
    }

    @Transactional(readOnly = true)
    public List<Counterparty> listByRole(CounterpartyRole role) {
        return counterpartyRepository.findByRoleOrderByNameAsc(role).stream()
                .map(CounterpartyEntity::toDomain)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<PaymentAccount> listAccounts() {
        return accountRepository.findAll().stream()
                .map(PaymentAccountEntity::toDomain)
                .toList();
    }

    private static void requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Name is required");
        }
    }
}
