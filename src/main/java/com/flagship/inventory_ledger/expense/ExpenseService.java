package com.flagship.inventory_ledger.expense;

import com.flagship.inventory_ledger.common.CodeGenerator;
import com.flagship.inventory_ledger.common.CodePrefix;
import com.flagship.inventory_ledger.common.Money;
import com.flagship.inventory_ledger.common.PageRequests;
import com.flagship.inventory_ledger.common.PagedResult;
import com.flagship.inventory_ledger.exception.ResourceNotFoundException;
import com.flagship.inventory_ledger.ledger.FinancialLedgerService;
import com.flagship.inventory_ledger.ledger.FinancialReferenceType;
import com.flagship.inventory_ledger.party.PartyService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * Operating expenses. Each expense is mirrored by one EXPENSE debit on the
 * counterparty's financial ledger, referenced by the expense id.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ExpenseService {

    private final ExpenseRepository expenseRepository;
    private final FinancialLedgerService financialLedgerService;
    private final PartyService partyService;
    private final CodeGenerator codeGenerator;

    /**
     * @param expenseDate optional; defaults to today in UTC
     */
    @Transactional
    public Expense recordExpense(String counterpartyId, String accountId, String name, BigDecimal amount,
                                 String category, String description, LocalDate expenseDate) {
        BigDecimal value = Money.requirePositive(amount, "Expense amount");
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Expense name is required");
        }
        if (category == null || category.isBlank()) {
            throw new IllegalArgumentException("Expense category is required");
        }
        partyService.getCounterparty(counterpartyId);
        partyService.requireAccount(accountId);

        String id = codeGenerator.generate(CodePrefix.EXPENSE, expenseRepository::existsById);
        LocalDate date = expenseDate != null ? expenseDate : LocalDate.now(ZoneOffset.UTC);
        String text = description == null || description.isBlank() ? null : description.trim();
        Expense expense = expenseRepository.save(ExpenseEntity.create(id, name.trim(), value, accountId,
                counterpartyId, category.trim(), text, date)).toDomain();

        financialLedgerService.debit(counterpartyId, FinancialReferenceType.EXPENSE, id, value);
        log.info("Expense {} recorded: {} {} on {} for {}", id, value, expense.getCategory(), date, counterpartyId);
        return expense;
    }

    /**
     * Removes the expense and its ledger row.
     */
    @Transactional
    public void deleteExpense(String expenseId) {
        ExpenseEntity expense = expenseRepository.findById(expenseId)
                .orElseThrow(() -> new ResourceNotFoundException("Expense", expenseId));
        int rows = financialLedgerService.deleteByReference(FinancialReferenceType.EXPENSE, expenseId);
        expenseRepository.delete(expense);
        log.info("Expense {} deleted, {} ledger row(s) removed", expenseId, rows);
    }

    @Transactional(readOnly = true)
    public Expense getExpense(String expenseId) {
        return expenseRepository.findById(expenseId)
                .map(ExpenseEntity::toDomain)
                .orElseThrow(() -> new ResourceNotFoundException("Expense", expenseId));
    }

    @Transactional(readOnly = true)
    public PagedResult<Expense> listExpenses(String counterpartyId, String category, LocalDate fromDate,
                                             LocalDate toDate, String search, int offset, int limit) {
        return PageRequests.toResult(
                expenseRepository.findAll(
                        ExpenseSpecifications.filter(counterpartyId, category, fromDate, toDate, search),
                        PageRequests.of(offset, limit, Sort.by(Sort.Direction.DESC, "expenseDate", "createdAt")))
                    .map(ExpenseEntity::toDomain),
                offset, limit);
    }

    @Transactional(readOnly = true)
    public DailyExpenseTotal dailyTotal(LocalDate date) {
        LocalDate day = date != null ? date : LocalDate.now(ZoneOffset.UTC);
        return new DailyExpenseTotal(day, Money.of(expenseRepository.sumAmountByDate(day)),
                expenseRepository.countByExpenseDate(day));
    }
}
