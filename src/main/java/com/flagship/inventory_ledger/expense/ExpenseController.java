package com.flagship.inventory_ledger.expense;

import com.flagship.inventory_ledger.common.PagedResult;
import com.flagship.inventory_ledger.expense.dto.CreateExpenseRequest;
import com.flagship.inventory_ledger.expense.dto.ExpenseResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;

@RestController
@RequestMapping("/api/expenses")
@RequiredArgsConstructor
public class ExpenseController {

    private final ExpenseService expenseService;

    @PostMapping
    public ResponseEntity<ExpenseResponse> recordExpense(@Valid @RequestBody CreateExpenseRequest request) {
        Expense expense = expenseService.recordExpense(request.getCounterpartyId(), request.getAccountId(),
                request.getName(), request.getAmount(), request.getCategory(), request.getDescription(),
                request.getExpenseDate());
        return ResponseEntity.status(HttpStatus.CREATED).body(ExpenseResponse.from(expense));
    }

    @GetMapping
    public PagedResult<ExpenseResponse> listExpenses(
            @RequestParam(name = "counterparty_id", required = false) String counterpartyId,
            @RequestParam(name = "category", required = false) String category,
            @RequestParam(name = "from_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate fromDate,
            @RequestParam(name = "to_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate toDate,
            @RequestParam(name = "search", required = false) String search,
            @RequestParam(name = "offset", defaultValue = "0") int offset,
            @RequestParam(name = "limit", defaultValue = "50") int limit) {
        return expenseService.listExpenses(counterpartyId, category, fromDate, toDate, search, offset, limit)
                .map(ExpenseResponse::from);
    }

    @GetMapping("/daily-total")
    public DailyExpenseTotal dailyTotal(
            @RequestParam(name = "date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return expenseService.dailyTotal(date);
    }

    @GetMapping("/{id}")
    public ExpenseResponse getExpense(@PathVariable("id") String id) {
        return ExpenseResponse.from(expenseService.getExpense(id));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteExpense(@PathVariable("id") String id) {
        expenseService.deleteExpense(id);
        return ResponseEntity.noContent().build();
    }
}
