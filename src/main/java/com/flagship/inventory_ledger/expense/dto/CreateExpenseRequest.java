package com.flagship.inventory_ledger.expense.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.LocalDate;

@Value
@Builder
@Jacksonized
public class CreateExpenseRequest {

    @NotBlank(message = "Counterparty ID is required")
    @JsonProperty("counterparty_id")
    String counterpartyId;

    @NotBlank(message = "Account ID is required")
    @JsonProperty("account_id")
    String accountId;

    @NotBlank(message = "Name is required")
    @Size(max = 255)
    @JsonProperty("name")
    String name;

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0.01", message = "Amount must be at least 0.01")
    @JsonProperty("amount")
    BigDecimal amount;

    @NotBlank(message = "Category is required")
    @Size(max = 100)
    @JsonProperty("category")
    String category;

    @Size(max = 1000)
    @JsonProperty("description")
    String description;

    @JsonProperty("expense_date")
    LocalDate expenseDate;
}
