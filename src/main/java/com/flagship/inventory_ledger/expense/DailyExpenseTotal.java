package com.flagship.inventory_ledger.expense;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

@Value
public class DailyExpenseTotal {

    @JsonProperty("date")
    LocalDate date;

    @JsonProperty("total_amount")
    BigDecimal totalAmount;

    @JsonProperty("count")
    long count;
}
