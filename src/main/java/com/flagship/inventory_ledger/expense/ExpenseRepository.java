package com.flagship.inventory_ledger.expense;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.LocalDate;

@Repository
interface ExpenseRepository extends JpaRepository<ExpenseEntity, String>, JpaSpecificationExecutor<ExpenseEntity> {

    @Query("SELECT COALESCE(SUM(e.amount), 0) FROM ExpenseEntity e WHERE e.expenseDate = :date")
    BigDecimal sumAmountByDate(@Param("date") LocalDate date);

    long countByExpenseDate(LocalDate expenseDate);
}
