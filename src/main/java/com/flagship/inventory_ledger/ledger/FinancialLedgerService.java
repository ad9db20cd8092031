package com.flagship.inventory_ledger.ledger;

import com.flagship.inventory_ledger.common.Money;
import com.flagship.inventory_ledger.common.PageRequests;
import com.flagship.inventory_ledger.common.SqlConditions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Append-only debit/credit log per counterparty.
 *
 * Balances are derived from the rows, never stored. Rows are written in the
 * caller's transaction and removed only as part of deleting the invoice,
 * payment or expense they belong to.
 *
 * Uses JDBC directly; the database check constraint enforces that each row
 * is either a debit or a credit.
 */
@Service
@Slf4j
public class FinancialLedgerService {

    private static final String COLUMNS =
        "id, counterparty_id, reference_type, reference_id, debit, credit, created_at";

    private final JdbcTemplate jdbcTemplate;

    public FinancialLedgerService(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public FinancialLedgerEntry debit(String counterpartyId, FinancialReferenceType type,
                                      String referenceId, BigDecimal amount) {
        return post(counterpartyId, type, referenceId, Money.requirePositive(amount, "Debit amount"), Money.ZERO);
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public FinancialLedgerEntry credit(String counterpartyId, FinancialReferenceType type,
                                       String referenceId, BigDecimal amount) {
        return post(counterpartyId, type, referenceId, Money.ZERO, Money.requirePositive(amount, "Credit amount"));
    }

    private FinancialLedgerEntry post(String counterpartyId, FinancialReferenceType type, String referenceId,
                                      BigDecimal debit, BigDecimal credit) {
        if (counterpartyId == null || type == null || referenceId == null) {
            throw new IllegalArgumentException("Counterparty, reference type and reference id are required");
        }
        Instant now = Instant.now().truncatedTo(ChronoUnit.MICROS);

        Long id = jdbcTemplate.queryForObject(
            "INSERT INTO financial_ledger (counterparty_id, reference_type, reference_id, debit, credit, created_at) " +
            "VALUES (?, ?, ?, ?, ?, ?) RETURNING id",
            Long.class,
            counterpartyId, type.name(), referenceId, debit, credit, now.atOffset(ZoneOffset.UTC));

        log.debug("Financial ledger row {}: counterparty={}, ref={}:{}, debit={}, credit={}",
                id, counterpartyId, type, referenceId, debit, credit);
        return new FinancialLedgerEntry(id, counterpartyId, type, referenceId, debit, credit, now);
    }

    /**
     * Removes every row whose reference id matches, whatever its type.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public int deleteByReference(String referenceId) {
        int removed = jdbcTemplate.update("DELETE FROM financial_ledger WHERE reference_id = ?", referenceId);
        log.debug("Removed {} financial rows for reference {}", removed, referenceId);
        return removed;
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public int deleteByReference(FinancialReferenceType type, String referenceId) {
        int removed = jdbcTemplate.update(
            "DELETE FROM financial_ledger WHERE reference_type = ? AND reference_id = ?",
            type.name(), referenceId);
        log.debug("Removed {} financial rows for {}:{}", removed, type, referenceId);
        return removed;
    }

    @Transactional(readOnly = true)
    public List<FinancialLedgerEntry> findByReference(String referenceId) {
        return jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM financial_ledger WHERE reference_id = ? ORDER BY id",
            rowMapper(), referenceId);
    }

    @Transactional(readOnly = true)
    public List<FinancialLedgerEntry> findByCounterparty(String counterpartyId) {
        return jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM financial_ledger WHERE counterparty_id = ? ORDER BY id",
            rowMapper(), counterpartyId);
    }

    @Transactional(readOnly = true)
    public LedgerBalance getBalance(String counterpartyId) {
        return jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(debit), 0) AS total_debit, COALESCE(SUM(credit), 0) AS total_credit " +
            "FROM financial_ledger WHERE counterparty_id = ?",
            (rs, rowNum) -> new LedgerBalance(counterpartyId,
                Money.of(rs.getBigDecimal("total_debit")),
                Money.of(rs.getBigDecimal("total_credit"))),
            counterpartyId);
    }

    @Transactional(readOnly = true)
    public FinancialLedgerPage query(FinancialLedgerQuery query) {
        PageRequests.validate(query.getOffset(), query.getLimit());

        StringBuilder where = new StringBuilder(" WHERE 1 = 1");
        List<Object> params = new ArrayList<>();
        if (query.getCounterpartyId() != null) {
            where.append(" AND counterparty_id = ?");
            params.add(query.getCounterpartyId());
        }
        if (query.getReferenceType() != null) {
            where.append(" AND reference_type = ?");
            params.add(query.getReferenceType().name());
        }
        SqlConditions.appendSearch(where, params, query.getSearch(), "reference_type", "reference_id", "counterparty_id");
        SqlConditions.appendDateRange(where, params, query.getFromDate(), query.getToDate());

        Long count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM financial_ledger" + where, Long.class, params.toArray());
        LedgerBalance totals = jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(debit), 0) AS total_debit, COALESCE(SUM(credit), 0) AS total_credit " +
            "FROM financial_ledger" + where,
            (rs, rowNum) -> new LedgerBalance(query.getCounterpartyId(),
                Money.of(rs.getBigDecimal("total_debit")),
                Money.of(rs.getBigDecimal("total_credit"))),
            params.toArray());

        List<Object> pageParams = new ArrayList<>(params);
        pageParams.add(query.getLimit());
        pageParams.add(query.getOffset());
        List<FinancialLedgerEntry> entries = jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM financial_ledger" + where + " ORDER BY created_at DESC, id DESC LIMIT ? OFFSET ?",
            rowMapper(), pageParams.toArray());

        return new FinancialLedgerPage(entries, count == null ? 0 : count,
                totals.getTotalDebit(), totals.getTotalCredit(), query.getOffset(), query.getLimit());
    }

    private RowMapper<FinancialLedgerEntry> rowMapper() {
        return (rs, rowNum) -> new FinancialLedgerEntry(
            rs.getLong("id"),
            rs.getString("counterparty_id"),
            FinancialReferenceType.valueOf(rs.getString("reference_type")),
            rs.getString("reference_id"),
            rs.getBigDecimal("debit"),
            rs.getBigDecimal("credit"),
            rs.getObject("created_at", OffsetDateTime.class).toInstant()
        );
    }
}
