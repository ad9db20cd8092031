package com.flagship.inventory_ledger.stock;

import com.flagship.inventory_ledger.common.CodeGenerator;
import com.flagship.inventory_ledger.common.CodePrefix;
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
 * Append-only log of stock movements.
 *
 * Recording a movement never touches item aggregates; callers pair each
 * entry with the matching {@code InventoryValuationService} call in the same
 * transaction. Rows are deleted only when the movement that created them is
 * being compensated, e.g. when a purchase invoice is edited or removed.
 *
 * Uses JDBC directly, like the financial ledger.
 */
@Service
@Slf4j
public class StockLedgerService {

    private static final String COLUMNS =
        "id, item_id, reference_type, reference_id, qty_in, qty_out, unit_price, note, created_at";

    private final JdbcTemplate jdbcTemplate;
    private final CodeGenerator codeGenerator;

    public StockLedgerService(JdbcTemplate jdbcTemplate, CodeGenerator codeGenerator) {
        this.jdbcTemplate = jdbcTemplate;
        this.codeGenerator = codeGenerator;
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public StockLedgerEntry recordIn(String itemId, StockReferenceType type, String referenceId,
                                     int quantity, BigDecimal unitPrice) {
        return record(itemId, type, referenceId, quantity, 0, unitPrice, null);
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public StockLedgerEntry recordOut(String itemId, StockReferenceType type, String referenceId,
                                      int quantity, BigDecimal unitPrice) {
        return record(itemId, type, referenceId, 0, quantity, unitPrice, null);
    }

    /**
     * Appends a movement.
     *
     * @throws IllegalArgumentException unless exactly one of qtyIn/qtyOut is positive
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public StockLedgerEntry record(String itemId, StockReferenceType type, String referenceId,
                                   int qtyIn, int qtyOut, BigDecimal unitPrice, String note) {
        if (qtyIn < 0 || qtyOut < 0) {
            throw new IllegalArgumentException("Movement quantities cannot be negative");
        }
        if ((qtyIn > 0) == (qtyOut > 0)) {
            throw new IllegalArgumentException(String.format(
                "Exactly one of qty_in and qty_out must be positive (qty_in=%d, qty_out=%d)", qtyIn, qtyOut));
        }
        if (type == null || referenceId == null || referenceId.isBlank()) {
            throw new IllegalArgumentException("Reference type and id are required");
        }

        String id = codeGenerator.generate(CodePrefix.STOCK_ENTRY, this::exists);
        BigDecimal price = Money.of(unitPrice);
        Instant now = Instant.now().truncatedTo(ChronoUnit.MICROS);

        jdbcTemplate.update(
            "INSERT INTO stock_ledger (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)",
            id, itemId, type.name(), referenceId, qtyIn, qtyOut, price, note, now.atOffset(ZoneOffset.UTC));

        log.debug("Stock movement {}: item={}, ref={}:{}, in={}, out={}, price={}",
                id, itemId, type, referenceId, qtyIn, qtyOut, price);
        return new StockLedgerEntry(id, itemId, type, referenceId, qtyIn, qtyOut, price, note, now);
    }

    /**
     * Removes the movements of a reference that is being compensated.
     *
     * @return number of rows removed
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public int deleteByReference(StockReferenceType type, String referenceId) {
        int removed = jdbcTemplate.update(
            "DELETE FROM stock_ledger WHERE reference_type = ? AND reference_id = ?",
            type.name(), referenceId);
        log.debug("Removed {} stock movements for {}:{}", removed, type, referenceId);
        return removed;
    }

    @Transactional(readOnly = true)
    public List<StockLedgerEntry> findByReference(StockReferenceType type, String referenceId) {
        return jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM stock_ledger WHERE reference_type = ? AND reference_id = ? " +
            "ORDER BY sequence_number",
            rowMapper(), type.name(), referenceId);
    }

    /**
     * Total quantity ever received and issued for one item.
     */
    @Transactional(readOnly = true)
    public MovementTotals totalsForItem(String itemId) {
        return jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(qty_in), 0) AS total_in, COALESCE(SUM(qty_out), 0) AS total_out " +
            "FROM stock_ledger WHERE item_id = ?",
            (rs, rowNum) -> new MovementTotals(rs.getLong("total_in"), rs.getLong("total_out")),
            itemId);
    }

    @Transactional(readOnly = true)
    public StockLedgerPage query(StockLedgerQuery query) {
        PageRequests.validate(query.getOffset(), query.getLimit());

        StringBuilder where = new StringBuilder(" WHERE 1 = 1");
        List<Object> params = new ArrayList<>();
        if (query.getItemId() != null) {
            where.append(" AND item_id = ?");
            params.add(query.getItemId());
        }
        if (query.getReferenceType() != null) {
            where.append(" AND reference_type = ?");
            params.add(query.getReferenceType().name());
        }
        if (query.getReferenceId() != null) {
            where.append(" AND reference_id = ?");
            params.add(query.getReferenceId());
        }
        SqlConditions.appendSearch(where, params, query.getSearch(), "reference_type", "reference_id", "item_id");
        SqlConditions.appendDateRange(where, params, query.getFromDate(), query.getToDate());

        Long count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM stock_ledger" + where, Long.class, params.toArray());
        MovementTotals totals = jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(qty_in), 0) AS total_in, COALESCE(SUM(qty_out), 0) AS total_out " +
            "FROM stock_ledger" + where,
            (rs, rowNum) -> new MovementTotals(rs.getLong("total_in"), rs.getLong("total_out")),
            params.toArray());

        List<Object> pageParams = new ArrayList<>(params);
        pageParams.add(query.getLimit());
        pageParams.add(query.getOffset());
        List<StockLedgerEntry> entries = jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM stock_ledger" + where +
            " ORDER BY created_at DESC, sequence_number DESC LIMIT ? OFFSET ?",
            rowMapper(), pageParams.toArray());

        return new StockLedgerPage(entries, count == null ? 0 : count,
                totals.getQtyIn(), totals.getQtyOut(), query.getOffset(), query.getLimit());
    }

    private boolean exists(String id) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM stock_ledger WHERE id = ?", Integer.class, id);
        return count != null && count > 0;
    }

    private RowMapper<StockLedgerEntry> rowMapper() {
        return (rs, rowNum) -> new StockLedgerEntry(
            rs.getString("id"),
            rs.getString("item_id"),
            StockReferenceType.valueOf(rs.getString("reference_type")),
            rs.getString("reference_id"),
            rs.getInt("qty_in"),
            rs.getInt("qty_out"),
            rs.getBigDecimal("unit_price"),
            rs.getString("note"),
            rs.getObject("created_at", OffsetDateTime.class).toInstant()
        );
    }
}
