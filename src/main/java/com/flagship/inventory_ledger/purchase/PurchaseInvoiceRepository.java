package com.flagship.inventory_ledger.purchase;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface PurchaseInvoiceRepository extends JpaRepository<PurchaseInvoiceEntity, String>,
        JpaSpecificationExecutor<PurchaseInvoiceEntity> {

    /**
     * Loads an invoice with SELECT ... FOR UPDATE. Payment changes and
     * invoice edits go through a row obtained here.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM PurchaseInvoiceEntity p WHERE p.id = :id")
    Optional<PurchaseInvoiceEntity> findByIdForUpdate(@Param("id") String id);

    /**
     * Locks every invoice of a supplier that still has a balance, oldest first.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM PurchaseInvoiceEntity p WHERE p.supplierId = :supplierId AND p.balanceDue > 0 "
            + "ORDER BY p.createdAt ASC, p.id ASC")
    List<PurchaseInvoiceEntity> findOutstandingBySupplierForUpdate(@Param("supplierId") String supplierId);

    @Query("SELECT p FROM PurchaseInvoiceEntity p WHERE p.supplierId = :supplierId AND p.balanceDue > 0 "
            + "ORDER BY p.createdAt ASC, p.id ASC")
    List<PurchaseInvoiceEntity> findOutstandingBySupplier(@Param("supplierId") String supplierId);

    List<PurchaseInvoiceEntity> findBySupplierIdOrderByCreatedAtAsc(String supplierId);
}
