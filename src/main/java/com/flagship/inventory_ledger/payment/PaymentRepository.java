package com.flagship.inventory_ledger.payment;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface PaymentRepository extends JpaRepository<PaymentEntity, String> {

    List<PaymentEntity> findByInvoiceIdOrderByCreatedAtAscIdAsc(String invoiceId);

    List<PaymentEntity> findByDirectPaymentRefOrderByCreatedAtAscIdAsc(String directPaymentRef);

    List<PaymentEntity> findByCounterpartyIdOrderByCreatedAtDescIdDesc(String counterpartyId);

    boolean existsByDirectPaymentRef(String directPaymentRef);

    /**
     * All slices of one direct payment share its idempotency key, so any of
     * them identifies the earlier request.
     */
    Optional<PaymentEntity> findFirstByIdempotencyKey(String idempotencyKey);
}
