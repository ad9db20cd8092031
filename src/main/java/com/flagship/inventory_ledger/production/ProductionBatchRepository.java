package com.flagship.inventory_ledger.production;

import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
interface ProductionBatchRepository extends JpaRepository<ProductionBatchEntity, String> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT b FROM ProductionBatchEntity b WHERE b.id = :id")
    Optional<ProductionBatchEntity> findByIdForUpdate(@Param("id") String id);

    boolean existsByFinalProductIdAndStage(String finalProductId, ProductionStage stage);

    Page<ProductionBatchEntity> findByFinalProductId(String finalProductId, Pageable pageable);

    Page<ProductionBatchEntity> findByStage(ProductionStage stage, Pageable pageable);

    Page<ProductionBatchEntity> findByFinalProductIdAndStage(String finalProductId, ProductionStage stage,
                                                             Pageable pageable);
}
