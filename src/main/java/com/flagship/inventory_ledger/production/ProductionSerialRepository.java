package com.flagship.inventory_ledger.production;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
interface ProductionSerialRepository extends JpaRepository<ProductionSerialEntity, Long> {

    /**
     * Stored serials matching any of the upper-cased keys.
     */
    @Query("SELECT s.serialNumber FROM ProductionSerialEntity s WHERE UPPER(s.serialNumber) IN :keys")
    List<String> findExisting(@Param("keys") Collection<String> keys);

    /**
     * Stored serials matching any of the upper-cased keys on batches other than {@code batchId}.
     */
    @Query("SELECT s.serialNumber FROM ProductionSerialEntity s "
            + "WHERE UPPER(s.serialNumber) IN :keys AND s.batch.id <> :batchId")
    List<String> findExistingOutsideBatch(@Param("keys") Collection<String> keys,
                                          @Param("batchId") String batchId);
}
