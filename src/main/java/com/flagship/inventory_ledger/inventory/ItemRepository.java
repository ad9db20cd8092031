package com.flagship.inventory_ledger.inventory;

import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface ItemRepository extends JpaRepository<ItemEntity, String> {

    /**
     * Loads an item with SELECT ... FOR UPDATE. Every change to stock
     * aggregates goes through a row obtained here.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT i FROM ItemEntity i WHERE i.id = :id")
    Optional<ItemEntity> findByIdForUpdate(@Param("id") String id);

    /**
     * Locks several items at once, in id order so concurrent callers
     * acquire row locks in the same sequence.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT i FROM ItemEntity i WHERE i.id IN :ids ORDER BY i.id")
    List<ItemEntity> findAllByIdForUpdate(@Param("ids") Collection<String> ids);

    Page<ItemEntity> findByItemType(ItemType itemType, Pageable pageable);

    List<ItemEntity> findByTotalQuantityLessThanOrderByTotalQuantityAscNameAsc(int threshold);

    long countByItemType(ItemType itemType);

    @Query("SELECT COALESCE(SUM(i.avgPrice * i.totalQuantity), 0) FROM ItemEntity i WHERE i.itemType = :itemType")
    BigDecimal sumStockValueByItemType(@Param("itemType") ItemType itemType);

    @Query("SELECT COALESCE(SUM(COALESCE(i.standardCost, i.avgPrice) * i.totalQuantity), 0) FROM ItemEntity i "
            + "WHERE i.itemType = :itemType")
    BigDecimal sumStandardStockValueByItemType(@Param("itemType") ItemType itemType);

    @Query("SELECT COALESCE(SUM(i.totalQuantity), 0) FROM ItemEntity i WHERE i.itemType = :itemType")
    long sumQuantityByItemType(@Param("itemType") ItemType itemType);
}
