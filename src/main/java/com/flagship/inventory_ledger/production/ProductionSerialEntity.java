package com.flagship.inventory_ledger.production;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Entity
@Table(name = "production_serials")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
class ProductionSerialEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "batch_id", nullable = false, updatable = false)
    private ProductionBatchEntity batch;

    @Column(name = "serial_number", nullable = false, updatable = false, length = 100)
    private String serialNumber;

    static ProductionSerialEntity create(ProductionBatchEntity batch, String serialNumber) {
        return new ProductionSerialEntity(null, batch, serialNumber);
    }
}
