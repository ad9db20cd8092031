package com.flagship.inventory_ledger.party;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface CounterpartyRepository extends JpaRepository<CounterpartyEntity, String> {

    List<CounterpartyEntity> findByRoleOrderByNameAsc(CounterpartyRole role);
}
