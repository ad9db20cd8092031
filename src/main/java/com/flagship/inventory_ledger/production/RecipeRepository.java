package com.flagship.inventory_ledger.production;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
interface RecipeRepository extends JpaRepository<RecipeEntity, String> {

    Optional<RecipeEntity> findByFinalProductId(String finalProductId);

    boolean existsByFinalProductId(String finalProductId);

    List<RecipeEntity> findAllByOrderByCreatedAtDesc();
}
