package com.flagship.inventory_ledger.production;

import com.flagship.inventory_ledger.common.CodeGenerator;
import com.flagship.inventory_ledger.common.CodePrefix;
import com.flagship.inventory_ledger.common.Money;
import com.flagship.inventory_ledger.exception.ResourceNotFoundException;
import com.flagship.inventory_ledger.inventory.InventoryValuationService;
import com.flagship.inventory_ledger.inventory.Item;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Master recipes. Every change recomputes the final product's standard cost
 * from the current raw material averages.
 *
 * A recipe is frozen once any batch of its product has been completed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RecipeService {

    private final RecipeRepository recipeRepository;
    private final ProductionBatchRepository batchRepository;
    private final RecipeLineValidator validator;
    private final InventoryValuationService valuationService;
    private final CodeGenerator codeGenerator;

    /**
     * @throws IllegalStateException if the product already has a recipe or has completed batches
     */
    @Transactional
    public Recipe createRecipe(String finalProductId, String name, List<RecipeLine> lines) {
        validator.requireFinalProduct(finalProductId);
        if (recipeRepository.existsByFinalProductId(finalProductId)) {
            throw new IllegalStateException("A recipe already exists for final product " + finalProductId);
        }
        List<RecipeLine> normalized = validator.validate(lines);
        Map<String, Item> locked = lockRecipeItems(finalProductId, normalized);
        requireNoCompletedBatches(finalProductId);

        String id = codeGenerator.generate(CodePrefix.RECIPE, recipeRepository::existsById);
        RecipeEntity recipe = recipeRepository.save(RecipeEntity.create(id, finalProductId, trimName(name)));
        recipe.addLines(normalized);

        BigDecimal standardCost = applyStandardCost(finalProductId, normalized, locked);
        log.info("Recipe {} created for {} with {} item(s), standard cost {}",
                id, finalProductId, normalized.size(), standardCost);
        return recipeRepository.save(recipe).toDomain();
    }

    /**
     * Renames the recipe and, when lines are given, replaces them.
     */
    @Transactional
    public Recipe updateRecipe(String recipeId, String name, List<RecipeLine> lines) {
        RecipeEntity recipe = requireRecipe(recipeId);
        List<RecipeLine> normalized = lines != null ? validator.validate(lines) : recipe.lines();
        Map<String, Item> locked = lockRecipeItems(recipe.getFinalProductId(), normalized);
        requireNoCompletedBatches(recipe.getFinalProductId());

        recipe.rename(name != null ? trimName(name) : recipe.getName());
        if (lines != null) {
            recipe.clearLines();
            // Old rows must be gone before the unique (recipe, raw item) rows are re-inserted.
            recipeRepository.flush();
            recipe.addLines(normalized);
        }

        BigDecimal standardCost = applyStandardCost(recipe.getFinalProductId(), normalized, locked);
        log.info("Recipe {} updated, standard cost {}", recipeId, standardCost);
        return recipeRepository.save(recipe).toDomain();
    }

    @Transactional
    public void deleteRecipe(String recipeId) {
        RecipeEntity recipe = requireRecipe(recipeId);
        valuationService.lockAll(List.of(recipe.getFinalProductId()));
        requireNoCompletedBatches(recipe.getFinalProductId());
        recipeRepository.delete(recipe);
        valuationService.applyStandardCost(recipe.getFinalProductId(), null);
        log.info("Recipe {} deleted, standard cost of {} cleared", recipeId, recipe.getFinalProductId());
    }

    @Transactional(readOnly = true)
    public Recipe getRecipe(String recipeId) {
        return requireRecipe(recipeId).toDomain();
    }

    @Transactional(readOnly = true)
    public Recipe getRecipeForProduct(String finalProductId) {
        return recipeRepository.findByFinalProductId(finalProductId)
                .map(RecipeEntity::toDomain)
                .orElseThrow(() -> new ResourceNotFoundException("Recipe for final product", finalProductId));
    }

    @Transactional(readOnly = true)
    public List<Recipe> listRecipes() {
        return recipeRepository.findAllByOrderByCreatedAtDesc().stream()
                .map(RecipeEntity::toDomain)
                .toList();
    }

    /**
     * Sum of quantity per unit times raw average, rounded to money scale.
     */
    static BigDecimal standardCost(List<RecipeLine> lines, Map<String, Item> rawItems) {
        BigDecimal total = BigDecimal.ZERO;
        for (RecipeLine line : lines) {
            total = total.add(line.getQuantityPerUnit().multiply(rawItems.get(line.getRawItemId()).getAvgPrice()));
        }
        return Money.of(total);
    }

    /**
     * Locks the raw items and the final product in id order. Completing a batch
     * locks the same product row, so the DONE check that follows sees any
     * completion that committed first.
     */
    private Map<String, Item> lockRecipeItems(String finalProductId, List<RecipeLine> lines) {
        List<String> ids = new ArrayList<>(lines.stream().map(RecipeLine::getRawItemId).toList());
        ids.add(finalProductId);
        return valuationService.lockAll(ids);
    }

    private BigDecimal applyStandardCost(String finalProductId, List<RecipeLine> lines, Map<String, Item> locked) {
        BigDecimal cost = standardCost(lines, locked);
        valuationService.applyStandardCost(finalProductId, cost);
        return cost;
    }

    private void requireNoCompletedBatches(String finalProductId) {
        if (batchRepository.existsByFinalProductIdAndStage(finalProductId, ProductionStage.DONE)) {
            throw new IllegalStateException(
                    "Recipe cannot change: final product " + finalProductId + " has completed production batches");
        }
    }

    private RecipeEntity requireRecipe(String recipeId) {
        return recipeRepository.findById(recipeId)
                .orElseThrow(() -> new ResourceNotFoundException("Recipe", recipeId));
    }

    private static String trimName(String name) {
        return name == null || name.isBlank() ? null : name.trim();
    }
}
