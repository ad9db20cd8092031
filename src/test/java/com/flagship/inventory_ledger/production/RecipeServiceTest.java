package com.flagship.inventory_ledger.production;

import com.flagship.inventory_ledger.IntegrationTestBase;
import com.flagship.inventory_ledger.exception.ResourceNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Master recipes and the standard cost they give their final product.
 */
class RecipeServiceTest extends IntegrationTestBase {

    @Autowired
    private RecipeService recipeService;

    @Autowired
    private ProductionService productionService;

    private String supplierId;
    private String rawId;
    private String productId;

    @BeforeEach
    void setUp() {
        supplierId = newSupplier();
        rawId = newRawMaterial();
        productId = newFinalProduct();
    }

    @Test
    @DisplayName("Saving a recipe sets the product's standard cost from raw averages")
    void testCreateRecipe_StandardCost() {
        printTestHeader("Recipe Standard Cost");
        purchase(supplierId, rawId, 10, "90.00");
        printInput("Recipe", "4 x raw @ 90.00");

        Recipe recipe = recipeService.createRecipe(productId, "  Kit  ", List.of(RecipeLine.of(rawId, new BigDecimal("4"))));
        printOutput("Standard cost", item(productId).getStandardCost());

        assertTrue(recipe.getId().startsWith("RCP-"));
        assertEquals("Kit", recipe.getName());
        assertEquals(1, recipe.getLines().size());
        assertAmount("360.00", item(productId).getStandardCost());
        assertAmount("360.00", itemService.unitCost(item(productId)));
        assertAmount("0.00", item(productId).getAvgPrice());
        printSuccess("Standard cost 360.00, purchased average untouched");
    }

    @Test
    @DisplayName("Fractional quantities are costed exactly before rounding")
    void testCreateRecipe_FractionalQuantity() {
        String second = newRawMaterial();
        purchase(supplierId, rawId, 10, "3.33");
        purchase(supplierId, second, 10, "1.00");

        recipeService.createRecipe(productId, null, List.of(
                RecipeLine.of(rawId, new BigDecimal("0.5")),
                RecipeLine.of(second, new BigDecimal("0.25"))));

        assertAmount("1.92", item(productId).getStandardCost());
    }

    @Test
    @DisplayName("Recipe lines must be raw materials, positive and distinct")
    void testCreateRecipe_Validation() {
        String other = newFinalProduct();

        assertThrows(IllegalArgumentException.class, () -> recipeService.createRecipe(productId, null, List.of()));
        assertThrows(IllegalArgumentException.class, () -> recipeService.createRecipe(productId, null,
                List.of(RecipeLine.of(rawId, BigDecimal.ZERO))));
        assertThrows(IllegalArgumentException.class, () -> recipeService.createRecipe(productId, null,
                List.of(RecipeLine.of(rawId, BigDecimal.ONE), RecipeLine.of(rawId, BigDecimal.TEN))));
        assertThrows(IllegalArgumentException.class, () -> recipeService.createRecipe(productId, null,
                List.of(RecipeLine.of(other, BigDecimal.ONE))));
        assertThrows(IllegalArgumentException.class, () -> recipeService.createRecipe(rawId, null,
                List.of(RecipeLine.of(rawId, BigDecimal.ONE))));
    }

    @Test
    @DisplayName("A product has at most one recipe")
    void testCreateRecipe_OnePerProduct() {
        recipeService.createRecipe(productId, null, List.of(RecipeLine.of(rawId, BigDecimal.ONE)));

        assertThrows(IllegalStateException.class, () -> recipeService.createRecipe(productId, null,
                List.of(RecipeLine.of(rawId, BigDecimal.TEN))));
    }

    @Test
    @DisplayName("Updating lines replaces them and recomputes the standard cost")
    void testUpdateRecipe() {
        purchase(supplierId, rawId, 10, "90.00");
        String second = newRawMaterial();
        purchase(supplierId, second, 10, "10.00");
        Recipe recipe = recipeService.createRecipe(productId, "v1", List.of(RecipeLine.of(rawId, new BigDecimal("4"))));

        Recipe updated = recipeService.updateRecipe(recipe.getId(), "v2", List.of(
                RecipeLine.of(rawId, new BigDecimal("2")),
                RecipeLine.of(second, new BigDecimal("3"))));

        assertEquals("v2", updated.getName());
        assertEquals(2, updated.getLines().size());
        assertAmount("210.00", item(productId).getStandardCost());

        Recipe renamed = recipeService.updateRecipe(recipe.getId(), "v3", null);
        assertEquals(2, renamed.getLines().size());
    }

    @Test
    @DisplayName("Recipes are frozen once the product has a completed batch")
    void testUpdateRecipe_FrozenAfterDone() {
        printTestHeader("Recipe Frozen After Production");
        purchase(supplierId, rawId, 10, "90.00");
        Recipe recipe = recipeService.createRecipe(productId, null, List.of(RecipeLine.of(rawId, BigDecimal.ONE)));
        ProductionBatch batch = productionService.createDraft(productId, 1, List.of(shortId()));
        productionService.executeDraft(batch.getId());
        productionService.completeBatch(batch.getId());

        assertThrows(IllegalStateException.class, () -> recipeService.updateRecipe(recipe.getId(), "new", null));
        assertThrows(IllegalStateException.class, () -> recipeService.deleteRecipe(recipe.getId()));
        printExpectedException("IllegalStateException", "product has DONE batches");
    }

    @Test
    @DisplayName("Deleting a recipe clears the standard cost")
    void testDeleteRecipe() {
        purchase(supplierId, rawId, 10, "90.00");
        Recipe recipe = recipeService.createRecipe(productId, null, List.of(RecipeLine.of(rawId, BigDecimal.ONE)));

        recipeService.deleteRecipe(recipe.getId());

        assertNull(item(productId).getStandardCost());
        assertThrows(ResourceNotFoundException.class, () -> recipeService.getRecipeForProduct(productId));
        assertThrows(ResourceNotFoundException.class, () -> recipeService.getRecipe(recipe.getId()));
    }
}
