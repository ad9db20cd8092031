package com.flagship.inventory_ledger.production;

import com.flagship.inventory_ledger.production.dto.CreateRecipeRequest;
import com.flagship.inventory_ledger.production.dto.RecipeLineRequest;
import com.flagship.inventory_ledger.production.dto.RecipeResponse;
import com.flagship.inventory_ledger.production.dto.UpdateRecipeRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/recipes")
@RequiredArgsConstructor
@Slf4j
public class RecipeController {

    private final RecipeService recipeService;

    @PostMapping
    public ResponseEntity<RecipeResponse> createRecipe(@Valid @RequestBody CreateRecipeRequest request) {
        log.info("Received recipe request: product={}, items={}", request.getFinalProductId(), request.getItems().size());
        Recipe recipe = recipeService.createRecipe(request.getFinalProductId(), request.getName(),
                RecipeLineRequest.toLines(request.getItems()));
        return ResponseEntity.status(HttpStatus.CREATED).body(RecipeResponse.from(recipe));
    }

    @GetMapping
    public List<RecipeResponse> listRecipes(
            @RequestParam(name = "final_product_id", required = false) String finalProductId) {
        if (finalProductId != null) {
            return List.of(RecipeResponse.from(recipeService.getRecipeForProduct(finalProductId)));
        }
        return recipeService.listRecipes().stream().map(RecipeResponse::from).toList();
    }

    @GetMapping("/{id}")
    public RecipeResponse getRecipe(@PathVariable("id") String id) {
        return RecipeResponse.from(recipeService.getRecipe(id));
    }

    @PutMapping("/{id}")
    public RecipeResponse updateRecipe(@PathVariable("id") String id, @Valid @RequestBody UpdateRecipeRequest request) {
        return RecipeResponse.from(recipeService.updateRecipe(id, request.getName(),
                RecipeLineRequest.toLines(request.getItems())));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteRecipe(@PathVariable("id") String id) {
        recipeService.deleteRecipe(id);
        return ResponseEntity.noContent().build();
    }
}
