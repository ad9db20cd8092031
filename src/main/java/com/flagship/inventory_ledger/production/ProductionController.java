package com.flagship.inventory_ledger.production;

import com.flagship.inventory_ledger.common.PagedResult;
import com.flagship.inventory_ledger.production.dto.BatchDetailResponse;
import com.flagship.inventory_ledger.production.dto.BatchResponse;
import com.flagship.inventory_ledger.production.dto.CreateBatchRequest;
import com.flagship.inventory_ledger.production.dto.RecipeLineRequest;
import com.flagship.inventory_ledger.production.dto.UpdateBatchRequest;
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

@RestController
@RequestMapping("/api/production")
@RequiredArgsConstructor
@Slf4j
public class ProductionController {

    private final ProductionService productionService;

    @GetMapping("/preview")
    public ProductionPreview preview(@RequestParam("final_product_id") String finalProductId,
                                     @RequestParam(name = "quantity", defaultValue = "1") int quantity) {
        return productionService.preview(finalProductId, quantity);
    }

    @GetMapping("/feasibility")
    public ProductionFeasibility feasibility(@RequestParam("final_product_id") String finalProductId,
                                             @RequestParam("quantity") int quantity) {
        return productionService.feasibility(finalProductId, quantity);
    }

    @PostMapping
    public ResponseEntity<BatchResponse> createDraft(@Valid @RequestBody CreateBatchRequest request) {
        log.info("Received draft request: product={}, quantity={}", request.getFinalProductId(), request.getQuantity());
        ProductionBatch batch = productionService.createDraft(request.getFinalProductId(), request.getQuantity(),
                request.getSerialNumbers());
        return ResponseEntity.status(HttpStatus.CREATED).body(BatchResponse.from(batch));
    }

    @GetMapping
    public PagedResult<BatchResponse> listBatches(
            @RequestParam(name = "final_product_id", required = false) String finalProductId,
            @RequestParam(name = "stage", required = false) ProductionStage stage,
            @RequestParam(name = "offset", defaultValue = "0") int offset,
            @RequestParam(name = "limit", defaultValue = "50") int limit) {
        return productionService.listBatches(finalProductId, stage, offset, limit).map(BatchResponse::from);
    }

    @GetMapping("/{id}")
    public BatchDetailResponse getBatch(@PathVariable("id") String id) {
        return BatchDetailResponse.from(productionService.getBatchDetail(id));
    }

    @PutMapping("/{id}")
    public BatchResponse updateDraft(@PathVariable("id") String id, @Valid @RequestBody UpdateBatchRequest request) {
        return BatchResponse.from(productionService.updateDraft(id, request.getQuantity(),
                request.getSerialNumbers(), RecipeLineRequest.toLines(request.getRecipeItems())));
    }

    @PostMapping("/{id}/execute")
    public BatchResponse executeDraft(@PathVariable("id") String id) {
        return BatchResponse.from(productionService.executeDraft(id));
    }

    @PostMapping("/{id}/complete")
    public BatchResponse completeBatch(@PathVariable("id") String id) {
        return BatchResponse.from(productionService.completeBatch(id));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteBatch(@PathVariable("id") String id) {
        productionService.deleteBatch(id);
        return ResponseEntity.noContent().build();
    }
}
