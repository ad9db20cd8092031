package com.flagship.inventory_ledger.purchase;

import com.flagship.inventory_ledger.common.PagedResult;
import com.flagship.inventory_ledger.payment.PaymentService;
import com.flagship.inventory_ledger.purchase.dto.CreatePurchaseRequest;
import com.flagship.inventory_ledger.purchase.dto.PurchaseInvoiceResponse;
import com.flagship.inventory_ledger.purchase.dto.PurchaseLineRequest;
import com.flagship.inventory_ledger.purchase.dto.UpdatePurchaseRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
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

import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping("/api/purchases")
@RequiredArgsConstructor
@Slf4j
public class PurchaseController {

    private final PurchaseService purchaseService;
    private final PaymentService paymentService;

    @PostMapping
    public ResponseEntity<PurchaseInvoiceResponse> createPurchase(@Valid @RequestBody CreatePurchaseRequest request) {
        log.info("Received purchase request: supplier={}, lines={}, payment={}",
                request.getSupplierId(), request.getItems().size(), request.getPaymentAmount());
        PurchaseInvoice invoice = purchaseService.createPurchase(request.getSupplierId(), toLines(request.getItems()),
                request.getPaymentAmount(), request.getPaymentAccountId());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(PurchaseInvoiceResponse.from(invoice, paymentService.findByInvoice(invoice.getId())));
    }

    @GetMapping("/{id}")
    public PurchaseInvoiceResponse getPurchase(@PathVariable("id") String id) {
        return PurchaseInvoiceResponse.from(purchaseService.getInvoice(id), paymentService.findByInvoice(id));
    }

    @GetMapping
    public PagedResult<PurchaseInvoiceResponse> listPurchases(
            @RequestParam(name = "supplier_id", required = false) String supplierId,
            @RequestParam(name = "status", required = false) InvoiceStatus status,
            @RequestParam(name = "from_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate fromDate,
            @RequestParam(name = "to_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate toDate,
            @RequestParam(name = "offset", defaultValue = "0") int offset,
            @RequestParam(name = "limit", defaultValue = "50") int limit) {
        return purchaseService.listInvoices(supplierId, status, fromDate, toDate, offset, limit)
                .map(PurchaseInvoiceResponse::from);
    }

    @GetMapping("/summary/{supplierId}")
    public PurchaseSummary getSupplierSummary(@PathVariable("supplierId") String supplierId) {
        return purchaseService.supplierSummary(supplierId);
    }

    @PutMapping("/{id}")
    public PurchaseInvoiceResponse updatePurchase(@PathVariable("id") String id,
                                                  @Valid @RequestBody UpdatePurchaseRequest request) {
        List<PurchaseLine> lines = request.getItems() == null ? null : toLines(request.getItems());
        PurchaseInvoice invoice = purchaseService.updatePurchase(id, lines);
        return PurchaseInvoiceResponse.from(invoice, paymentService.findByInvoice(id));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deletePurchase(@PathVariable("id") String id) {
        purchaseService.deletePurchase(id);
        return ResponseEntity.noContent().build();
    }

    private static List<PurchaseLine> toLines(List<PurchaseLineRequest> items) {
        return items.stream().map(PurchaseLineRequest::toLine).toList();
    }
}
