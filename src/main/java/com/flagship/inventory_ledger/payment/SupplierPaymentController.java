package com.flagship.inventory_ledger.payment;

import com.flagship.inventory_ledger.payment.dto.DirectPaymentRequest;
import com.flagship.inventory_ledger.payment.dto.DirectPaymentResponse;
import com.flagship.inventory_ledger.payment.dto.PaymentResponse;
import com.flagship.inventory_ledger.payment.dto.SimulatePaymentRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Lump-sum payments to a supplier.
 *
 * The Idempotency-Key header is optional; when present, repeating the request
 * returns the original allocation with 200 instead of paying twice.
 */
@RestController
@RequestMapping("/api/suppliers/{supplierId}/payments")
@RequiredArgsConstructor
@Slf4j
public class SupplierPaymentController {

    private static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private final DirectPaymentService directPaymentService;
    private final PaymentService paymentService;

    @PostMapping
    public ResponseEntity<DirectPaymentResponse> paySupplier(
            @PathVariable("supplierId") String supplierId,
            @Valid @RequestBody DirectPaymentRequest request,
            @RequestHeader(value = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey) {

        log.info("Received direct payment request: supplier={}, amount={}, method={}, idempotencyKey={}",
                supplierId, request.getAmount(), request.getAllocationMethod(), idempotencyKey);

        DirectPaymentResult result = directPaymentService.paySupplier(supplierId, request.getAmount(),
                request.getAccountId(), request.getAllocationMethod(), idempotencyKey);
        HttpStatus status = result.isReplayed() ? HttpStatus.OK : HttpStatus.CREATED;
        return ResponseEntity.status(status).body(DirectPaymentResponse.from(result));
    }

    @PostMapping("/simulate")
    public PaymentSimulation simulate(@PathVariable("supplierId") String supplierId,
                                      @Valid @RequestBody SimulatePaymentRequest request) {
        return directPaymentService.simulate(supplierId, request.getAmount(), request.getAllocationMethod());
    }

    @GetMapping("/outstanding")
    public SupplierOutstanding outstanding(@PathVariable("supplierId") String supplierId) {
        return directPaymentService.outstanding(supplierId);
    }

    @GetMapping
    public List<PaymentResponse> listPayments(@PathVariable("supplierId") String supplierId) {
        return paymentService.findBySupplier(supplierId).stream().map(PaymentResponse::from).toList();
    }
}
