package com.flagship.inventory_ledger.payment;

import com.flagship.inventory_ledger.payment.dto.AddPaymentRequest;
import com.flagship.inventory_ledger.payment.dto.PaymentResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Payments against a single purchase invoice.
 */
@RestController
@RequestMapping("/api/payments")
@RequiredArgsConstructor
@Slf4j
public class PaymentController {

    private final PaymentService paymentService;

    @PostMapping
    public ResponseEntity<PaymentResponse> addPayment(@Valid @RequestBody AddPaymentRequest request) {
        log.info("Received payment request: invoice={}, amount={}", request.getInvoiceId(), request.getAmount());
        Payment payment = paymentService.addPayment(request.getInvoiceId(), request.getAmount(), request.getAccountId());
        return ResponseEntity.status(HttpStatus.CREATED).body(PaymentResponse.from(payment));
    }

    @GetMapping("/{id}")
    public PaymentResponse getPayment(@PathVariable("id") String id) {
        return PaymentResponse.from(paymentService.getPayment(id));
    }

    @GetMapping
    public List<PaymentResponse> listPayments(
            @RequestParam(name = "invoice_id", required = false) String invoiceId,
            @RequestParam(name = "direct_payment_ref", required = false) String directPaymentRef) {
        List<Payment> payments;
        if (invoiceId != null) {
            payments = paymentService.findByInvoice(invoiceId);
        } else if (directPaymentRef != null) {
            payments = paymentService.findByDirectPaymentRef(directPaymentRef);
        } else {
            throw new IllegalArgumentException("Either invoice_id or direct_payment_ref is required");
        }
        return payments.stream().map(PaymentResponse::from).toList();
    }

    @DeleteMapping("/{id}")
    public PaymentResponse deletePayment(@PathVariable("id") String id) {
        return PaymentResponse.from(paymentService.deletePayment(id));
    }
}
