package com.relayauthority.payment;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.Map;

@RestController
@RequestMapping("/api/vanity")
public class PaymentController {

    private final InvoiceService invoiceService;
    private final PaymentConfirmationService confirmationService;

    public PaymentController(InvoiceService invoiceService, PaymentConfirmationService confirmationService) {
        this.invoiceService = invoiceService;
        this.confirmationService = confirmationService;
    }

    @PostMapping("/invoice")
    public Mono<InvoiceResponse> issueInvoice(@RequestBody InvoiceRequest request) {
        return invoiceService.issue(request);
    }

    /**
     * Confirms an invoice issued by this service with the preimage the payer's wallet
     * returned. Answers {@code {alias, validUntil}}.
     */
    @PostMapping("/confirm")
    public Mono<ConfirmResponse> confirm(@RequestBody ConfirmRequest request) {
        if (request.paymentRequest() == null || request.secretPreimage() == null) {
            return Mono.error(new PaymentException(PaymentException.Reason.BAD_REQUEST,
                    "paymentRequest and secretPreimage are required"));
        }
        return confirmationService.confirmWithPreimage(request.paymentRequest(), request.secretPreimage())
                .map(record -> new ConfirmResponse(record.alias(), record.validUntil()));
    }

    @ExceptionHandler(PaymentException.class)
    public ResponseEntity<Map<String, String>> handlePaymentException(PaymentException e) {
        return ResponseEntity.status(statusOf(e.reason()))
                .body(Map.of("error", e.reason().name(), "message", e.getMessage()));
    }

    static HttpStatus statusOf(PaymentException.Reason reason) {
        switch (reason) {
            case BAD_REQUEST:
                return HttpStatus.BAD_REQUEST;
            case UNKNOWN_INVOICE:
                return HttpStatus.NOT_FOUND;
            case ALIAS_UNAVAILABLE:
            case INSUFFICIENT_AMOUNT:
            case ALREADY_CONFIRMED:
                return HttpStatus.CONFLICT;
            case INVALID_PREIMAGE:
                return HttpStatus.UNPROCESSABLE_ENTITY;
            case ISSUANCE_UNAVAILABLE:
                return HttpStatus.SERVICE_UNAVAILABLE;
            default:
                return HttpStatus.BAD_GATEWAY;
        }
    }
}
