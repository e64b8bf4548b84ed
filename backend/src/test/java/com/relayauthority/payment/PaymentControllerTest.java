package com.relayauthority.payment;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.springframework.http.HttpStatus;

import static org.junit.jupiter.api.Assertions.assertEquals;

class PaymentControllerTest {

    @ParameterizedTest
    @EnumSource(value = PaymentException.Reason.class, names = {"ALIAS_UNAVAILABLE", "INSUFFICIENT_AMOUNT", "ALREADY_CONFIRMED"})
    void purchaseConflictsMapTo409(PaymentException.Reason reason) {
        assertEquals(HttpStatus.CONFLICT, PaymentController.statusOf(reason));
    }

    @Test
    void clientAndServerErrorsAreDistinguished() {
        assertEquals(HttpStatus.BAD_REQUEST, PaymentController.statusOf(PaymentException.Reason.BAD_REQUEST));
        assertEquals(HttpStatus.NOT_FOUND, PaymentController.statusOf(PaymentException.Reason.UNKNOWN_INVOICE));
        assertEquals(HttpStatus.UNPROCESSABLE_ENTITY, PaymentController.statusOf(PaymentException.Reason.INVALID_PREIMAGE));
        assertEquals(HttpStatus.SERVICE_UNAVAILABLE, PaymentController.statusOf(PaymentException.Reason.ISSUANCE_UNAVAILABLE));
        assertEquals(HttpStatus.BAD_GATEWAY, PaymentController.statusOf(PaymentException.Reason.UPSTREAM_FAILURE));
    }
}
