package com.relayauthority.payment;

public record ConfirmRequest(String paymentRequest, String secretPreimage) {
}
