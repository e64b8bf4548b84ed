package com.relayauthority.payment;

public record InvoiceResponse(String pr) {
}
