package com.relayauthority.payment;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Body of {@code POST /api/vanity/invoice}: the alias, the amount and the signed
 * payment request (kind 9734 event object).
 */
public record InvoiceRequest(long amountSats, String vanityName, JsonNode zapRequest) {
}
