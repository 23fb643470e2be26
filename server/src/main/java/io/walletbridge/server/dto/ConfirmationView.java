package io.walletbridge.server.dto;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * JSON view of one pending confirmation for GET /confirmations.
 * Example:
 *   {
 *     "ticketId": "6f1c...",
 *     "correlationId": 12,
 *     "origin": "https://dapp.example",
 *     "transaction": { "from": "0x..", "to": "0x..", "amount": "100", ... },
 *     "createdAtMillis": 1718000000000,
 *     "expiresAtMillis": 1718000030000
 *   }
 */
public class ConfirmationView {
    public String ticketId;
    public long correlationId;
    public String origin;
    public JsonNode transaction;
    public long createdAtMillis;
    public long expiresAtMillis;
}
