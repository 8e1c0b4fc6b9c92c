package com.example.wager.iface.dto;

/**
 * reveal 訊息內容
 */
public record RevealPayload(String nonce) {
}
