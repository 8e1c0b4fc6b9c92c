package com.example.wager.iface.dto;

/**
 * submitCommitment 訊息內容
 *
 * @param wager      下注金額 (最小貨幣單位，十進位字串或整數)
 * @param choice     heads / tails
 * @param commitment 0x 開頭的 keccak256 摘要
 */
public record SubmitCommitmentPayload(String wager, String choice, String commitment) {
}
