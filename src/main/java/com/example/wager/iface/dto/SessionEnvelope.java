package com.example.wager.iface.dto;

import tools.jackson.databind.JsonNode;

/**
 * 玩家送來的訊息外框 {type, payload}
 */
public record SessionEnvelope(String type, JsonNode payload) {
}
