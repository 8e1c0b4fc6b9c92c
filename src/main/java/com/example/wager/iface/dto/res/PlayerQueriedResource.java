package com.example.wager.iface.dto.res;

public record PlayerQueriedResource(String code, String message, PlayerBalanceResource data) {

}
