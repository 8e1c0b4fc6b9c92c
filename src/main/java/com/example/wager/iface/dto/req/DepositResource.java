package com.example.wager.iface.dto.req;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;

/**
 * 存款請求，金額為最小貨幣單位
 */
@Data
public class DepositResource {

	@NotNull(message = "金額不能為空")
	@Positive(message = "金額必須大於 0")
	private Long amount;
}
