package com.example.wager.application.domain.fairness;

import java.util.Arrays;
import java.util.Locale;

import com.example.wager.application.domain.error.ErrorCode;
import com.example.wager.application.domain.error.ValidationException;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 二元結果 (A / B)，同時作為玩家的選項與推導出的開獎結果。
 */
@Getter
@RequiredArgsConstructor
public enum CoinChoice {
	HEADS("heads", (byte) 0), //
	TAILS("tails", (byte) 1);

	/**
	 * 線上協定使用的字串表示
	 */
	private final String wireValue;

	/**
	 * 承諾編碼中固定 1 byte 的欄位值
	 */
	private final byte code;

	/**
	 * 解析玩家送來的選項字串 (不分大小寫)
	 *
	 * @throws ValidationException 不認得的選項
	 */
	public static CoinChoice fromWire(String value) {
		if (value == null) {
			throw new ValidationException(ErrorCode.INVALID_CHOICE, "缺少選項");
		}
		String normalized = value.trim().toLowerCase(Locale.ROOT);
		return Arrays.stream(values()).filter(c -> c.wireValue.equals(normalized)).findFirst()
				.orElseThrow(() -> new ValidationException(ErrorCode.INVALID_CHOICE, "不認得的選項: " + value));
	}
}
