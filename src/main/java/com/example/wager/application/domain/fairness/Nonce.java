package com.example.wager.application.domain.fairness;

import java.util.Locale;
import java.util.regex.Pattern;

import org.web3j.utils.Numeric;

import com.example.wager.application.domain.error.ErrorCode;
import com.example.wager.application.domain.error.ValidationException;

/**
 * 32 bytes 的隨機值，以 "0x" + 64 個十六進位字元 (共 66 字元) 表示。
 */
public record Nonce(String hex) {

	public static final int BYTE_LENGTH = 32;

	private static final Pattern FORMAT = Pattern.compile("^0x[0-9a-f]{64}$");

	public Nonce {
		if (hex == null || !FORMAT.matcher(hex).matches()) {
			throw new ValidationException(ErrorCode.INVALID_NONCE, "nonce 必須為 0x 開頭的 32 bytes 十六進位字串");
		}
	}

	/**
	 * 解析外部輸入，大小寫一律正規化為小寫
	 */
	public static Nonce parse(String value) {
		if (value == null) {
			throw new ValidationException(ErrorCode.INVALID_NONCE, "缺少 nonce");
		}
		return new Nonce(value.trim().toLowerCase(Locale.ROOT));
	}

	public static Nonce of(byte[] bytes) {
		if (bytes.length != BYTE_LENGTH) {
			throw new IllegalArgumentException("nonce 長度必須為 " + BYTE_LENGTH + " bytes");
		}
		return new Nonce(Numeric.toHexString(bytes));
	}

	public byte[] bytes() {
		return Numeric.hexStringToByteArray(hex);
	}

	@Override
	public String toString() {
		return hex;
	}
}
