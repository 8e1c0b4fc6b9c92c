package com.example.wager.application.domain.fairness;

import java.util.Locale;
import java.util.regex.Pattern;

import org.web3j.utils.Numeric;

import com.example.wager.application.domain.error.ErrorCode;
import com.example.wager.application.domain.error.ValidationException;

/**
 * keccak256({wager, choice, nonce}) 的摘要值，0x 開頭的 32 bytes 十六進位字串。
 */
public record Commitment(String hex) {

	private static final Pattern FORMAT = Pattern.compile("^0x[0-9a-f]{64}$");

	public Commitment {
		if (hex == null || !FORMAT.matcher(hex).matches()) {
			throw new ValidationException(ErrorCode.INVALID_COMMITMENT, "commitment 必須為 0x 開頭的 32 bytes 十六進位字串");
		}
	}

	public static Commitment parse(String value) {
		if (value == null) {
			throw new ValidationException(ErrorCode.INVALID_COMMITMENT, "缺少 commitment");
		}
		return new Commitment(value.trim().toLowerCase(Locale.ROOT));
	}

	public byte[] bytes() {
		return Numeric.hexStringToByteArray(hex);
	}

	@Override
	public String toString() {
		return hex;
	}
}
