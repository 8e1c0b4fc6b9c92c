package com.example.wager.application.domain.fairness;

import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.security.MessageDigest;
import java.security.SecureRandom;

import org.web3j.crypto.Hash;
import org.web3j.utils.Numeric;

import com.example.wager.application.domain.error.ErrorCode;
import com.example.wager.application.domain.error.ValidationException;

/**
 * 公平性原語 (Fairness Primitives)
 *
 * <p>
 * 無狀態的純函式集合，負責 commit-reveal 協定中的所有密碼學運算：
 * <ul>
 * <li>nonce 產生：{@link SecureRandom} 產生 32 bytes</li>
 * <li>承諾：keccak256( uint256(wager) || uint8(choice) || bytes32(nonce) )，三個欄位皆為固定長度，
 * 不同的 (wager, choice, nonce) 組合不可能序列化為相同位元組</li>
 * <li>結果推導：keccak256( playerNonce || houseNonce ) 最後一個 byte 的奇偶性</li>
 * <li>派彩：wager * 2 * (10000 - edgeBps) / 10000，全程整數運算</li>
 * </ul>
 * </p>
 */
public final class FairnessPrimitives {

	/**
	 * 預設莊家優勢 2% (basis points)
	 */
	public static final int DEFAULT_HOUSE_EDGE_BPS = 200;

	public static final int BPS_BASE = 10_000;

	private static final int WAGER_FIELD_BYTES = 32;

	private static final int ENCODED_LENGTH = WAGER_FIELD_BYTES + 1 + Nonce.BYTE_LENGTH;

	private static final SecureRandom RANDOM = new SecureRandom();

	private FairnessPrimitives() {
	}

	/**
	 * 產生一個新的 32 bytes 隨機 nonce
	 */
	public static Nonce generateNonce() {
		byte[] bytes = new byte[Nonce.BYTE_LENGTH];
		RANDOM.nextBytes(bytes);
		return Nonce.of(bytes);
	}

	/**
	 * 建立承諾摘要
	 *
	 * @param wager  下注金額 (最小貨幣單位，不可為負)
	 * @param choice 玩家選項
	 * @param nonce  玩家 nonce
	 */
	public static Commitment createCommitment(long wager, CoinChoice choice, Nonce nonce) {
		return new Commitment(Numeric.toHexString(Hash.sha3(encode(wager, choice, nonce))));
	}

	/**
	 * 重新計算承諾並以固定時間比較摘要。任何欄位不符都只回傳 false，呼叫端無從得知是哪個欄位不符。
	 */
	public static boolean verifyCommitment(Commitment commitment, long wager, CoinChoice choice, Nonce nonce) {
		if (commitment == null || choice == null || nonce == null || wager < 0) {
			return false;
		}
		byte[] expected = Hash.sha3(encode(wager, choice, nonce));
		return MessageDigest.isEqual(expected, commitment.bytes());
	}

	/**
	 * 由雙方 nonce 推導結果。相同的 nonce 組合永遠得到相同結果，可事後稽核。
	 */
	public static CoinChoice deriveResult(Nonce playerNonce, Nonce houseNonce) {
		byte[] combined = ByteBuffer.allocate(Nonce.BYTE_LENGTH * 2).put(playerNonce.bytes()).put(houseNonce.bytes())
				.array();
		byte[] mixed = Hash.sha3(combined);
		int lastByte = mixed[mixed.length - 1] & 0xff;
		return lastByte % 2 == 0 ? CoinChoice.HEADS : CoinChoice.TAILS;
	}

	/**
	 * 以預設莊家優勢計算派彩
	 */
	public static long calculatePayout(long wager, boolean won) {
		return calculatePayout(wager, won, DEFAULT_HOUSE_EDGE_BPS);
	}

	/**
	 * 計算派彩：輸則為 0；贏則為 wager * 2 * (10000 - edgeBps) / 10000 (向下取整，餘數歸莊家)
	 *
	 * @throws ValidationException 金額為負或運算結果超出 long 範圍
	 */
	public static long calculatePayout(long wager, boolean won, int houseEdgeBps) {
		if (wager < 0) {
			throw new ValidationException(ErrorCode.INVALID_WAGER, "下注金額不可為負: " + wager);
		}
		if (houseEdgeBps < 0 || houseEdgeBps > BPS_BASE) {
			throw new IllegalArgumentException("house edge 必須介於 0 與 " + BPS_BASE + " bps 之間: " + houseEdgeBps);
		}
		if (!won) {
			return 0L;
		}
		BigInteger payout = BigInteger.valueOf(wager).multiply(BigInteger.TWO)
				.multiply(BigInteger.valueOf(BPS_BASE - houseEdgeBps)).divide(BigInteger.valueOf(BPS_BASE));
		try {
			return payout.longValueExact();
		} catch (ArithmeticException e) {
			throw new ValidationException(ErrorCode.INVALID_WAGER, "派彩金額超出範圍: " + payout);
		}
	}

	private static byte[] encode(long wager, CoinChoice choice, Nonce nonce) {
		if (wager < 0) {
			throw new ValidationException(ErrorCode.INVALID_WAGER, "下注金額不可為負: " + wager);
		}
		return ByteBuffer.allocate(ENCODED_LENGTH) //
				.put(Numeric.toBytesPadded(BigInteger.valueOf(wager), WAGER_FIELD_BYTES)) //
				.put(choice.getCode()) //
				.put(nonce.bytes()) //
				.array();
	}
}
