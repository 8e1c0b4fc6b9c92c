package com.example.wager.application.domain.fairness;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.example.wager.application.domain.error.ErrorCode;
import com.example.wager.application.domain.error.ValidationException;

import lombok.extern.slf4j.Slf4j;

/**
 * <h1>公平性原語測試</h1>
 *
 * <pre>
 * <b>Scenario:</b> 驗證承諾、結果推導與派彩計算的確定性與防竄改能力。
 * <b>Given</b> 玩家以 (wager, choice, nonce) 建立承諾
 * <b>When</b>  任何一個欄位被更動後再驗證
 * <b>Then</b>  驗證必須失敗，且無從得知是哪個欄位不符
 * </pre>
 */
@Slf4j
class FairnessPrimitivesTest {

	@Test
	@DisplayName("相同輸入產生相同承諾，驗證通過")
	void commitmentIsDeterministicAndVerifiable() {
		Nonce nonce = FairnessPrimitives.generateNonce();

		Commitment first = FairnessPrimitives.createCommitment(1_000_000L, CoinChoice.HEADS, nonce);
		Commitment second = FairnessPrimitives.createCommitment(1_000_000L, CoinChoice.HEADS, nonce);

		assertThat(first).isEqualTo(second);
		assertThat(first.hex()).startsWith("0x").hasSize(66);
		assertThat(FairnessPrimitives.verifyCommitment(first, 1_000_000L, CoinChoice.HEADS, nonce)).isTrue();
	}

	@Test
	@DisplayName("竄改金額、選項或 nonce 任一欄位，驗證失敗")
	void tamperedFieldsFailVerification() {
		Nonce nonce = FairnessPrimitives.generateNonce();
		Commitment commitment = FairnessPrimitives.createCommitment(500L, CoinChoice.TAILS, nonce);

		assertThat(FairnessPrimitives.verifyCommitment(commitment, 501L, CoinChoice.TAILS, nonce)).isFalse();
		assertThat(FairnessPrimitives.verifyCommitment(commitment, 500L, CoinChoice.HEADS, nonce)).isFalse();
		assertThat(FairnessPrimitives.verifyCommitment(commitment, 500L, CoinChoice.TAILS,
				FairnessPrimitives.generateNonce())).isFalse();
		assertThat(FairnessPrimitives.verifyCommitment(commitment, -1L, CoinChoice.TAILS, nonce)).isFalse();
	}

	@Test
	@DisplayName("nonce 為 32 bytes 且每次不同")
	void generatedNoncesAreUniqueAndWellFormed() {
		Nonce a = FairnessPrimitives.generateNonce();
		Nonce b = FairnessPrimitives.generateNonce();

		assertThat(a.hex()).matches("^0x[0-9a-f]{64}$");
		assertThat(a.bytes()).hasSize(Nonce.BYTE_LENGTH);
		assertThat(a).isNotEqualTo(b);
	}

	@Test
	@DisplayName("nonce 解析時大小寫正規化，格式錯誤時拒絕")
	void nonceParsingNormalizesCase() {
		String upper = "0x" + "AB".repeat(32);

		assertThat(Nonce.parse(upper).hex()).isEqualTo("0x" + "ab".repeat(32));
		assertThatThrownBy(() -> Nonce.parse("0x1234")).isInstanceOf(ValidationException.class)
				.extracting(e -> ((ValidationException) e).getCode()).isEqualTo(ErrorCode.INVALID_NONCE);
		assertThatThrownBy(() -> Commitment.parse("not-a-hash")).isInstanceOf(ValidationException.class);
	}

	@Test
	@DisplayName("相同 nonce 組合永遠推導出相同結果")
	void resultDerivationIsDeterministic() {
		Nonce player = FairnessPrimitives.generateNonce();
		Nonce house = FairnessPrimitives.generateNonce();

		CoinChoice result = FairnessPrimitives.deriveResult(player, house);

		for (int i = 0; i < 10; i++) {
			assertThat(FairnessPrimitives.deriveResult(player, house)).isEqualTo(result);
		}
	}

	@Test
	@DisplayName("10,000 次隨機樣本中兩種結果各占 45% ~ 55%")
	void resultDistributionIsBalanced() {
		int samples = 10_000;
		int heads = 0;
		for (int i = 0; i < samples; i++) {
			if (FairnessPrimitives.deriveResult(FairnessPrimitives.generateNonce(),
					FairnessPrimitives.generateNonce()) == CoinChoice.HEADS) {
				heads++;
			}
		}
		log.info(">>> [Result] HEADS {} / {}", heads, samples);
		assertThat(heads).isBetween(4_500, 5_500);
	}

	@Test
	@DisplayName("派彩：贏 = wager * 2 * (1 - 2%)，輸 = 0")
	void payoutAppliesHouseEdge() {
		assertThat(FairnessPrimitives.calculatePayout(1_000_000L, true)).isEqualTo(1_960_000L);
		assertThat(FairnessPrimitives.calculatePayout(1_000_000L, false)).isZero();
		assertThat(FairnessPrimitives.calculatePayout(1L, true)).isEqualTo(1L);
		assertThat(FairnessPrimitives.calculatePayout(1_000L, true, 0)).isEqualTo(2_000L);
		assertThat(FairnessPrimitives.calculatePayout(1_000L, true, 500)).isEqualTo(1_900L);
	}

	@Test
	@DisplayName("負數金額與超出範圍的派彩會被拒絕")
	void payoutRejectsInvalidInput() {
		assertThatThrownBy(() -> FairnessPrimitives.calculatePayout(-1L, true))
				.isInstanceOf(ValidationException.class);
		assertThatThrownBy(() -> FairnessPrimitives.calculatePayout(Long.MAX_VALUE, true))
				.isInstanceOf(ValidationException.class);
		assertThatThrownBy(() -> FairnessPrimitives.calculatePayout(100L, true, 10_001))
				.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	@DisplayName("選項字串不分大小寫")
	void choiceParsing() {
		assertThat(CoinChoice.fromWire("HEADS")).isEqualTo(CoinChoice.HEADS);
		assertThat(CoinChoice.fromWire(" tails ")).isEqualTo(CoinChoice.TAILS);
		assertThatThrownBy(() -> CoinChoice.fromWire("edge")).isInstanceOf(ValidationException.class);
	}
}
