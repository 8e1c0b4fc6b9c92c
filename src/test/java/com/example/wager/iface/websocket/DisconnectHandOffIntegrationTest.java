package com.example.wager.iface.websocket;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;

import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.awaitility.Awaitility;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoSpyBean;
import org.springframework.web.socket.WebSocketSession;

import com.example.wager.application.domain.error.TransientInfrastructureException;
import com.example.wager.application.domain.fairness.CoinChoice;
import com.example.wager.application.domain.fairness.FairnessPrimitives;
import com.example.wager.application.domain.fairness.Nonce;
import com.example.wager.application.domain.round.GameSession;
import com.example.wager.application.domain.round.Round;
import com.example.wager.application.domain.round.RoundState;
import com.example.wager.application.port.PlayerBalancePort;
import com.example.wager.application.port.RoundRepositoryPort;
import com.example.wager.application.service.GameSessionService;
import com.example.wager.application.service.PlayerAccountService;
import com.example.wager.application.shared.projection.PlayerBalanceProjection;
import com.example.wager.iface.schedule.AbandonedRoundReaper;
import com.example.wager.support.StubVaultLedgerConfiguration;

import lombok.extern.slf4j.Slf4j;
import tools.jackson.databind.ObjectMapper;

/**
 * <h1>斷線時的結算交付測試</h1>
 *
 * <pre>
 * <b>Feature:</b> 已 RESOLVED 的回合不會因斷線而遺失
 * <b>Given</b> 玩家揭示後，RESOLVED 回合寫入持久化佇列失敗，回合仍掛在 Session 上
 * <b>When</b>  玩家斷線
 * <b>Then</b>  斷線清理重新交付回合，回合最終結算、保留金額被消耗
 * <b>And</b>   若交付始終失敗，回收任務之後會過期回合並退回保留金額
 * </pre>
 */
@Slf4j
@SpringBootTest
@ActiveProfiles("test")
@Import(StubVaultLedgerConfiguration.class)
class DisconnectHandOffIntegrationTest {

	private static final long DEPOSIT = 10_000L;
	private static final long WAGER = 1_000L;

	@MockitoSpyBean
	private RoundRepositoryPort roundRepository;

	@Autowired
	private GameSessionService gameSessionService;
	@Autowired
	private GameMessageDispatcher dispatcher;
	@Autowired
	private PlayerAccountService playerAccountService;
	@Autowired
	private PlayerBalancePort playerBalance;
	@Autowired
	private AbandonedRoundReaper abandonedRoundReaper;
	@Autowired
	private JdbcTemplate jdbcTemplate;
	@Autowired
	private ObjectMapper objectMapper;

	private String playerId;
	private GameSession session;
	private SessionConnection connection;

	@BeforeEach
	void setUp() {
		playerId = "HANDOFF-" + UUID.randomUUID().toString().substring(0, 8);
		playerAccountService.deposit(playerId, DEPOSIT);
		session = new GameSession(playerId, Instant.now());
		// 已斷線的 socket：isOpen() 為 false，所有推送都會被略過
		connection = new SessionConnection(mock(WebSocketSession.class), session, new SessionMailbox(Runnable::run),
				objectMapper, Instant.now());
	}

	@Test
	@DisplayName("揭示後交付失敗，斷線清理重新交付並完成結算")
	void disconnectRetriesFailedHandOff() {
		// --- Given ---
		Round round = commitAndRevealWithFailingHandOff(1);
		assertThat(session.pendingHandoff()).isPresent();
		assertThat(roundRepository.findById(round.getRoundId()).orElseThrow().getState())
				.isEqualTo(RoundState.AWAITING_REVEAL);

		// --- When ---
		log.info(">>> [When] 玩家斷線，執行清理");
		dispatcher.onDisconnect(connection);

		// --- Then ---
		assertThat(session.pendingHandoff()).isEmpty();
		Awaitility.await().atMost(10, TimeUnit.SECONDS)
				.until(() -> roundRepository.findById(round.getRoundId()).orElseThrow().getState() == RoundState.SETTLED);
		PlayerBalanceProjection balance = playerBalance.find(playerId).orElseThrow();
		assertThat(balance.reserved()).isZero();
		assertThat(balance.available()).isEqualTo(DEPOSIT - WAGER + round.getPayout());
		log.info(">>> [Result] 回合 {} 已結算 (Payout: {})", round.getRoundId(), round.getPayout());
	}

	@Test
	@DisplayName("斷線時交付始終失敗，回合由回收任務過期並退回保留金額")
	void handOffThatNeverSucceedsIsReclaimed() {
		// --- Given: 揭示一次 + 斷線清理三次全部失敗 ---
		Round round = commitAndRevealWithFailingHandOff(4);
		dispatcher.onDisconnect(connection);
		assertThat(session.pendingHandoff()).isPresent();
		assertThat(playerBalance.find(playerId).orElseThrow().reserved()).isEqualTo(WAGER);

		// --- When: 資料庫恢復，回合閒置已超過上限 ---
		jdbcTemplate.update("UPDATE rounds SET last_activity_at = ? WHERE round_id = ?",
				Timestamp.from(Instant.now().minus(Duration.ofHours(1))), round.getRoundId());
		abandonedRoundReaper.reap();

		// --- Then ---
		Round reclaimed = roundRepository.findById(round.getRoundId()).orElseThrow();
		assertThat(reclaimed.getState()).isEqualTo(RoundState.EXPIRED);
		PlayerBalanceProjection balance = playerBalance.find(playerId).orElseThrow();
		assertThat(balance.reserved()).isZero();
		assertThat(balance.available()).isEqualTo(DEPOSIT);
	}

	/**
	 * 送出承諾並揭示，前 failures 次的交付寫入都會失敗
	 */
	private Round commitAndRevealWithFailingHandOff(int failures) {
		Nonce nonce = FairnessPrimitives.generateNonce();
		Round round = gameSessionService.submitCommitment(session, WAGER, "heads",
				FairnessPrimitives.createCommitment(WAGER, CoinChoice.HEADS, nonce).hex());

		AtomicInteger remaining = new AtomicInteger(failures);
		doAnswer(invocation -> {
			if (remaining.getAndDecrement() > 0) {
				throw new DataAccessResourceFailureException("database unavailable");
			}
			return invocation.callRealMethod();
		}).when(roundRepository).updateIfOpen(any(Round.class));

		assertThatThrownBy(() -> gameSessionService.reveal(session, nonce.hex()))
				.isInstanceOf(TransientInfrastructureException.class);
		log.info(">>> [Given] 回合 {} 已 RESOLVED，但交付寫入失敗", round.getRoundId());
		return round;
	}
}
