package com.example.wager.iface.websocket;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import org.awaitility.Awaitility;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import com.example.wager.application.domain.fairness.CoinChoice;
import com.example.wager.application.domain.fairness.FairnessPrimitives;
import com.example.wager.application.domain.fairness.Nonce;
import com.example.wager.application.domain.round.RoundState;
import com.example.wager.application.port.RoundRepositoryPort;
import com.example.wager.application.service.PlayerAccountService;
import com.example.wager.iface.schedule.SessionSweepTask;
import com.example.wager.support.StubVaultLedgerConfiguration;

import lombok.extern.slf4j.Slf4j;
import tools.jackson.databind.ObjectMapper;

/**
 * <h1>即時遊戲 Gateway 端對端測試</h1>
 *
 * <pre>
 * <b>Feature:</b> 玩家透過 WebSocket 進行 Commit-Reveal 回合
 * <b>Given</b> 玩家已存入餘額並以錢包位址連線
 * <b>When</b>  依序送出 submitCommitment、reveal
 * <b>Then</b>  依序收到 connected、committed、resolved，並且回合最終結算
 * <b>And</b>   格式錯誤、nonce 不符、閒置逾時都會收到對應的終態或錯誤訊息
 * </pre>
 */
@Slf4j
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
@Import(StubVaultLedgerConfiguration.class)
class GameGatewayIntegrationTest {

	private static final long WAGER = 1_000L;

	@Value("${local.server.port}")
	private int port;

	@Autowired
	private PlayerAccountService playerAccountService;
	@Autowired
	private RoundRepositoryPort roundRepository;
	@Autowired
	private SessionSweepTask sessionSweepTask;
	@Autowired
	private SessionRegistry sessionRegistry;
	@Autowired
	private ObjectMapper objectMapper;

	private final BlockingQueue<String> inbox = new LinkedBlockingQueue<>();
	private String address;
	private WebSocketSession client;

	@BeforeEach
	void connect() throws Exception {
		address = "0x" + UUID.randomUUID().toString().replace("-", "");
		playerAccountService.deposit(address, 100_000L);
		client = open(address);

		Map<String, Object> connected = next("connected");
		assertThat(payload(connected)).containsEntry("playerId", address);
		log.info(">>> [Test Setup] 玩家 {} 已連線", address);
	}

	@AfterEach
	void disconnect() throws Exception {
		if (client != null && client.isOpen()) {
			client.close();
		}
	}

	@Test
	@DisplayName("承諾、揭示、結算的完整流程")
	void commitRevealOverWebSocket() throws Exception {
		Nonce nonce = FairnessPrimitives.generateNonce();
		String commitment = FairnessPrimitives.createCommitment(WAGER, CoinChoice.HEADS, nonce).hex();

		// --- When: 承諾 ---
		send("submitCommitment", Map.of("wager", String.valueOf(WAGER), "choice", "heads", "commitment", commitment));
		Map<String, Object> committed = payload(next("committed"));
		String roundId = (String) committed.get("roundId");
		assertThat(committed).containsEntry("wager", "1000").containsEntry("choice", "heads");

		// --- When: 揭示 ---
		send("reveal", Map.of("nonce", nonce.hex()));
		Map<String, Object> resolved = payload(next("resolved"));

		// --- Then ---
		assertThat(resolved).containsEntry("roundId", roundId).containsEntry("playerNonce", nonce.hex());
		Nonce houseNonce = Nonce.parse((String) resolved.get("houseNonce"));
		CoinChoice outcome = FairnessPrimitives.deriveResult(nonce, houseNonce);
		assertThat(resolved).containsEntry("outcome", outcome.getWireValue());
		assertThat(resolved).containsEntry("payout", outcome == CoinChoice.HEADS ? "1960" : "0");

		Awaitility.await().atMost(10, TimeUnit.SECONDS)
				.until(() -> roundRepository.findById(roundId).orElseThrow().getState() == RoundState.SETTLED);
		log.info(">>> [Result] 回合 {} 已結算 (Outcome: {})", roundId, outcome);
	}

	@Test
	@DisplayName("nonce 不符時收到 voided")
	void mismatchedNonceIsVoided() throws Exception {
		Nonce nonce = FairnessPrimitives.generateNonce();
		send("submitCommitment", Map.of("wager", "500", "choice", "tails", "commitment",
				FairnessPrimitives.createCommitment(500L, CoinChoice.TAILS, nonce).hex()));
		String roundId = (String) payload(next("committed")).get("roundId");

		send("reveal", Map.of("nonce", FairnessPrimitives.generateNonce().hex()));

		Map<String, Object> voided = payload(next("voided"));
		assertThat(voided).containsEntry("roundId", roundId).containsEntry("code", "FAIRNESS_VIOLATION");
		assertThat(roundRepository.findById(roundId).orElseThrow().getState()).isEqualTo(RoundState.VOIDED);
	}

	@Test
	@DisplayName("格式錯誤與未知類型回報 error，連線保持開啟")
	void malformedMessagesReturnErrors() throws Exception {
		client.sendMessage(new TextMessage("not json"));
		assertThat(payload(next("error"))).containsEntry("code", "INVALID_MESSAGE");

		send("teleport", Map.of());
		assertThat(payload(next("error"))).containsEntry("code", "UNKNOWN_TYPE");

		send("submitCommitment", Map.of("wager", "-5", "choice", "heads", "commitment", "0x00"));
		assertThat(payload(next("error"))).containsEntry("code", "INVALID_WAGER");

		send("reveal", Map.of("nonce", FairnessPrimitives.generateNonce().hex()));
		assertThat(payload(next("error"))).containsEntry("code", "NO_OPEN_ROUND");

		send("ping", Map.of());
		next("pong");
		assertThat(client.isOpen()).isTrue();
	}

	@Test
	@DisplayName("閒置逾時的回合由巡檢任務過期並通知玩家")
	void inactiveRoundExpiresOnSweep() throws Exception {
		Nonce nonce = FairnessPrimitives.generateNonce();
		send("submitCommitment", Map.of("wager", "300", "choice", "heads", "commitment",
				FairnessPrimitives.createCommitment(300L, CoinChoice.HEADS, nonce).hex()));
		String roundId = (String) payload(next("committed")).get("roundId");

		log.info(">>> [When] 等待超過閒置上限後執行巡檢");
		Thread.sleep(2_500);
		sessionSweepTask.sweep();

		Map<String, Object> expired = payload(next("expired"));
		assertThat(expired).containsEntry("roundId", roundId).containsEntry("reason", "INACTIVITY");
		assertThat(roundRepository.findById(roundId).orElseThrow().getState()).isEqualTo(RoundState.EXPIRED);
	}

	@Test
	@DisplayName("斷線後開放中的回合過期")
	void disconnectExpiresOpenRound() throws Exception {
		Nonce nonce = FairnessPrimitives.generateNonce();
		send("submitCommitment", Map.of("wager", "300", "choice", "tails", "commitment",
				FairnessPrimitives.createCommitment(300L, CoinChoice.TAILS, nonce).hex()));
		String roundId = (String) payload(next("committed")).get("roundId");

		client.close(CloseStatus.NORMAL);

		Awaitility.await().atMost(5, TimeUnit.SECONDS)
				.until(() -> roundRepository.findById(roundId).orElseThrow().getState() == RoundState.EXPIRED);
		assertThat(roundRepository.findById(roundId).orElseThrow().getLastError()).isEqualTo("DISCONNECT");
		Awaitility.await().atMost(5, TimeUnit.SECONDS).until(() -> sessionRegistry.find(address).isEmpty());
	}

	@Test
	@DisplayName("沒有玩家身分的握手被拒絕")
	void handshakeWithoutAddressIsRejected() {
		StandardWebSocketClient anonymous = new StandardWebSocketClient();

		assertThatThrownBy(() -> anonymous
				.execute(new TextWebSocketHandler(), "ws://localhost:" + port + "/ws/game").get(5, TimeUnit.SECONDS))
				.isInstanceOf(ExecutionException.class);
	}

	@Test
	@DisplayName("玩家識別碼超過 64 字元的握手被拒絕，剛好 64 字元可連線")
	void handshakeAddressLengthIsBounded() throws Exception {
		String longest = "0x" + "a".repeat(62);
		String tooLong = longest + "b";

		// --- When / Then: 65 字元無法寫入 player_id 欄位，握手即拒絕 ---
		assertThatThrownBy(() -> open(tooLong)).isInstanceOf(ExecutionException.class);

		// --- When / Then: 64 字元可連線並下注 ---
		playerAccountService.deposit(longest, 10_000L);
		WebSocketSession boundary = open(longest);
		try {
			Map<String, Object> connected = next("connected");
			assertThat(payload(connected)).containsEntry("playerId", longest);
		} finally {
			boundary.close();
		}
	}

	private WebSocketSession open(String playerAddress) throws Exception {
		StandardWebSocketClient webSocketClient = new StandardWebSocketClient();
		return webSocketClient.execute(new TextWebSocketHandler() {
			@Override
			protected void handleTextMessage(WebSocketSession session, TextMessage message) {
				inbox.add(message.getPayload());
			}
		}, "ws://localhost:" + port + "/ws/game?address=" + playerAddress).get(5, TimeUnit.SECONDS);
	}

	private void send(String type, Map<String, Object> payload) throws Exception {
		client.sendMessage(new TextMessage(objectMapper.writeValueAsString(Map.of("type", type, "payload", payload))));
	}

	/**
	 * 等待下一則指定類型的訊息
	 */
	@SuppressWarnings("unchecked")
	private Map<String, Object> next(String expectedType) throws Exception {
		String raw = inbox.poll(5, TimeUnit.SECONDS);
		assertThat(raw).as("等待 %s 訊息逾時", expectedType).isNotNull();
		Map<String, Object> message = objectMapper.readValue(raw, Map.class);
		assertThat(message).containsEntry("type", expectedType);
		return message;
	}

	@SuppressWarnings("unchecked")
	private static Map<String, Object> payload(Map<String, Object> message) {
		return (Map<String, Object>) message.get("payload");
	}
}
