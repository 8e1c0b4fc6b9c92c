package com.example.wager.iface.websocket;

import java.util.regex.Pattern;

import org.springframework.stereotype.Component;

import com.example.wager.application.domain.error.ErrorCode;
import com.example.wager.application.domain.error.FairnessViolationException;
import com.example.wager.application.domain.error.RoundTimeoutException;
import com.example.wager.application.domain.error.ValidationException;
import com.example.wager.application.domain.error.WagerException;
import com.example.wager.application.domain.round.GameSession;
import com.example.wager.application.domain.round.Round;
import com.example.wager.application.service.GameSessionService;
import com.example.wager.iface.dto.RevealPayload;
import com.example.wager.iface.dto.SessionEnvelope;
import com.example.wager.iface.dto.SessionMessage;
import com.example.wager.iface.dto.SubmitCommitmentPayload;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;

/**
 * 將玩家訊息轉送到回合狀態機，並把狀態轉換推回給玩家
 *
 * <p>
 * 所有方法都只在該連線的 {@link SessionMailbox} 中執行。驗證與公平性錯誤同步回報給發起的連線；
 * 玩家開過的每一個回合最終一定會收到 resolved / voided / expired 其中之一。
 * </p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GameMessageDispatcher {

	static final String SUBMIT_COMMITMENT = "submitCommitment";
	static final String REVEAL = "reveal";
	static final String PING = "ping";

	private static final Pattern AMOUNT_FORMAT = Pattern.compile("^[0-9]{1,19}$");

	private static final int DISCONNECT_HANDOFF_ATTEMPTS = 3;

	private final GameSessionService gameSessionService;
	private final ObjectMapper objectMapper;

	public void dispatch(SessionConnection connection, String text) {
		if (connection.isClosed()) {
			return;
		}
		GameSession session = connection.getGameSession();
		try {
			SessionEnvelope envelope = parse(text);
			switch (envelope.type()) {
			case SUBMIT_COMMITMENT -> {
				SubmitCommitmentPayload payload = payload(envelope, SubmitCommitmentPayload.class);
				Round round = gameSessionService.submitCommitment(session, parseAmount(payload.wager()),
						payload.choice(), payload.commitment());
				connection.send(SessionMessage.committed(round));
			}
			case REVEAL -> {
				RevealPayload payload = payload(envelope, RevealPayload.class);
				Round round = gameSessionService.reveal(session, payload.nonce());
				connection.send(SessionMessage.resolved(round));
			}
			case PING -> connection.send(SessionMessage.pong());
			default -> throw new ValidationException(ErrorCode.UNKNOWN_TYPE, "未知的訊息類型: " + envelope.type());
			}
		} catch (FairnessViolationException e) {
			connection.send(SessionMessage.voided(e.getRoundId(), e.getCode(), e.getMessage()));
		} catch (RoundTimeoutException e) {
			connection.send(SessionMessage.expired(e.getRoundId(), "INACTIVITY"));
		} catch (WagerException e) {
			log.debug(">>> [Gateway] 拒絕訊息 (Player: {}, Code: {}): {}", session.getPlayerId(), e.getCode(),
					e.getMessage());
			connection.send(SessionMessage.error(e.getCode(), e.getMessage()));
		} catch (RuntimeException e) {
			log.error(">>> [Gateway] 處理訊息時發生未預期錯誤 (Player: {})", session.getPlayerId(), e);
			connection.send(SessionMessage.error(ErrorCode.INTERNAL_ERROR, "伺服器內部錯誤"));
		}
	}

	/**
	 * 定期巡檢：重新交付先前失敗的 RESOLVED 回合，並讓閒置逾時的回合過期
	 */
	public void sweep(SessionConnection connection) {
		if (connection.isClosed()) {
			return;
		}
		GameSession session = connection.getGameSession();
		gameSessionService.retryHandOff(session).ifPresent(round -> connection.send(SessionMessage.resolved(round)));
		if (gameSessionService.isRoundInactive(session)) {
			gameSessionService.expireOpenRound(session, "INACTIVITY")
					.ifPresent(round -> connection.send(SessionMessage.expired(round.getRoundId(), "INACTIVITY")));
		}
	}

	/**
	 * 斷線清理：開放中的回合過期；尚未交付的 RESOLVED 回合必須先寫入結算佇列才能丟棄 Session
	 */
	public void onDisconnect(SessionConnection connection) {
		GameSession session = connection.getGameSession();
		gameSessionService.expireOpenRound(session, "DISCONNECT");

		for (int attempt = 1; attempt <= DISCONNECT_HANDOFF_ATTEMPTS
				&& session.pendingHandoff().isPresent(); attempt++) {
			gameSessionService.retryHandOff(session);
		}
		session.pendingHandoff().ifPresent(round -> log.error(
				">>> [Gateway] 斷線時回合 {} 仍無法交付結算 (Player: {}, Payout: {})，需人工介入", round.getRoundId(),
				round.getPlayerId(), round.getPayout()));
		log.info(">>> [Gateway] 連線清理完成 (Player: {}, Session: {})", session.getPlayerId(), session.getSessionId());
	}

	private SessionEnvelope parse(String text) {
		SessionEnvelope envelope;
		try {
			envelope = objectMapper.readValue(text, SessionEnvelope.class);
		} catch (JacksonException e) {
			throw new ValidationException(ErrorCode.INVALID_MESSAGE, "訊息必須為 {type, payload} 格式的 JSON");
		}
		if (envelope == null || envelope.type() == null) {
			throw new ValidationException(ErrorCode.INVALID_MESSAGE, "缺少訊息類型");
		}
		return envelope;
	}

	private <T> T payload(SessionEnvelope envelope, Class<T> type) {
		JsonNode node = envelope.payload() == null ? objectMapper.createObjectNode() : envelope.payload();
		try {
			return objectMapper.treeToValue(node, type);
		} catch (JacksonException e) {
			throw new ValidationException(ErrorCode.INVALID_MESSAGE, envelope.type() + " 的 payload 格式錯誤");
		}
	}

	private long parseAmount(String value) {
		if (value == null || !AMOUNT_FORMAT.matcher(value.trim()).matches()) {
			throw new ValidationException(ErrorCode.INVALID_WAGER, "下注金額必須為正整數 (最小貨幣單位): " + value);
		}
		try {
			return Long.parseLong(value.trim());
		} catch (NumberFormatException e) {
			throw new ValidationException(ErrorCode.INVALID_WAGER, "下注金額超出範圍: " + value);
		}
	}
}
