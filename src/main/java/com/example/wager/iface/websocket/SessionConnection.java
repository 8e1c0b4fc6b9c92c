package com.example.wager.iface.websocket;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.PingMessage;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import com.example.wager.application.domain.round.GameSession;
import com.example.wager.iface.dto.SessionMessage;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import tools.jackson.databind.ObjectMapper;

/**
 * 一條玩家連線：WebSocket、該連線獨佔的 {@link GameSession} 以及它的訊息信箱
 *
 * <p>
 * 生命週期：連線建立時建立並登記到 {@link SessionRegistry}，斷線、heartbeat 逾時或被同一玩家的新連線取代時移除。
 * </p>
 */
@Slf4j
public class SessionConnection {

	@Getter
	private final WebSocketSession socket;
	@Getter
	private final GameSession gameSession;
	@Getter
	private final SessionMailbox mailbox;
	private final ObjectMapper objectMapper;
	private final AtomicBoolean closed = new AtomicBoolean();

	private volatile Instant lastTrafficAt;
	private volatile Instant heartbeatSentAt;

	public SessionConnection(WebSocketSession socket, GameSession gameSession, SessionMailbox mailbox,
			ObjectMapper objectMapper, Instant now) {
		this.socket = socket;
		this.gameSession = gameSession;
		this.mailbox = mailbox;
		this.objectMapper = objectMapper;
		this.lastTrafficAt = now;
	}

	public String getPlayerId() {
		return gameSession.getPlayerId();
	}

	/**
	 * 收到任何流量 (訊息或 pong) 即視為存活
	 */
	public void touch(Instant now) {
		this.lastTrafficAt = now;
		this.heartbeatSentAt = null;
	}

	public boolean isIdle(Instant now, Duration interval) {
		return heartbeatSentAt == null && lastTrafficAt.plus(interval).isBefore(now);
	}

	/**
	 * heartbeat 已送出且超過等待上限仍無任何回應
	 */
	public boolean isHeartbeatOverdue(Instant now, Duration timeout) {
		Instant sentAt = heartbeatSentAt;
		return sentAt != null && sentAt.plus(timeout).isBefore(now);
	}

	public void sendHeartbeat(Instant now) {
		this.heartbeatSentAt = now;
		try {
			socket.sendMessage(new PingMessage());
		} catch (IOException | RuntimeException e) {
			log.warn(">>> [Gateway] heartbeat 送出失敗 (Player: {}): {}", getPlayerId(), e.getMessage());
		}
	}

	public void send(SessionMessage message) {
		if (!socket.isOpen()) {
			log.debug(">>> [Gateway] 連線已關閉，略過 {} (Player: {})", message.type(), getPlayerId());
			return;
		}
		try {
			socket.sendMessage(new TextMessage(objectMapper.writeValueAsString(message)));
		} catch (IOException | RuntimeException e) {
			log.warn(">>> [Gateway] 訊息 {} 送出失敗 (Player: {}): {}", message.type(), getPlayerId(), e.getMessage());
		}
	}

	public void close(CloseStatus status) {
		try {
			socket.close(status);
		} catch (IOException e) {
			log.debug(">>> [Gateway] 關閉連線失敗 (Player: {}): {}", getPlayerId(), e.getMessage());
		}
	}

	/**
	 * 只有第一次呼叫回傳 true，確保斷線清理只執行一次
	 */
	public boolean markClosed() {
		return closed.compareAndSet(false, true);
	}

	public boolean isClosed() {
		return closed.get();
	}
}
