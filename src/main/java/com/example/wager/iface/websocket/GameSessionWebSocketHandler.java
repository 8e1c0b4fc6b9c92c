package com.example.wager.iface.websocket;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.ExecutorService;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.PongMessage;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import com.example.wager.application.domain.round.GameSession;
import com.example.wager.config.config.WagerProperties;
import com.example.wager.iface.dto.SessionMessage;

import lombok.extern.slf4j.Slf4j;
import tools.jackson.databind.ObjectMapper;

/**
 * 即時遊戲 Gateway (/ws/game)
 *
 * <p>
 * WebSocket 容器執行緒只負責收訊與登記，所有會修改 GameSession 的工作都送進該連線的 {@link SessionMailbox}：
 * <ul>
 * <li>連線建立：建立 GameSession，登記到 {@link SessionRegistry}，同一玩家的舊連線被取代並清理</li>
 * <li>收到訊息或 pong：更新存活時間，訊息交給 {@link GameMessageDispatcher}</li>
 * <li>斷線：從登記表移除並執行斷線清理，已進入結算管線的回合不受影響</li>
 * </ul>
 * </p>
 */
@Slf4j
@Component
public class GameSessionWebSocketHandler extends TextWebSocketHandler {

	static final String CONNECTION = "connection";

	static final CloseStatus REPLACED = new CloseStatus(4000, "replaced by a newer connection");

	private final SessionRegistry registry;
	private final GameMessageDispatcher dispatcher;
	private final ExecutorService sessionExecutor;
	private final ObjectMapper objectMapper;
	private final WagerProperties properties;
	private final Clock clock;

	public GameSessionWebSocketHandler(SessionRegistry registry, GameMessageDispatcher dispatcher,
			@Qualifier("sessionExecutor") ExecutorService sessionExecutor, ObjectMapper objectMapper,
			WagerProperties properties, Clock clock) {
		this.registry = registry;
		this.dispatcher = dispatcher;
		this.sessionExecutor = sessionExecutor;
		this.objectMapper = objectMapper;
		this.properties = properties;
		this.clock = clock;
	}

	@Override
	public void afterConnectionEstablished(WebSocketSession session) {
		String playerId = (String) session.getAttributes().get(PlayerHandshakeInterceptor.PLAYER_ID);
		Instant now = clock.instant();
		WebSocketSession socket = new ConcurrentWebSocketSessionDecorator(session,
				properties.getGateway().getSendTimeLimitMillis(), properties.getGateway().getSendBufferSizeLimit());

		SessionConnection connection = new SessionConnection(socket, new GameSession(playerId, now),
				new SessionMailbox(sessionExecutor), objectMapper, now);
		session.getAttributes().put(CONNECTION, connection);

		registry.register(connection).ifPresent(previous -> {
			log.info(">>> [Gateway] 玩家 {} 建立新連線，關閉舊連線", playerId);
			previous.close(REPLACED);
			cleanup(previous);
		});

		connection.send(SessionMessage.connected(playerId, now));
		log.info(">>> [Gateway] 玩家連線 (Player: {}, Session: {}, Online: {})", playerId,
				connection.getGameSession().getSessionId(), registry.size());
	}

	@Override
	protected void handleTextMessage(WebSocketSession session, TextMessage message) {
		SessionConnection connection = connection(session);
		if (connection == null) {
			return;
		}
		connection.touch(clock.instant());
		String payload = message.getPayload();
		connection.getMailbox().submit(() -> dispatcher.dispatch(connection, payload));
	}

	@Override
	protected void handlePongMessage(WebSocketSession session, PongMessage message) {
		SessionConnection connection = connection(session);
		if (connection != null) {
			connection.touch(clock.instant());
		}
	}

	@Override
	public void handleTransportError(WebSocketSession session, Throwable exception) {
		log.warn(">>> [Gateway] 傳輸錯誤 (Session: {}): {}", session.getId(), exception.getMessage());
	}

	@Override
	public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
		SessionConnection connection = connection(session);
		if (connection != null) {
			log.info(">>> [Gateway] 玩家斷線 (Player: {}, Status: {})", connection.getPlayerId(), status);
			cleanup(connection);
		}
	}

	/**
	 * 斷線清理，同一條連線只會執行一次
	 */
	public void cleanup(SessionConnection connection) {
		if (!connection.markClosed()) {
			return;
		}
		registry.remove(connection);
		connection.getMailbox().submit(() -> dispatcher.onDisconnect(connection));
	}

	private SessionConnection connection(WebSocketSession session) {
		return (SessionConnection) session.getAttributes().get(CONNECTION);
	}
}
