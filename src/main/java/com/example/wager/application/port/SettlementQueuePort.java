package com.example.wager.application.port;

import com.example.wager.application.domain.round.Round;

/**
 * 結算佇列發布 Port
 */
public interface SettlementQueuePort {

	/**
	 * 將已持久化的 RESOLVED 回合送進單一寫入者結算管線
	 *
	 * @return false 代表佇列已滿，交由 Watcher 稍後撿起
	 */
	boolean publish(Round round, String source);
}
