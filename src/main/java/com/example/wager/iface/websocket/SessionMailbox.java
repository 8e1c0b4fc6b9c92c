package com.example.wager.iface.websocket;

import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

import lombok.extern.slf4j.Slf4j;

/**
 * 單一連線的訊息信箱
 *
 * <p>
 * 以共用執行緒池執行，但同一個信箱內的任務永遠依送入順序、一次一個執行。 連線的 GameSession 只會在信箱任務中被修改，因此不需要任何鎖。
 * </p>
 */
@Slf4j
public class SessionMailbox {

	private final Executor executor;
	private final Queue<Runnable> tasks = new ConcurrentLinkedQueue<>();
	private final AtomicBoolean scheduled = new AtomicBoolean();

	public SessionMailbox(Executor executor) {
		this.executor = executor;
	}

	public void submit(Runnable task) {
		tasks.add(task);
		schedule();
	}

	private void schedule() {
		if (!scheduled.compareAndSet(false, true)) {
			return;
		}
		try {
			executor.execute(this::drain);
		} catch (RejectedExecutionException e) {
			scheduled.set(false);
			log.warn(">>> [Mailbox] 執行緒池已關閉，丟棄 {} 筆待處理任務", tasks.size());
			tasks.clear();
		}
	}

	private void drain() {
		try {
			Runnable task;
			while ((task = tasks.poll()) != null) {
				try {
					task.run();
				} catch (RuntimeException e) {
					log.error(">>> [Mailbox] 任務執行失敗", e);
				}
			}
		} finally {
			scheduled.set(false);
			if (!tasks.isEmpty()) {
				schedule();
			}
		}
	}
}
