package com.example.wager.iface.schedule;

import java.time.Duration;

/**
 * 由 {@link BackgroundTaskSupervisor} 週期執行的背景任務
 */
public interface SupervisedTask {

	String name();

	/**
	 * 兩次執行之間的間隔 (上一次結束到下一次開始)
	 */
	Duration interval();

	/**
	 * 執行一次。拋出的例外由監督器記錄並計數，下一個週期照常執行。
	 */
	void runOnce() throws Exception;
}
