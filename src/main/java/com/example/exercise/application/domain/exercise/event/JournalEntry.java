package com.example.exercise.application.domain.exercise.event;

/**
 * 事件日誌中的一筆紀錄
 *
 * @param revision   該事件在使用者 Stream 中的序號 (從 0 開始)
 * @param event      解碼後的領域事件
 * @param persistent 是否來自已持久化的儲存；非持久化的投遞一律忽略
 */
public record JournalEntry(long revision, UserExercisesEvent event, boolean persistent) {

	public static JournalEntry persisted(long revision, UserExercisesEvent event) {
		return new JournalEntry(revision, event, true);
	}

	public static JournalEntry transientDelivery(UserExercisesEvent event) {
		return new JournalEntry(-1, event, false);
	}
}
