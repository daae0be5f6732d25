package com.example.exercise.application.domain.exercise.event;

import java.util.Arrays;

/**
 * 使用者運動事件類型，對應 EventStore 中的 eventType 名稱
 */
public enum UserExercisesEventType {
	SESSION_STARTED("SessionStarted"), // 課程開始
	EXERCISE_OBSERVED("ExerciseObserved"), // 觀察到一筆運動
	SESSION_ENDED("SessionEnded"), // 課程結束
	SUGGESTIONS_SET("SuggestionsSet"), // 建議集合更新
	UNKNOWN("Unknown"); // 未識別的類型，一律忽略

	private final String eventTypeName;

	UserExercisesEventType(String eventTypeName) {
		this.eventTypeName = eventTypeName;
	}

	public String getEventTypeName() {
		return eventTypeName;
	}

	/**
	 * 由 EventStore 的 eventType 還原；無法識別時回傳 {@link #UNKNOWN}，以相容未來新增的事件類型。
	 */
	public static UserExercisesEventType fromEventTypeName(String eventTypeName) {
		return Arrays.stream(values()).filter(t -> t != UNKNOWN && t.eventTypeName.equals(eventTypeName)).findFirst()
				.orElse(UNKNOWN);
	}
}
