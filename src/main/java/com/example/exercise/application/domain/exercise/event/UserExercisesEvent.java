package com.example.exercise.application.domain.exercise.event;

import java.util.Map;
import java.util.UUID;

import com.example.exercise.application.domain.exercise.aggregate.vo.Exercise;
import com.example.exercise.application.domain.exercise.aggregate.vo.SessionProperties;
import com.example.exercise.application.domain.exercise.suggestion.Suggestions;
import com.fasterxml.jackson.annotation.JsonIgnore;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 使用者運動領域事件 (由事件日誌讀出，本服務只讀不寫)
 * <p>
 * 依 {@link #type} 決定哪些欄位有意義；type 由 EventStore 的 eventType 帶入，不在 JSON 內容中。
 * </p>
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class UserExercisesEvent {

	@JsonIgnore
	private UserExercisesEventType type;

	private UUID sessionId; // SESSION_STARTED / EXERCISE_OBSERVED / SESSION_ENDED

	private SessionProperties sessionProperties; // SESSION_STARTED

	private Map<String, Object> metadata; // EXERCISE_OBSERVED，對統計而言為不透明資料，可為任意巢狀結構

	private Exercise exercise; // EXERCISE_OBSERVED

	private Suggestions suggestions; // SUGGESTIONS_SET

	public static UserExercisesEvent sessionStarted(UUID sessionId, SessionProperties sessionProperties) {
		return new UserExercisesEvent(UserExercisesEventType.SESSION_STARTED, sessionId, sessionProperties, null, null,
				null);
	}

	public static UserExercisesEvent exerciseObserved(UUID sessionId, Exercise exercise) {
		return new UserExercisesEvent(UserExercisesEventType.EXERCISE_OBSERVED, sessionId, null, Map.of(), exercise,
				null);
	}

	public static UserExercisesEvent sessionEnded(UUID sessionId) {
		return new UserExercisesEvent(UserExercisesEventType.SESSION_ENDED, sessionId, null, null, null, null);
	}

	public static UserExercisesEvent suggestionsSet(Suggestions suggestions) {
		return new UserExercisesEvent(UserExercisesEventType.SUGGESTIONS_SET, null, null, null, null, suggestions);
	}

	public static UserExercisesEvent unrecognized() {
		return new UserExercisesEvent(UserExercisesEventType.UNKNOWN, null, null, null, null, null);
	}
}
