package com.example.exercise.application.domain.exercise.aggregate;

import java.util.UUID;

import com.example.exercise.application.domain.exercise.aggregate.vo.SessionProperties;
import com.example.exercise.application.domain.exercise.aggregate.vo.ViewMode;
import com.example.exercise.application.domain.exercise.suggestion.Suggestions;

/**
 * 統計視圖的完整狀態 (不可變)
 *
 * @param mode              目前模式
 * @param sessionId         進行中的課程 ID，IDLE 時為 null
 * @param sessionProperties 進行中的課程屬性，IDLE 時為 null
 * @param statistics        運動統計
 * @param suggestions       最新建議集合
 */
public record ViewState(ViewMode mode, UUID sessionId, SessionProperties sessionProperties,
		ExerciseStatistics statistics, Suggestions suggestions) {

	private static final ViewState INITIAL = new ViewState(ViewMode.IDLE, null, null, ExerciseStatistics.empty(),
			Suggestions.empty());

	public static ViewState initial() {
		return INITIAL;
	}

	public ViewState startSession(UUID newSessionId, SessionProperties newSessionProperties) {
		return new ViewState(ViewMode.EXERCISING, newSessionId, newSessionProperties, statistics, suggestions);
	}

	public ViewState endSession() {
		return new ViewState(ViewMode.IDLE, null, null, statistics, suggestions);
	}

	public ViewState withStatistics(ExerciseStatistics newStatistics) {
		return new ViewState(mode, sessionId, sessionProperties, newStatistics, suggestions);
	}

	public ViewState withSuggestions(Suggestions newSuggestions) {
		return new ViewState(mode, sessionId, sessionProperties, statistics, newSuggestions);
	}

	public boolean isExercising(UUID candidateSessionId) {
		return mode == ViewMode.EXERCISING && sessionId.equals(candidateSessionId);
	}
}
