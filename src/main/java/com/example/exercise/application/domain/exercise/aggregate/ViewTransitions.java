package com.example.exercise.application.domain.exercise.aggregate;

import java.util.EnumMap;
import java.util.Map;

import com.example.exercise.application.domain.exercise.aggregate.vo.ViewMode;
import com.example.exercise.application.domain.exercise.event.UserExercisesEvent;
import com.example.exercise.application.domain.exercise.event.UserExercisesEventType;
import com.example.exercise.application.domain.exercise.exception.ReplayInconsistencyException;
import com.example.exercise.application.domain.exercise.suggestion.Suggestions;

/**
 * <h1>統計視圖轉移表</h1>
 * <p>
 * 以 (目前模式, 事件類型) 查表決定下一個狀態，轉移函式皆為純函式。
 * </p>
 *
 * <pre>
 * IDLE       + SESSION_STARTED   -> EXERCISING
 * IDLE       + SUGGESTIONS_SET   -> IDLE (替換建議)
 * EXERCISING + EXERCISE_OBSERVED -> EXERCISING (更新統計)
 * EXERCISING + SESSION_ENDED     -> IDLE
 * EXERCISING + SUGGESTIONS_SET   -> EXERCISING (替換建議)
 * 其他組合                       -> 不變
 * </pre>
 */
public final class ViewTransitions {

	@FunctionalInterface
	interface Transition {
		ViewState apply(ViewState state, UserExercisesEvent event);
	}

	private static final Map<ViewMode, Map<UserExercisesEventType, Transition>> TABLE = new EnumMap<>(ViewMode.class);

	static {
		Map<UserExercisesEventType, Transition> idle = new EnumMap<>(UserExercisesEventType.class);
		idle.put(UserExercisesEventType.SESSION_STARTED, ViewTransitions::startSession);
		idle.put(UserExercisesEventType.SUGGESTIONS_SET, ViewTransitions::replaceSuggestions);

		Map<UserExercisesEventType, Transition> exercising = new EnumMap<>(UserExercisesEventType.class);
		exercising.put(UserExercisesEventType.EXERCISE_OBSERVED, ViewTransitions::observeExercise);
		exercising.put(UserExercisesEventType.SESSION_ENDED, (state, event) -> state.endSession());
		exercising.put(UserExercisesEventType.SUGGESTIONS_SET, ViewTransitions::replaceSuggestions);

		TABLE.put(ViewMode.IDLE, idle);
		TABLE.put(ViewMode.EXERCISING, exercising);
	}

	private ViewTransitions() {
	}

	/**
	 * @return 該模式是否處理此類型的事件
	 */
	public static boolean handles(ViewMode mode, UserExercisesEventType type) {
		return type != null && TABLE.get(mode).containsKey(type);
	}

	/**
	 * 計算下一個狀態；未列於表中的組合回傳原狀態。
	 *
	 * @throws ReplayInconsistencyException 事件缺少轉移所需的欄位
	 */
	public static ViewState next(ViewState state, UserExercisesEvent event) {
		if (!handles(state.mode(), event.getType())) {
			return state;
		}
		return TABLE.get(state.mode()).get(event.getType()).apply(state, event);
	}

	private static ViewState startSession(ViewState state, UserExercisesEvent event) {
		if (event.getSessionId() == null || event.getSessionProperties() == null) {
			throw new ReplayInconsistencyException("SessionStarted 缺少 sessionId 或 sessionProperties");
		}
		return state.startSession(event.getSessionId(), event.getSessionProperties());
	}

	private static ViewState observeExercise(ViewState state, UserExercisesEvent event) {
		if (event.getExercise() == null || event.getExercise().name() == null) {
			throw new ReplayInconsistencyException("ExerciseObserved 缺少 exercise (session " + event.getSessionId() + ")");
		}
		return state.withStatistics(
				state.statistics().withObservedExercise(state.sessionProperties(), event.getExercise()));
	}

	private static ViewState replaceSuggestions(ViewState state, UserExercisesEvent event) {
		Suggestions suggestions = event.getSuggestions() != null ? event.getSuggestions() : Suggestions.empty();
		return state.withSuggestions(suggestions);
	}
}
