package com.example.exercise.application.domain.exercise.aggregate;

import java.util.List;
import java.util.UUID;

import com.example.exercise.application.domain.exercise.aggregate.vo.UserId;
import com.example.exercise.application.domain.exercise.aggregate.vo.ViewMode;
import com.example.exercise.application.domain.exercise.event.JournalEntry;
import com.example.exercise.application.domain.exercise.exception.ReplayInconsistencyException;
import com.example.exercise.application.domain.exercise.query.ClassificationExamples;
import com.example.exercise.application.domain.exercise.suggestion.Suggestions;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * 使用者運動統計視圖 (Read Side Aggregate)
 * <p>
 * 透過依序套用使用者 Stream 的事件重建狀態，並以目前狀態回答查詢。 本類別不具執行緒安全性，由所屬分片的單一執行緒獨佔存取。
 * </p>
 */
@Slf4j
@Getter
public class UserExercisesStatistics {

	private final UserId userId;

	private ViewState state = ViewState.initial();

	/**
	 * 最後套用的事件序號，-1 代表尚未套用任何事件。 續讀時從 version + 1 開始。
	 */
	private long version = -1;

	public UserExercisesStatistics(UserId userId) {
		this.userId = userId;
	}

	/**
	 * 套用一筆事件日誌紀錄。
	 *
	 * @throws ReplayInconsistencyException 序號不連續或事件內容損毀
	 */
	public void apply(JournalEntry entry) {
		if (!entry.persistent()) {
			log.debug("[{}] 忽略非持久化投遞: {}", userId, entry.event().getType());
			return;
		}
		if (entry.revision() != version + 1) {
			throw new ReplayInconsistencyException(
					"使用者 " + userId + " 事件序號不連續，預期 " + (version + 1) + "，實際 " + entry.revision());
		}
		if (!ViewTransitions.handles(state.mode(), entry.event().getType())) {
			log.debug("[{}] {} 模式下忽略事件 {} (Rev: {})", userId, state.mode(), entry.event().getType(),
					entry.revision());
		}
		state = ViewTransitions.next(state, entry.event());
		version = entry.revision();
	}

	public void applyAll(List<JournalEntry> entries) {
		entries.forEach(this::apply);
	}

	public long nextRevision() {
		return version + 1;
	}

	/**
	 * 分類範例查詢。
	 * <ul>
	 * <li>進行中的課程且 sessionId 相符：依課程肌群與預定強度過濾</li>
	 * <li>未指定 sessionId 與肌群：全部歷史加上完整目錄</li>
	 * <li>未指定 sessionId、指定肌群：依肌群過濾</li>
	 * <li>其他情況 (IDLE 或 sessionId 不符)：No examples，不退回目錄資料</li>
	 * </ul>
	 */
	public ClassificationExamples classificationExamples(UUID sessionId, List<String> muscleGroupKeys) {
		if (sessionId != null) {
			if (state.isExercising(sessionId)) {
				return ClassificationExamples.of(state.statistics().examples(
						state.sessionProperties().muscleGroupKeys(), state.sessionProperties().intendedIntensity()));
			}
			return ClassificationExamples.noExamples();
		}
		if (muscleGroupKeys == null) {
			return ClassificationExamples.of(state.statistics().examples());
		}
		return ClassificationExamples.of(state.statistics().examples(muscleGroupKeys));
	}

	public Suggestions suggestions() {
		return state.suggestions();
	}

	public ViewMode mode() {
		return state.mode();
	}
}
