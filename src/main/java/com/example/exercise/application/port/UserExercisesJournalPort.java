package com.example.exercise.application.port;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import com.example.exercise.application.domain.exercise.aggregate.vo.UserId;
import com.example.exercise.application.domain.exercise.event.JournalEntry;

/**
 * 使用者運動事件日誌讀取 Port (唯讀)
 */
public interface UserExercisesJournalPort {

	/**
	 * 非同步讀取使用者 Stream 中從指定序號開始的事件，依序號遞增排列。
	 * <p>
	 * Stream 不存在時回傳空清單。
	 * </p>
	 *
	 * @param userId       使用者
	 * @param fromRevision 起始序號 (含)
	 * @param maxCount     單次最多讀取筆數
	 */
	CompletableFuture<List<JournalEntry>> readFrom(UserId userId, long fromRevision, int maxCount);
}
