package com.example.exercise.application.service;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import com.example.exercise.application.domain.exercise.aggregate.vo.MuscleGroup;
import com.example.exercise.application.domain.exercise.aggregate.vo.UserId;
import com.example.exercise.application.domain.exercise.catalog.ExerciseCatalog;
import com.example.exercise.application.domain.exercise.exception.ViewUnavailableException;
import com.example.exercise.application.domain.exercise.query.ClassificationExamples;
import com.example.exercise.application.domain.exercise.query.UserExerciseExplicitClassificationExamples;
import com.example.exercise.application.domain.exercise.query.UserGetExerciseSuggestions;
import com.example.exercise.application.domain.exercise.suggestion.Suggestions;
import com.example.exercise.application.port.UserExercisesViewPort;

import lombok.extern.slf4j.Slf4j;

/**
 * 使用者運動統計查詢應用服務
 * <p>
 * 查詢直接以記憶體中的視圖回答，結果最多落後事件日誌一個刷新週期。
 * </p>
 */
@Slf4j
@Service
public class UserExercisesStatisticsQueryService {

	private final UserExercisesViewPort viewPort;
	private final long askTimeoutMs;

	public UserExercisesStatisticsQueryService(UserExercisesViewPort viewPort,
			@Value("${exercise-statistics.ask-timeout-ms:5000}") long askTimeoutMs) {
		this.viewPort = viewPort;
		this.askTimeoutMs = askTimeoutMs;
	}

	/**
	 * 取得分類範例
	 *
	 * @param userId          使用者
	 * @param sessionId       課程 ID，可為 null
	 * @param muscleGroupKeys 肌群，可為 null
	 * @return 範例；課程不符時為 No examples 結果
	 * @throws ViewUnavailableException 逾時或視圖重播失敗
	 */
	public ClassificationExamples getClassificationExamples(UserId userId, UUID sessionId,
			List<String> muscleGroupKeys) {
		return await(userId,
				viewPort.classificationExamples(
						new UserExerciseExplicitClassificationExamples(userId, sessionId, muscleGroupKeys)));
	}

	/**
	 * 取得未來課程建議
	 */
	public Suggestions getSuggestions(UserId userId) {
		return await(userId, viewPort.suggestions(new UserGetExerciseSuggestions(userId)));
	}

	public List<MuscleGroup> getSupportedMuscleGroups() {
		return ExerciseCatalog.supportedMuscleGroups();
	}

	private <T> T await(UserId userId, CompletableFuture<T> future) {
		try {
			return future.get(askTimeoutMs, TimeUnit.MILLISECONDS);
		} catch (TimeoutException e) {
			log.warn(">>> [Query] 使用者 {} 的統計視圖在 {} ms 內未回應", userId, askTimeoutMs);
			throw new ViewUnavailableException("統計視圖回應逾時: " + userId, e);
		} catch (ExecutionException e) {
			log.warn(">>> [Query] 使用者 {} 的統計視圖查詢失敗: {}", userId, e.getCause().getMessage());
			throw new ViewUnavailableException("統計視圖暫時無法使用: " + userId, e.getCause());
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new ViewUnavailableException("查詢被中斷: " + userId, e);
		}
	}
}
