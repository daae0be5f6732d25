package com.example.exercise.iface.rest;

import java.util.List;
import java.util.UUID;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.example.exercise.application.domain.exercise.aggregate.vo.UserId;
import com.example.exercise.application.domain.exercise.query.ClassificationExamples;
import com.example.exercise.application.service.UserExercisesStatisticsQueryService;
import com.example.exercise.iface.dto.res.ClassificationExamplesResource;
import com.example.exercise.iface.dto.res.MuscleGroupsResource;
import com.example.exercise.iface.dto.res.SuggestionsResource;

import lombok.AllArgsConstructor;

/**
 * 使用者運動統計查詢控制器 (Query Side)
 * <p>
 * 直接以記憶體中的統計視圖回答，不經過事件日誌。
 * </p>
 */
@RestController
@AllArgsConstructor
public class UserExercisesStatisticsController {

	private final UserExercisesStatisticsQueryService queryService;

	/**
	 * 取得分類範例
	 * <p>
	 * 帶 sessionId 時必須對應進行中的課程，否則回傳 404 No examples。
	 * </p>
	 */
	@GetMapping("/users/{userId}/exercise-statistics/examples")
	public ResponseEntity<ClassificationExamplesResource> getClassificationExamples(@PathVariable UUID userId,
			@RequestParam(required = false) UUID sessionId,
			@RequestParam(required = false) List<String> muscleGroupKeys) {
		ClassificationExamples result = queryService.getClassificationExamples(new UserId(userId), sessionId,
				muscleGroupKeys);
		if (!result.isSuccess()) {
			return ResponseEntity.status(HttpStatus.NOT_FOUND)
					.body(new ClassificationExamplesResource("404", result.failure(), List.of()));
		}
		return ResponseEntity.ok(new ClassificationExamplesResource("200", "查詢成功", result.examples()));
	}

	@GetMapping("/users/{userId}/exercise-statistics/suggestions")
	public ResponseEntity<SuggestionsResource> getSuggestions(@PathVariable UUID userId) {
		return ResponseEntity
				.ok(new SuggestionsResource("200", "查詢成功", queryService.getSuggestions(new UserId(userId))));
	}

	@GetMapping("/exercise-statistics/muscle-groups")
	public ResponseEntity<MuscleGroupsResource> getMuscleGroups() {
		return ResponseEntity.ok(new MuscleGroupsResource("200", "查詢成功", queryService.getSupportedMuscleGroups()));
	}
}
