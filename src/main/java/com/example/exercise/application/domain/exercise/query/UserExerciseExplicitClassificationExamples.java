package com.example.exercise.application.domain.exercise.query;

import java.util.List;
import java.util.UUID;

import com.example.exercise.application.domain.exercise.aggregate.vo.UserId;

/**
 * 取得分類範例。
 * <p>
 * 指定 sessionId 時回傳符合該進行中課程屬性的範例；未指定 sessionId 但指定肌群時， 回傳該肌群的範例 (供離線模式的用戶端使用)；
 * 兩者皆未指定則回傳全部。
 * </p>
 *
 * @param userId          使用者
 * @param sessionId       課程 ID，可為 null
 * @param muscleGroupKeys 肌群，可為 null
 */
public record UserExerciseExplicitClassificationExamples(UserId userId, UUID sessionId, List<String> muscleGroupKeys)
		implements UserScopedQuery {
}
