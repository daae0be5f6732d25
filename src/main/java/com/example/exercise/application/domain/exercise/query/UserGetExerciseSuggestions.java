package com.example.exercise.application.domain.exercise.query;

import com.example.exercise.application.domain.exercise.aggregate.vo.UserId;

/**
 * 取得未來課程建議
 */
public record UserGetExerciseSuggestions(UserId userId) implements UserScopedQuery {
}
