package com.example.exercise.application.domain.exercise.aggregate.vo;

import java.util.List;

/**
 * 肌群與其支援的運動清單 (靜態參考資料)
 */
public record MuscleGroup(String key, String title, List<String> exercises) {

	public MuscleGroup {
		exercises = List.copyOf(exercises);
	}
}
