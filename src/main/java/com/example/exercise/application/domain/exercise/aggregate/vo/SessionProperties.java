package com.example.exercise.application.domain.exercise.aggregate.vo;

import java.time.LocalDate;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * 運動課程屬性，由 SessionStarted 事件帶入，課程期間維持不變
 *
 * @param startDate         課程開始日期，可為 null
 * @param muscleGroupKeys   目標肌群 (不重複、保留宣告順序)
 * @param intendedIntensity 預定強度
 */
public record SessionProperties(LocalDate startDate, List<String> muscleGroupKeys, double intendedIntensity) {

	public SessionProperties {
		muscleGroupKeys = muscleGroupKeys == null ? List.of() : List.copyOf(new LinkedHashSet<>(muscleGroupKeys));
	}

	public SessionProperties(List<String> muscleGroupKeys, double intendedIntensity) {
		this(null, muscleGroupKeys, intendedIntensity);
	}
}
