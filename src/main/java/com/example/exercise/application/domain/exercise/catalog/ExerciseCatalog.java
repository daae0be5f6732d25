package com.example.exercise.application.domain.exercise.catalog;

import java.util.List;
import java.util.Optional;

import com.example.exercise.application.domain.exercise.aggregate.ExerciseStatistics.Entry;
import com.example.exercise.application.domain.exercise.aggregate.vo.Exercise;
import com.example.exercise.application.domain.exercise.aggregate.vo.MuscleGroup;

/**
 * 運動目錄 (Catalog)
 * <p>
 * 系統支援的肌群與運動，為程序生命週期內不可變的靜態資料。 使用者沒有任何歷史紀錄時，查詢結果以此補位。
 * </p>
 */
public final class ExerciseCatalog {

	private static final List<MuscleGroup> SUPPORTED_MUSCLE_GROUPS = List.of(
			new MuscleGroup("legs", "Legs", List.of("squat", "leg press", "leg extension", "leg curl", "lunge")),
			new MuscleGroup("core", "Core", List.of("crunch", "side bend", "cable crunch", "sit up", "leg raises")),
			new MuscleGroup("back", "Back", List.of("pull up", "row", "deadlift", "hyper-extension")),
			new MuscleGroup("arms", "Arms",
					List.of("bicep curl", "hammer curl", "pronated curl", "tricep push down",
							"tricep overhead extension", "tricep dip", "close-grip bench press")),
			new MuscleGroup("chest", "Chest",
					List.of("chest press", "butterfly", "cable cross-over", "incline chest press", "push up")),
			new MuscleGroup("shoulders", "Shoulders",
					List.of("shoulder press", "lateral raise", "front raise", "rear raise", "upright row", "shrug")),
			new MuscleGroup("cardiovascular", "Cardiovascular",
					List.of("running", "cycling", "swimming", "elliptical", "rowing")));

	// 每個肌群 x 運動的零計數佔位列，啟動時計算一次
	private static final List<Entry> ALL_EXAMPLE_ENTRIES = SUPPORTED_MUSCLE_GROUPS.stream()
			.flatMap(mg -> mg.exercises().stream().map(name -> new Entry(mg.key(), 0, 0, Exercise.named(name))))
			.toList();

	private ExerciseCatalog() {
	}

	public static List<MuscleGroup> supportedMuscleGroups() {
		return SUPPORTED_MUSCLE_GROUPS;
	}

	public static Optional<MuscleGroup> findMuscleGroup(String key) {
		return SUPPORTED_MUSCLE_GROUPS.stream().filter(mg -> mg.key().equals(key)).findFirst();
	}

	/**
	 * @return 所有 (肌群, 運動) 組合的佔位列，計數與強度皆為 0
	 */
	public static List<Entry> allExampleEntries() {
		return ALL_EXAMPLE_ENTRIES;
	}
}
