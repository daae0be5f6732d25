package com.example.exercise.application.domain.exercise.aggregate;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import com.example.exercise.application.domain.exercise.aggregate.vo.Exercise;
import com.example.exercise.application.domain.exercise.aggregate.vo.Intensity;
import com.example.exercise.application.domain.exercise.aggregate.vo.SessionProperties;
import com.example.exercise.application.domain.exercise.catalog.ExerciseCatalog;

/**
 * <h1>運動統計 (Exercise Statistics)</h1>
 * <p>
 * 不可變的統計「表」：每一列 {@link Entry} 代表 (肌群, 課程預定強度, 運動) 的出現次數。 所有更新都回傳新的實例，
 * 讓持有者可以整體替換狀態。
 * </p>
 */
public final class ExerciseStatistics {

	/**
	 * 沒有強度的列在計算平均強度時使用的預設值
	 */
	private static final double DEFAULT_INTENSITY = 0.5;

	private static final ExerciseStatistics EMPTY = new ExerciseStatistics(List.of());

	private final List<Entry> entries;

	private ExerciseStatistics(List<Entry> entries) {
		this.entries = List.copyOf(entries);
	}

	public static ExerciseStatistics empty() {
		return EMPTY;
	}

	public List<Entry> entries() {
		return entries;
	}

	/**
	 * 表中的一列
	 *
	 * @param key               肌群鍵
	 * @param intendedIntensity 課程的預定強度
	 * @param count             出現次數，只增不減
	 * @param exercise          運動
	 */
	public record Entry(String key, double intendedIntensity, int count, Exercise exercise) {

		/**
		 * @return 計數加一的新列
		 */
		public Entry inc() {
			return new Entry(key, intendedIntensity, count + 1, exercise);
		}

		/**
		 * 判斷此列是否代表給定課程屬性下的該筆運動
		 */
		public boolean matches(SessionProperties sessionProperties, Exercise observed) {
			return sessionProperties.muscleGroupKeys().contains(key)
					&& Intensity.isClose(intendedIntensity, sessionProperties.intendedIntensity())
					&& exercise.sameAs(observed);
		}
	}

	/**
	 * 加入一筆觀察到的運動。
	 * <p>
	 * 依插入順序找出第一筆相符的列並遞增計數；若無相符列，則為課程的每一個肌群各新增一列 (計數 1)。
	 * </p>
	 *
	 * @param sessionProperties 目前課程屬性
	 * @param exercise          觀察到的運動
	 * @return 更新後的新統計，原實例不變
	 */
	public ExerciseStatistics withObservedExercise(SessionProperties sessionProperties, Exercise exercise) {
		List<Entry> updated = new ArrayList<>(entries);
		for (int i = 0; i < updated.size(); i++) {
			if (updated.get(i).matches(sessionProperties, exercise)) {
				updated.set(i, updated.get(i).inc());
				return new ExerciseStatistics(updated);
			}
		}
		for (String key : sessionProperties.muscleGroupKeys()) {
			updated.add(new Entry(key, sessionProperties.intendedIntensity(), 1, exercise));
		}
		return new ExerciseStatistics(updated);
	}

	/**
	 * 依肌群與預定強度過濾的範例
	 */
	public List<Exercise> examples(Collection<String> muscleGroups, double intendedIntensity) {
		return examples(muscleGroups, Double.valueOf(intendedIntensity));
	}

	/**
	 * 依肌群過濾的範例
	 */
	public List<Exercise> examples(Collection<String> muscleGroups) {
		return examples(muscleGroups, null);
	}

	/**
	 * 全部歷史加上完整目錄
	 */
	public List<Exercise> examples() {
		return examples(null, null);
	}

	/**
	 * 計算範例清單。
	 * <p>
	 * 使用者的運動依總次數由少到多排序 (同次數依名稱)，強度取該組的平均值； 之後依字母順序補上目錄中同肌群、尚未出現的運動。
	 * </p>
	 *
	 * @param muscleGroups      肌群過濾，null 代表不過濾
	 * @param intendedIntensity 強度過濾，null 代表不過濾
	 */
	private List<Exercise> examples(Collection<String> muscleGroups, Double intendedIntensity) {
		Predicate<Entry> muscleGroupFilter = e -> muscleGroups == null || muscleGroups.contains(e.key());
		Predicate<Entry> intensityFilter = e -> intendedIntensity == null
				|| Intensity.isClose(e.intendedIntensity(), intendedIntensity);

		Map<String, List<Entry>> byName = entries.stream().filter(muscleGroupFilter.and(intensityFilter))
				.collect(Collectors.groupingBy(e -> e.exercise().name(), LinkedHashMap::new, Collectors.toList()));

		List<Exercise> userExercises = byName.entrySet().stream()
				.sorted(Comparator.comparingInt((Map.Entry<String, List<Entry>> group) -> totalCount(group.getValue()))
						.thenComparing(Map.Entry::getKey))
				.map(group -> new Exercise(group.getKey(), averageIntensity(group.getValue()), null)).toList();

		Set<String> observedNames = byName.keySet();
		List<Exercise> rest = ExerciseCatalog.allExampleEntries().stream().filter(muscleGroupFilter)
				.map(e -> e.exercise().name()).filter(name -> !observedNames.contains(name)).distinct().sorted()
				.map(Exercise::named).toList();

		return Stream.concat(userExercises.stream(), rest.stream()).toList();
	}

	private static int totalCount(List<Entry> group) {
		return group.stream().mapToInt(Entry::count).sum();
	}

	private static double averageIntensity(List<Entry> group) {
		return group.stream().mapToDouble(e -> e.exercise().intensityOrDefault(DEFAULT_INTENSITY)).average()
				.orElse(DEFAULT_INTENSITY);
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof ExerciseStatistics other && entries.equals(other.entries);
	}

	@Override
	public int hashCode() {
		return entries.hashCode();
	}

	@Override
	public String toString() {
		return "ExerciseStatistics" + entries;
	}
}
