package com.example.exercise.application.domain.exercise.aggregate.vo;

/**
 * 運動 (Value Object)
 *
 * @param name      運動名稱，統計時的分組鍵
 * @param intensity 強度 (0 ~ 1)，可為 null
 * @param metric    量測值，可為 null
 */
public record Exercise(String name, Double intensity, Metric metric) {

	/**
	 * 建立只有名稱的運動，供目錄 (Catalog) 補位使用
	 */
	public static Exercise named(String name) {
		return new Exercise(name, null, null);
	}

	public double intensityOrDefault(double defaultIntensity) {
		return intensity != null ? intensity : defaultIntensity;
	}

	/**
	 * 判斷兩筆運動是否屬於同一統計列：名稱相同且強度相近。
	 * <p>
	 * 兩者皆無強度視為相同；僅一方有強度則不相同。
	 * </p>
	 */
	public boolean sameAs(Exercise other) {
		if (other == null || !name.equals(other.name)) {
			return false;
		}
		if (intensity == null || other.intensity == null) {
			return intensity == null && other.intensity == null;
		}
		return Intensity.isClose(intensity, other.intensity);
	}
}
