package com.example.exercise.application.domain.exercise.aggregate.vo;

/**
 * 強度的「相近」關係 (~~)
 * <p>
 * 強度先量化到最接近的 0.1 再比較，統計列比對與查詢過濾必須共用此定義。
 * </p>
 */
public final class Intensity {

	/**
	 * 量化刻度：10 代表以 0.1 為一個區間
	 */
	private static final double BUCKETS_PER_UNIT = 10.0;

	private Intensity() {
	}

	public static long bucketOf(double intensity) {
		return Math.round(intensity * BUCKETS_PER_UNIT);
	}

	public static boolean isClose(double left, double right) {
		return bucketOf(left) == bucketOf(right);
	}
}
