package com.example.exercise.application.domain.exercise.aggregate.vo;

/**
 * 運動的量測值 (例如重量、距離)，對統計而言屬於不透明資料
 */
public record Metric(double value, String metricUnit) {
}
