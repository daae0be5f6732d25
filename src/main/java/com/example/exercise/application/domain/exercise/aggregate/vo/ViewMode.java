package com.example.exercise.application.domain.exercise.aggregate.vo;

/**
 * 統計視圖的模式
 */
public enum ViewMode {
	IDLE, // 未在運動中
	EXERCISING // 課程進行中
}
