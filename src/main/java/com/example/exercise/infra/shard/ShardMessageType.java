package com.example.exercise.infra.shard;

/**
 * 分片 RingBuffer 中的訊息類型
 */
public enum ShardMessageType {
	DELIVER, // 投遞查詢給實體 (必要時建立實體)
	APPLY, // 非同步讀取的事件回到分片執行緒套用
	REFRESH, // 為所有存活實體發起續讀
	PASSIVATE // 移除閒置實體
}
