package com.example.exercise.iface.schedule;

import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import com.example.exercise.infra.shard.ShardRegion;

import lombok.RequiredArgsConstructor;

/**
 * 定期讓存活中的統計視圖追上事件日誌
 */
@Component
@RequiredArgsConstructor
public class ViewRefreshTask {

	private final ShardRegion shardRegion;

	@Scheduled(fixedDelayString = "${exercise-statistics.refresh-interval-ms:1000}")
	public void refresh() {
		shardRegion.refreshAll();
	}
}
