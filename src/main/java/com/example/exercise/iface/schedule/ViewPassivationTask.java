package com.example.exercise.iface.schedule;

import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import com.example.exercise.infra.shard.ShardRegion;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 閒置實體移除任務
 * <p>
 * 記憶體狀態隨時可由重播重建，移除時不需寫回任何資料。
 * </p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ViewPassivationTask {

	private final ShardRegion shardRegion;

	@Scheduled(fixedDelayString = "${exercise-statistics.passivate-check-interval-ms:10000}")
	public void passivateIdleViews() {
		log.debug(">>> [Passivate] 檢查閒置實體，目前存活: {}", shardRegion.liveEntityCount());
		shardRegion.passivateIdle();
	}
}
