package com.example.exercise.config.config;

import java.time.Clock;
import java.time.Duration;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.example.exercise.application.port.UserExercisesJournalPort;
import com.example.exercise.infra.shard.ShardRegion;
import com.example.exercise.infra.shard.ShardRouter;

/**
 * 分片區域設定類
 *
 * <p>
 * 建立分片路由器與分片區域。每個分片各自擁有一個 Disruptor 與單一消費者執行緒， 確保同一使用者的統計視圖不會被並行修改。
 * </p>
 */
@Configuration
public class ShardRegionConfiguration {

	@Value("${exercise-statistics.shard-count:10}")
	private int shardCount;

	/**
	 * RingBuffer 容量需為 2 的次方
	 */
	@Value("${exercise-statistics.ring-buffer-size:1024}")
	private int ringBufferSize;

	@Value("${exercise-statistics.passivate-after-seconds:360}")
	private long passivateAfterSeconds;

	@Value("${exercise-statistics.read-batch-size:500}")
	private int readBatchSize;

	@Bean
	public Clock clock() {
		return Clock.systemUTC();
	}

	@Bean
	public ShardRouter shardRouter() {
		return new ShardRouter(shardCount);
	}

	@Bean(destroyMethod = "shutdown")
	public ShardRegion shardRegion(ShardRouter shardRouter, UserExercisesJournalPort journal, Clock clock) {
		return new ShardRegion(shardRouter, journal, clock, ringBufferSize, Duration.ofSeconds(passivateAfterSeconds),
				readBatchSize);
	}
}
