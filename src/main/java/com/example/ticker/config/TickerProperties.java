package com.example.ticker.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * ticker.* 配置
 */
@Data
@Component
@ConfigurationProperties(prefix = "ticker")
public class TickerProperties {

    /**
     * 写入 lock_holder 的 worker 标识，为空时按 host#pid#随机后缀 生成
     */
    private String workerId;

    /**
     * 领取后的租约时长，超过该时长未推进的 CLAIMED/RUNNING 行可被其他 worker 抢占
     */
    private Duration lease = Duration.ofMinutes(5);

    private Poll poll = new Poll();

    private Retry retry = new Retry();

    private Exec exec = new Exec();

    @Data
    public static class Poll {
        private boolean enabled = true;
        private long delayMs = 2000;
        /**
         * 单轮最多领取条数
         */
        private int batchSize = 16;
        /**
         * 存储不可用时的最大退避
         */
        private long backoffMaxMs = 60000;
    }

    @Data
    public static class Retry {
        private int defaultRetries = 3;
        private long defaultIntervalSeconds = 30;
    }

    @Data
    public static class Exec {
        private int corePoolSize = 8;
        private int maxPoolSize = 32;
        private int awaitTerminationSeconds = 20;
    }
}
