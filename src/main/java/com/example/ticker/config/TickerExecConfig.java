package com.example.ticker.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * TickerFunction 执行线程池
 * - 无队列 + CallerRunsPolicy：池满时由轮询线程自己执行，自然限制领取速度
 * - 执行在任何锁之外进行，只受租约时长约束
 */
@Configuration
@EnableScheduling
@RequiredArgsConstructor
public class TickerExecConfig {

    private final TickerProperties props;

    @Bean("tickerExec")
    public ThreadPoolTaskExecutor tickerExec() {
        TickerProperties.Exec cfg = props.getExec();
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();

        e.setCorePoolSize(cfg.getCorePoolSize());
        e.setMaxPoolSize(Math.max(cfg.getCorePoolSize(), cfg.getMaxPoolSize()));
        e.setQueueCapacity(0);
        e.setKeepAliveSeconds(30);
        e.setAllowCoreThreadTimeOut(true);
        e.setThreadNamePrefix("ticker-");
        e.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());

        // 优雅关闭
        e.setWaitForTasksToCompleteOnShutdown(true);
        e.setAwaitTerminationSeconds(cfg.getAwaitTerminationSeconds());

        e.initialize();
        return e;
    }
}
