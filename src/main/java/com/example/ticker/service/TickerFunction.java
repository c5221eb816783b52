package com.example.ticker.service;

import com.fasterxml.jackson.databind.JsonNode;

public interface TickerFunction {
    /**
     * 执行 ticker 负载。正常返回即成功，抛出异常即失败（按重试策略处理）。
     * 同一次到期可能被执行多于一次（租约过期被抢占时），实现方需自行保证幂等。
     */
    void execute(TickerContext context, JsonNode request) throws Exception;

    /**
     * 返回此函数对应的 function 名称
     */
    String name();
}
