package com.example.ticker.service;

import com.example.ticker.domain.TimeTicker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import javax.annotation.PostConstruct;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
@Component
public class TickerFunctionRegistry {

    private final Map<String, TickerFunction> map = new ConcurrentHashMap<>();
    private final List<TickerFunction> functions;

    @Autowired
    public TickerFunctionRegistry(Optional<List<TickerFunction>> functions) {
        this.functions = functions.orElseGet(Collections::emptyList);
    }

    @PostConstruct
    void init() {
        for (TickerFunction f : functions) {
            try {
                register(f);
            } catch (IllegalArgumentException ex) {
                log.error("Failed to register ticker function {} : {}",
                        (f == null ? "null" : f.getClass().getName()), ex.toString());
            }
        }
        log.info("TickerFunctionRegistry initialized. Registered functions: {}", map.keySet());
    }

    /**
     * 名称去除首尾空白后登记，与创建 ticker 时对 function 的处理一致
     */
    public void register(TickerFunction f) {
        if (f == null) throw new IllegalArgumentException("TickerFunction must not be null");
        String name = normalize(f.name());
        if (name == null) {
            throw new IllegalArgumentException("TickerFunction.name() must not be null/empty: " + f.getClass().getName());
        }
        if (name.length() > TimeTicker.FUNCTION_NAME_LENGTH) {
            throw new IllegalArgumentException("TickerFunction.name() longer than "
                    + TimeTicker.FUNCTION_NAME_LENGTH + ": " + name);
        }
        TickerFunction prev = map.putIfAbsent(name, f);
        if (prev == null) {
            log.info("Ticker function registered: {} -> {}", name, f.getClass().getName());
        } else if (prev != f) {
            log.warn("Ticker function conflict for name='{}' : existing={} new={}, keeping existing mapping",
                    name, prev.getClass().getName(), f.getClass().getName());
        }
    }

    public TickerFunction get(String name) {
        String key = normalize(name);
        return key == null ? null : map.get(key);
    }

    public Set<String> availableNames() {
        return Collections.unmodifiableSet(new TreeSet<>(map.keySet()));
    }

    private static String normalize(String name) {
        if (name == null) return null;
        String trimmed = name.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
