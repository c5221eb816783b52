package com.example.ticker.support;

import com.example.ticker.domain.TimeTicker;
import com.example.ticker.service.BatchCompletionListener;
import com.example.ticker.service.TickerContext;
import com.example.ticker.service.TickerFunction;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;

import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;

@TestConfiguration
public class TestTickerConfig {

    @Bean
    public RecordingFunction recordingFunction() {
        return new RecordingFunction();
    }

    @Bean
    public FailingFunction failingFunction() {
        return new FailingFunction();
    }

    @Bean
    public RecordingBatchListener recordingBatchListener() {
        return new RecordingBatchListener();
    }

    public static class RecordingFunction implements TickerFunction {
        public final Queue<TickerContext> contexts = new ConcurrentLinkedQueue<>();
        public final Queue<JsonNode> requests = new ConcurrentLinkedQueue<>();

        @Override
        public void execute(TickerContext context, JsonNode request) {
            contexts.add(context);
            requests.add(request);
        }

        @Override
        public String name() {
            return "record";
        }

        public void reset() {
            contexts.clear();
            requests.clear();
        }
    }

    public static class FailingFunction implements TickerFunction {
        @Override
        public void execute(TickerContext context, JsonNode request) {
            throw new IllegalStateException("boom on attempt " + context.getRetryCount());
        }

        @Override
        public String name() {
            return "fail";
        }
    }

    public static class RecordingBatchListener implements BatchCompletionListener {
        public final Queue<Long> completedParents = new ConcurrentLinkedQueue<>();
        public final Queue<Integer> childCounts = new ConcurrentLinkedQueue<>();

        @Override
        public void onBatchCompleted(TimeTicker parent, List<TimeTicker> children) {
            completedParents.add(parent.getId());
            childCounts.add(children.size());
        }

        public void reset() {
            completedParents.clear();
            childCounts.clear();
        }
    }
}
