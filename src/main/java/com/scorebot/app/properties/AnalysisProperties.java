package com.scorebot.app.properties;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@ConfigurationProperties(prefix = "analysis")
public class AnalysisProperties {
    private List<String> universe = new ArrayList<>();
    private String universeFile = "";
    private int threads = 4;
    private int historyBufferDays = 20;
    private Call price = new Call(3, 400L, 20_000L);
    private Call news = new Call(2, 300L, 15_000L);
    private Call ai = new Call(1, 0L, 180_000L);

    /**
     * Retry and timeout settings of one collaborator call.
     */
    @Getter
    @Setter
    public static class Call {
        private Retry retry = new Retry();
        private long timeoutMs;

        public Call() {
        }

        public Call(int max, long backoffMs, long timeoutMs) {
            this.retry.setMax(max);
            this.retry.setBackoffMs(backoffMs);
            this.timeoutMs = timeoutMs;
        }
    }

    @Getter
    @Setter
    public static class Retry {
        private int max = 1;
        private long backoffMs;
    }
}
