package com.scorebot.app;

import com.scorebot.engine.config.Config;
import com.scorebot.engine.db.AnalysisRepository;
import com.scorebot.engine.db.InMemoryAnalysisRepository;
import com.scorebot.engine.output.Mailer;
import com.scorebot.engine.runner.DecisionPipeline;
import com.scorebot.engine.runner.ScoreBotEngine;
import com.scorebot.engine.tuning.InMemoryParameterStore;
import com.scorebot.engine.tuning.ParameterStore;
import com.scorebot.engine.tuning.TuningFeedbackLoop;
import org.junit.jupiter.api.Test;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;

import java.time.ZoneId;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScoreBotBootstrapConfigTest {

    @Test
    void createContext_shouldWireInMemoryStoresForDryRun() {
        Config fileConfig = Config.of(Map.of(
                "analysis.universe", "aapl,MSFT",
                "analysis.threads", "2",
                "analysis.price.retry.max", "5",
                "feedback.maturity_days", "3",
                "schedule.zone", "Asia/Tokyo"
        ));

        try (AnnotationConfigApplicationContext context = ScoreBotApplication.createContext(fileConfig, true)) {
            assertInstanceOf(InMemoryParameterStore.class, context.getBean(ParameterStore.class));
            assertInstanceOf(InMemoryAnalysisRepository.class, context.getBean(AnalysisRepository.class));

            DecisionPipeline.Settings pipeline = context.getBean(DecisionPipeline.Settings.class);
            assertEquals(2, pipeline.threads);
            assertEquals(5, pipeline.pricePolicy.maxAttempts());
            assertEquals(2, pipeline.newsPolicy.maxAttempts());
            assertEquals(3, context.getBean(TuningFeedbackLoop.Settings.class).maturityDays);
            assertTrue(context.getBean(Mailer.Settings.class).dryRun);

            Config config = context.getBean(Config.class);
            assertTrue(ScoreBotBootstrapConfig.isDryRun(config));
            assertEquals(ZoneId.of("Asia/Tokyo"), ScoreBotBootstrapConfig.scheduleZone(config));
            assertEquals(List.of("AAPL", "MSFT"), context.getBean(ScoreBotEngine.class).universe());
        }
    }
}
