package com.scorebot.app;

import com.scorebot.app.properties.AnalysisProperties;
import com.scorebot.app.properties.DbProperties;
import com.scorebot.app.properties.FeedbackProperties;
import com.scorebot.app.properties.MailProperties;
import com.scorebot.core.RetryPolicy;
import com.scorebot.engine.ai.AiAdvisor;
import com.scorebot.engine.ai.LangChainAiAdvisor;
import com.scorebot.engine.config.Config;
import com.scorebot.engine.data.HttpClientEx;
import com.scorebot.engine.data.PriceHistoryProvider;
import com.scorebot.engine.data.StooqClient;
import com.scorebot.engine.data.UniverseLoader;
import com.scorebot.engine.db.AnalysisRepository;
import com.scorebot.engine.db.AnalysisRunDao;
import com.scorebot.engine.db.Database;
import com.scorebot.engine.db.InMemoryAnalysisRepository;
import com.scorebot.engine.db.MigrationRunner;
import com.scorebot.engine.db.TuningParameterDao;
import com.scorebot.engine.news.NewsProvider;
import com.scorebot.engine.news.RssNewsProvider;
import com.scorebot.engine.output.MailNotifier;
import com.scorebot.engine.output.Mailer;
import com.scorebot.engine.output.Notifier;
import com.scorebot.engine.query.AnalysisQueryService;
import com.scorebot.engine.runner.DecisionPipeline;
import com.scorebot.engine.runner.ScoreBotEngine;
import com.scorebot.engine.tuning.InMemoryParameterStore;
import com.scorebot.engine.tuning.ParameterStore;
import com.scorebot.engine.tuning.TuningFeedbackLoop;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.context.properties.bind.Bindable;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;
import org.springframework.core.env.Environment;

import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.Map;

@Configuration
@EnableConfigurationProperties({DbProperties.class, AnalysisProperties.class, FeedbackProperties.class, MailProperties.class})
public class ScoreBotBootstrapConfig {
    /**
     * Set by the CLI for {@code --dry-run}: in-memory stores, no database connection.
     */
    public static final String DRY_RUN_KEY = "app.dry_run";

    @Bean
    public Config scoreBotConfig(Environment environment) {
        Map<String, Object> rawProperties = Binder.get(environment)
                .bind("", Bindable.mapOf(String.class, Object.class))
                .orElseGet(Map::of);
        Path workingDir = Path.of(".").toAbsolutePath().normalize();
        return Config.fromConfigurationProperties(workingDir, rawProperties);
    }

    @Bean
    @Lazy
    public Database database(DbProperties dbProperties) {
        Database database = new Database(
                readDbUrl(dbProperties),
                readDbUser(dbProperties),
                readDbPass(dbProperties),
                readDbSchema(dbProperties),
                isSqlLogEnabled(dbProperties)
        );
        try {
            new MigrationRunner().run(database);
        } catch (Exception e) {
            throw new IllegalStateException("Database migration failed: " + e.getMessage(), e);
        }
        return database;
    }

    @Bean
    public ParameterStore parameterStore(Config config, ObjectProvider<Database> database) {
        if (isDryRun(config)) {
            return new InMemoryParameterStore();
        }
        return new TuningParameterDao(database.getObject());
    }

    @Bean
    public AnalysisRepository analysisRepository(Config config, ObjectProvider<Database> database) {
        if (isDryRun(config)) {
            return new InMemoryAnalysisRepository();
        }
        return new AnalysisRunDao(database.getObject());
    }

    @Bean
    public AnalysisQueryService analysisQueryService(AnalysisRepository analysisRepository) {
        return new AnalysisQueryService(analysisRepository);
    }

    @Bean
    public DecisionPipeline.Settings pipelineSettings(AnalysisProperties analysis) {
        DecisionPipeline.Settings settings = new DecisionPipeline.Settings();
        settings.threads = Math.max(1, analysis.getThreads());
        settings.historyBufferDays = Math.max(0, analysis.getHistoryBufferDays());
        settings.pricePolicy = policyOf(analysis.getPrice());
        settings.newsPolicy = policyOf(analysis.getNews());
        settings.aiPolicy = policyOf(analysis.getAi());
        return settings;
    }

    @Bean
    public TuningFeedbackLoop.Settings feedbackSettings(FeedbackProperties feedback, AnalysisProperties analysis) {
        TuningFeedbackLoop.Settings settings = new TuningFeedbackLoop.Settings();
        settings.maturityDays = Math.max(0, feedback.getMaturityDays());
        settings.batchLimit = Math.max(1, feedback.getBatchLimit());
        settings.pricePolicy = policyOf(analysis.getPrice());
        settings.aiPolicy = policyOf(analysis.getAi());
        return settings;
    }

    @Bean
    public Mailer.Settings mailSettings(Config config, MailProperties mailProperties) {
        Mailer.Settings settings = new Mailer().loadSettings(config);
        if (isDryRun(config) || Boolean.TRUE.equals(mailProperties.getDryRun())) {
            settings.dryRun = true;
        }
        String dryRunDir = mailProperties.getDryRunDir();
        if (dryRunDir != null && !dryRunDir.trim().isEmpty()) {
            settings.dryRunDir = config.workingDir().resolve(dryRunDir.trim()).normalize();
        }
        return settings;
    }

    @Bean
    public ScoreBotEngine scoreBotEngine(
            Config config,
            ParameterStore parameterStore,
            AnalysisRepository analysisRepository,
            DecisionPipeline.Settings pipelineSettings,
            TuningFeedbackLoop.Settings feedbackSettings,
            Mailer.Settings mailSettings
    ) {
        HttpClientEx http = new HttpClientEx();
        PriceHistoryProvider prices = new StooqClient(config, http);
        NewsProvider news = new RssNewsProvider(config, http);
        AiAdvisor ai = new LangChainAiAdvisor(config);
        Notifier notifier = new MailNotifier(new Mailer(), mailSettings);
        return new ScoreBotEngine(
                new UniverseLoader(config).load(),
                readSeedDate(config),
                parameterStore,
                analysisRepository,
                prices,
                news,
                ai,
                notifier,
                Clock.systemUTC(),
                scheduleZone(config),
                pipelineSettings,
                feedbackSettings
        );
    }

    static ZoneId scheduleZone(Config config) {
        return ZoneId.of(config.getString("schedule.zone", "UTC"));
    }

    static boolean isDryRun(Config config) {
        return config.getBoolean(DRY_RUN_KEY, false);
    }

    private static RetryPolicy policyOf(AnalysisProperties.Call call) {
        if (call == null) {
            return RetryPolicy.once();
        }
        return new RetryPolicy(call.getRetry().getMax(), call.getRetry().getBackoffMs(), call.getTimeoutMs());
    }

    private static LocalDate readSeedDate(Config config) {
        String raw = config.getString("tuning.seed_date", "2000-01-01");
        try {
            return LocalDate.parse(raw);
        } catch (DateTimeParseException e) {
            throw new IllegalStateException("invalid tuning.seed_date: " + raw, e);
        }
    }

    private String readDbUrl(DbProperties dbProperties) {
        return firstNonBlank(
                System.getenv("SCOREBOT_DB_URL"),
                dbProperties == null ? null : dbProperties.getUrl(),
                "jdbc:postgresql://localhost:5432/scorebot"
        );
    }

    private String readDbUser(DbProperties dbProperties) {
        return firstNonBlank(
                System.getenv("SCOREBOT_DB_USER"),
                dbProperties == null ? null : dbProperties.getUser(),
                "scorebot"
        );
    }

    private String readDbPass(DbProperties dbProperties) {
        return firstNonBlank(
                System.getenv("SCOREBOT_DB_PASS"),
                dbProperties == null ? null : dbProperties.getPass(),
                "scorebot"
        );
    }

    private String readDbSchema(DbProperties dbProperties) {
        return firstNonBlank(
                dbProperties == null ? null : dbProperties.getSchema(),
                "scorebot"
        );
    }

    private boolean isSqlLogEnabled(DbProperties dbProperties) {
        if (dbProperties == null || dbProperties.getSqlLog() == null) {
            return true;
        }
        return dbProperties.getSqlLog().isEnabled();
    }

    private String firstNonBlank(String... values) {
        for (String value : values) {
            if (value == null) {
                continue;
            }
            String trimmed = value.trim();
            if (!trimmed.isEmpty()) {
                return trimmed;
            }
        }
        return "";
    }
}
