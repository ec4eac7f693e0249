package com.scorebot.engine.output;

import com.scorebot.engine.config.Config;
import jakarta.mail.MessagingException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MailerTest {

    @TempDir
    Path tempDir;

    @Test
    void loadSettings_shouldReadEmailKeys() {
        Mailer.Settings settings = new Mailer().loadSettings(Config.of(Map.of(
                "email.smtp_user", "bot@example.com",
                "email.to", "a@example.com, b@example.com",
                "email.smtp_port", "465"
        )));

        assertTrue(settings.enabled);
        assertEquals(465, settings.port);
        assertEquals("bot@example.com", settings.from);
        assertEquals(List.of("a@example.com", "b@example.com"), settings.to);
        assertFalse(settings.dryRun);
    }

    @Test
    void send_shouldWriteEmlInDryRun() throws Exception {
        Mailer.Settings settings = dryRunSettings();

        assertTrue(new Mailer().send(settings, "Low-risk signal: AAPL", "RSI oversold."));

        List<Path> files = listFiles();
        assertEquals(1, files.size());
        String eml = Files.readString(files.get(0), StandardCharsets.UTF_8);
        assertTrue(eml.contains("Subject: [ScoreBot] Low-risk signal: AAPL"));
        assertTrue(eml.endsWith("RSI oversold."));
    }

    @Test
    void send_shouldSkipWhenDisabled() throws Exception {
        Mailer.Settings settings = dryRunSettings();
        settings.enabled = false;

        assertFalse(new Mailer().send(settings, "s", "t"));
        assertFalse(Files.exists(tempDir.resolve("mail")));
    }

    @Test
    void send_shouldRejectIncompleteSmtpSettings() {
        Mailer.Settings settings = new Mailer().loadSettings(Config.of(Map.of()));

        assertThrows(MessagingException.class, () -> new Mailer().send(settings, "s", "t"));
    }

    @Test
    void sendNotification_shouldReportFailureInsteadOfThrowing() throws Exception {
        Mailer.Settings incomplete = new Mailer().loadSettings(Config.of(Map.of()));
        assertFalse(new MailNotifier(new Mailer(), incomplete).sendNotification("AAPL", "why"));

        assertTrue(new MailNotifier(new Mailer(), dryRunSettings()).sendNotification("AAPL", "Earnings beat."));
        String eml = Files.readString(listFiles().get(0), StandardCharsets.UTF_8);
        assertTrue(eml.contains("Ticker: AAPL"));
        assertTrue(eml.contains("Earnings beat."));
    }

    private Mailer.Settings dryRunSettings() {
        Mailer.Settings settings = new Mailer().loadSettings(Config.of(Map.of("email.to", "ops@example.com")));
        settings.dryRun = true;
        settings.dryRunDir = tempDir.resolve("mail");
        return settings;
    }

    private List<Path> listFiles() throws Exception {
        try (Stream<Path> stream = Files.list(tempDir.resolve("mail"))) {
            return stream.sorted().collect(Collectors.toList());
        }
    }
}
