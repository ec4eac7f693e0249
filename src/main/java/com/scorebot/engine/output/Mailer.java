package com.scorebot.engine.output;

import com.scorebot.engine.config.Config;
import jakarta.mail.Authenticator;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.PasswordAuthentication;
import jakarta.mail.Session;
import jakarta.mail.Transport;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * SMTP sender with a dry-run mode that writes the message to files instead.
 */
public final class Mailer {
    private static final Logger LOG = LogManager.getLogger(Mailer.class);
    private static final AtomicInteger DRY_RUN_SEQ = new AtomicInteger(0);

    public static final class Settings {
        public boolean enabled;
        public String host;
        public int port;
        public String user;
        public String pass;
        public String from;
        public List<String> to;
        public String subjectPrefix;
        public boolean dryRun;
        public Path dryRunDir;
    }

    public Settings loadSettings(Config config) {
        Settings settings = new Settings();
        settings.enabled = config.getBoolean("email.enabled", true);
        settings.host = config.getString("email.smtp_host", "smtp.gmail.com");
        settings.port = config.getInt("email.smtp_port", 587);
        settings.user = config.getString("email.smtp_user", "");
        settings.pass = config.getString("email.smtp_pass", "");
        settings.from = config.getString("email.from", settings.user);
        settings.to = config.getList("email.to");
        settings.subjectPrefix = config.getString("email.subject_prefix", "[ScoreBot]");
        settings.dryRun = config.getBoolean("mail.dry_run", false);
        settings.dryRunDir = config.getPath("mail.dry_run_dir");
        return settings;
    }

    /**
     * @return false when mail is disabled
     * @throws MessagingException when the message could not be delivered or written
     */
    public boolean send(Settings s, String subject, String textBody) throws MessagingException {
        if (!s.enabled) {
            return false;
        }
        String safeSubject = safe(s.subjectPrefix).isEmpty() ? safe(subject) : s.subjectPrefix + " " + safe(subject);
        String safeText = safe(textBody);

        if (s.dryRun) {
            try {
                Path written = writeDryRunArtifact(s, safeSubject, safeText);
                LOG.info("Mail dry-run saved. file={}", written.toAbsolutePath());
                return true;
            } catch (IOException e) {
                throw new MessagingException("mail dry-run write failed dir=" + s.dryRunDir, e);
            }
        }

        if (isBlank(s.host) || isBlank(s.user) || isBlank(s.pass) || s.to == null || s.to.isEmpty()) {
            throw new MessagingException("email enabled but smtp settings are incomplete smtp="
                    + safe(s.host) + ":" + s.port + " to=" + maskAddresses(s.to));
        }

        Properties props = new Properties();
        props.put("mail.smtp.auth", "true");
        props.put("mail.smtp.starttls.enable", "true");
        props.put("mail.smtp.host", s.host);
        props.put("mail.smtp.port", String.valueOf(s.port));

        Session session = Session.getInstance(props, new Authenticator() {
            @Override
            protected PasswordAuthentication getPasswordAuthentication() {
                return new PasswordAuthentication(s.user, s.pass);
            }
        });

        MimeMessage message = new MimeMessage(session);
        message.setFrom(new InternetAddress(isBlank(s.from) ? s.user : s.from));
        String toJoined = s.to.stream().map(String::trim).filter(v -> !v.isEmpty()).collect(Collectors.joining(","));
        message.setRecipients(Message.RecipientType.TO, InternetAddress.parse(toJoined));
        message.setSubject(safeSubject, "UTF-8");
        message.setText(safeText, "UTF-8");
        Transport.send(message);
        LOG.info("Mail sent subject={} to={}", safeSubject, maskAddresses(s.to));
        return true;
    }

    private Path writeDryRunArtifact(Settings s, String subject, String textBody) throws IOException {
        Files.createDirectories(s.dryRunDir);
        String stamp = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneId.systemDefault()).format(Instant.now());
        Path emlPath = s.dryRunDir.resolve("mail_" + stamp + "_" + DRY_RUN_SEQ.incrementAndGet() + ".eml");
        String eml = "From: " + safe(s.from) + "\n"
                + "To: " + (s.to == null ? "" : String.join(",", s.to)) + "\n"
                + "Subject: " + subject + "\n"
                + "MIME-Version: 1.0\n"
                + "Content-Type: text/plain; charset=UTF-8\n\n"
                + textBody;
        Files.writeString(emlPath, eml, StandardCharsets.UTF_8);
        return emlPath;
    }

    private String maskAddresses(List<String> to) {
        if (to == null || to.isEmpty()) {
            return "";
        }
        return to.stream().map(this::maskAddress).collect(Collectors.joining(","));
    }

    private String maskAddress(String raw) {
        String value = safe(raw);
        int at = value.indexOf('@');
        if (at <= 0) {
            return value;
        }
        String local = value.substring(0, at);
        String domain = value.substring(at + 1);
        if (local.length() <= 1) {
            return "*@" + domain;
        }
        return local.substring(0, 1) + "***@" + domain;
    }

    private static String safe(String value) {
        return value == null ? "" : value;
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
