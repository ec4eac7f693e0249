package com.scorebot.engine.output;

import jakarta.mail.MessagingException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

public final class MailNotifier implements Notifier {
    private static final Logger LOG = LogManager.getLogger(MailNotifier.class);

    private final Mailer mailer;
    private final Mailer.Settings settings;

    public MailNotifier(Mailer mailer, Mailer.Settings settings) {
        this.mailer = mailer;
        this.settings = settings;
    }

    @Override
    public boolean sendNotification(String ticker, String rationale) {
        String subject = "Low-risk signal: " + ticker;
        String body = "Ticker: " + ticker + "\nRisk: none\n\n" + (rationale == null ? "" : rationale) + "\n";
        try {
            return mailer.send(settings, subject, body);
        } catch (MessagingException e) {
            LOG.warn("Notification failed ticker={} err={}", ticker, e.getMessage());
            return false;
        }
    }
}
