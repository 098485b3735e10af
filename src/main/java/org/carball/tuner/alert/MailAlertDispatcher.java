package org.carball.tuner.alert;

import jakarta.mail.Authenticator;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.PasswordAuthentication;
import jakarta.mail.Session;
import jakarta.mail.Transport;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;
import lombok.extern.slf4j.Slf4j;
import org.carball.tuner.config.MailSettings;
import org.carball.tuner.model.run.AlertEvent;

import java.util.Date;
import java.util.Properties;

/**
 * Sends alerts as plain-text mail over SMTP.
 */
@Slf4j
public class MailAlertDispatcher implements AlertDispatcher {

    @FunctionalInterface
    public interface MessageSender {
        void send(MimeMessage message) throws MessagingException;
    }

    private final MailSettings settings;
    private final MessageSender sender;

    public MailAlertDispatcher(MailSettings settings) {
        this(settings, Transport::send);
    }

    public MailAlertDispatcher(MailSettings settings, MessageSender sender) {
        this.settings = settings;
        this.sender = sender;
    }

    @Override
    public void dispatch(AlertEvent event) {
        if (settings == null || !settings.isConfigured()) {
            log.warn("Mail delivery is not configured; alert not sent: {}", event.subject());
            return;
        }

        try {
            sender.send(buildMessage(event));
            log.info("Alert sent to {}: {}", settings.getRecipient(), event.subject());
        } catch (MessagingException e) {
            throw new DeliveryException("Failed to send alert '" + event.subject() + "' via " + settings.getHost(), e);
        }
    }

    MimeMessage buildMessage(AlertEvent event) throws MessagingException {
        MimeMessage message = new MimeMessage(createSession());
        message.setFrom(new InternetAddress(settings.getSender()));
        message.setRecipients(Message.RecipientType.TO, InternetAddress.parse(settings.getRecipient()));
        message.setSubject(event.subject());
        message.setText(event.body());
        message.setSentDate(Date.from(event.timestamp()));
        return message;
    }

    private Session createSession() {
        Properties properties = new Properties();
        properties.put("mail.smtp.host", settings.getHost());
        properties.put("mail.smtp.port", String.valueOf(settings.getPort()));
        properties.put("mail.smtp.starttls.enable", String.valueOf(settings.isStartTls()));

        if (settings.getUsername() == null || settings.getUsername().isBlank()) {
            return Session.getInstance(properties);
        }

        properties.put("mail.smtp.auth", "true");
        return Session.getInstance(properties, new Authenticator() {
            @Override
            protected PasswordAuthentication getPasswordAuthentication() {
                return new PasswordAuthentication(settings.getUsername(), settings.getPassword());
            }
        });
    }
}
