package com.turdes.backend.modules.notification.infrastructure;

import com.turdes.backend.global.config.AuthProperties;
import com.turdes.backend.modules.notification.application.AccountNotificationSender;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(prefix = "auth.mail", name = "enabled", havingValue = "true")
public class MailAccountNotificationSender implements AccountNotificationSender {

    private static final Logger log = LoggerFactory.getLogger(MailAccountNotificationSender.class);

    private final JavaMailSender mailSender;
    private final String from;

    public MailAccountNotificationSender(JavaMailSender mailSender, AuthProperties properties) {
        this.mailSender = mailSender;
        this.from = properties.mail().from();
    }

    @Override
    public void sendVerification(String recipient, String name, String verificationUrl) {
        send(recipient, "Verify your e-mail address",
                AccountNotificationSender.greeting(name) + ",\n\n"
                        + "Please confirm your e-mail address by opening the link below:\n"
                        + verificationUrl + "\n\n"
                        + "The link expires soon. If you did not create an account, ignore this message.");
    }

    @Override
    public void sendPasswordReset(String recipient, String name, String resetUrl) {
        send(recipient, "Reset your password",
                AccountNotificationSender.greeting(name) + ",\n\n"
                        + "A password reset was requested for your account. Use the link below to choose a new password:\n"
                        + resetUrl + "\n\n"
                        + "If you did not request this, you can ignore this message.");
    }

    @Override
    public void sendWelcome(String recipient, String name) {
        send(recipient, "Welcome to Turdes",
                AccountNotificationSender.greeting(name) + ",\n\n"
                        + "Your e-mail address is confirmed and your account is ready to use.");
    }

    private void send(String recipient, String subject, String text) {
        SimpleMailMessage message = new SimpleMailMessage();
        message.setFrom(from);
        message.setTo(recipient);
        message.setSubject(subject);
        message.setText(text);
        mailSender.send(message);
        log.info("Sent '{}' mail to {}", subject, recipient);
    }
}
