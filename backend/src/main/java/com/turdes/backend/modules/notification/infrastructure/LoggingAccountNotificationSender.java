package com.turdes.backend.modules.notification.infrastructure;

import com.turdes.backend.modules.notification.application.AccountNotificationSender;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Sender used when SMTP delivery is off. Links carry one-time tokens, so only the recipient and the
 * kind of message are logged.
 */
@Component
@ConditionalOnProperty(prefix = "auth.mail", name = "enabled", havingValue = "false", matchIfMissing = true)
public class LoggingAccountNotificationSender implements AccountNotificationSender {

    private static final Logger log = LoggerFactory.getLogger(LoggingAccountNotificationSender.class);

    @Override
    public void sendVerification(String recipient, String name, String verificationUrl) {
        log.info("[mail disabled] verification message for {}", recipient);
    }

    @Override
    public void sendPasswordReset(String recipient, String name, String resetUrl) {
        log.info("[mail disabled] password reset message for {}", recipient);
    }

    @Override
    public void sendWelcome(String recipient, String name) {
        log.info("[mail disabled] welcome message for {}", recipient);
    }
}
