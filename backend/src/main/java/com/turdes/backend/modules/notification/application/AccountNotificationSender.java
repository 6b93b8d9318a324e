package com.turdes.backend.modules.notification.application;

/**
 * Delivers account e-mails. Implementations may throw; callers treat every send as best effort.
 */
public interface AccountNotificationSender {

    void sendVerification(String recipient, String name, String verificationUrl);

    void sendPasswordReset(String recipient, String name, String resetUrl);

    void sendWelcome(String recipient, String name);

    static String greeting(String name) {
        return (name == null || name.isBlank()) ? "Dear user" : "Dear " + name;
    }
}
