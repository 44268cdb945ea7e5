package com.tasknest.todoservice.utils;

import com.tasknest.todoservice.config.AppProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.mail.MailException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Outbound link mails. Sent on the async executor; a delivery failure is logged
 * and never reaches the request that triggered it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EmailTemplate {

    private final JavaMailSender mailSender;
    private final AppProperties appProperties;

    @Async
    public void sendVerificationLink(String to, String token) {
        String link = appProperties.getPublicBaseUrl() + "/auth/verify/" + token;
        send(to, "Verify your TaskNest account",
                "Welcome to TaskNest!\n\nConfirm your email address by opening:\n" + link
                        + "\n\nIf you did not sign up, ignore this message.");
    }

    @Async
    public void sendPasswordResetLink(String to, String token) {
        String link = appProperties.getPublicBaseUrl() + "/auth/password-reset/" + token;
        send(to, "Reset your TaskNest password",
                "A password reset was requested for your account.\n\nSubmit your new password to:\n" + link
                        + "\n\nThe link expires shortly. If this was not you, ignore this message.");
    }

    private void send(String to, String subject, String text) {
        SimpleMailMessage message = new SimpleMailMessage();
        message.setFrom(appProperties.getMail().getFrom());
        message.setTo(to);
        message.setSubject(subject);
        message.setText(text);
        try {
            mailSender.send(message);
            log.debug("Mail '{}' sent to {}", subject, to);
        } catch (MailException e) {
            log.warn("Mail '{}' to {} failed: {}", subject, to, e.getMessage());
        }
    }
}
