package com.github.dimitryivaniuta.essportal.gateway.auth;

import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * SMTP delivery through Spring's {@link JavaMailSender}, off the event loop.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SmtpResetMailer implements ResetMailer {

    private final JavaMailSender mailSender;
    private final PasswordResetProperties properties;

    @Override
    public Mono<Void> send(final ResetMessage message) {
        return Mono.fromCallable(() -> {
                    MimeMessage mime = mailSender.createMimeMessage();
                    MimeMessageHelper helper = new MimeMessageHelper(mime, true, "UTF-8");
                    helper.setFrom(properties.from());
                    helper.setTo(message.to());
                    helper.setSubject(properties.subject());
                    helper.setText(plainText(message), html(message));
                    mailSender.send(mime);
                    log.info("Password reset email sent to {}", message.to());
                    return mime;
                })
                .subscribeOn(Schedulers.boundedElastic())
                .doOnError(MessagingException.class, e -> log.error("Could not build reset email for {}", message.to(), e))
                .then();
    }

    private static String plainText(final ResetMessage message) {
        return "Hello " + message.recipientName() + ",\n\n"
                + "Use the link below to set a new password for your ESS portal account:\n"
                + message.resetLink() + "\n\n"
                + "The link is valid for " + message.validMinutes() + " minutes. "
                + "If you did not request a reset, ignore this email.\n";
    }

    private static String html(final ResetMessage message) {
        String link = HtmlUtils.htmlEscape(message.resetLink());
        return "<p>Hello " + HtmlUtils.htmlEscape(message.recipientName()) + ",</p>"
                + "<p>Use the link below to set a new password for your ESS portal account:</p>"
                + "<p><a href=\"" + link + "\">" + link + "</a></p>"
                + "<p>The link is valid for " + message.validMinutes() + " minutes. "
                + "If you did not request a reset, ignore this email.</p>";
    }
}
