package kcs.pricepulse.service.notification;

import java.math.BigDecimal;
import kcs.pricepulse.config.TrackerProperties;
import kcs.pricepulse.exception.NotificationFailureException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.mail.MailException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.stereotype.Component;

/**
 * Plain-text e-mail notifier. Without a configured mail sender or sender address the
 * message is only logged.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MailPriceDropNotifier implements PriceDropNotifier {

    private final ObjectProvider<JavaMailSender> mailSender;
    private final TrackerProperties properties;

    @Override
    public void send(PriceDropMessage message) {
        JavaMailSender sender = mailSender.getIfAvailable();
        String from = properties.getNotification().getFrom();
        if (sender == null || from == null || from.isBlank()) {
            log.info("mail not configured, price drop for alert {} not sent to {}", message.alertId(), message.recipient());
            return;
        }

        SimpleMailMessage mail = new SimpleMailMessage();
        mail.setFrom(from);
        mail.setTo(message.recipient());
        mail.setSubject("Price drop: " + message.productName());
        mail.setText(body(message));
        try {
            sender.send(mail);
        } catch (MailException e) {
            throw NotificationFailureException.of(message.recipient(), e);
        }
        log.info("price drop mail sent: alertId={}, to={}", message.alertId(), message.recipient());
    }

    String body(PriceDropMessage message) {
        return "Good news! " + message.productName() + " is now " + money(message.currentPrice())
                + " (was " + money(message.previousPrice()) + ", your target " + money(message.targetPrice()) + ").\n\n"
                + message.productUrl() + "\n"
                + (message.productImageUrl() == null ? "" : message.productImageUrl() + "\n");
    }

    private String money(long minorUnits) {
        return properties.getNotification().getCurrencySymbol() + BigDecimal.valueOf(minorUnits, 2).toPlainString();
    }
}
