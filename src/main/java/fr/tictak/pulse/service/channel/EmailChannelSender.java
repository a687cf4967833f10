package fr.tictak.pulse.service.channel;

import fr.tictak.pulse.config.AsyncConfig;
import fr.tictak.pulse.config.PulseProperties;
import fr.tictak.pulse.model.Notification;
import fr.tictak.pulse.model.NotificationRecipient;
import fr.tictak.pulse.model.enums.DeliveryChannel;
import fr.tictak.pulse.repository.NotificationRecipientRepository;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.thymeleaf.context.Context;
import org.thymeleaf.spring6.SpringTemplateEngine;

@Component
public class EmailChannelSender implements ChannelSender {

    private static final Logger log = LoggerFactory.getLogger(EmailChannelSender.class);
    static final String TEMPLATE = "notification-email";

    private final JavaMailSender mailSender;
    private final SpringTemplateEngine templateEngine;
    private final NotificationRecipientRepository recipientRepository;
    private final PulseProperties properties;

    public EmailChannelSender(JavaMailSender mailSender, SpringTemplateEngine templateEngine,
                              NotificationRecipientRepository recipientRepository, PulseProperties properties) {
        this.mailSender = mailSender;
        this.templateEngine = templateEngine;
        this.recipientRepository = recipientRepository;
        this.properties = properties;
    }

    @Override
    public DeliveryChannel channel() {
        return DeliveryChannel.EMAIL;
    }

    @Override
    public boolean isEnabled() {
        return properties.getChannels().getEmail().isEnabled();
    }

    @Async(AsyncConfig.CHANNEL_EXECUTOR)
    @Override
    public void deliver(Notification notification) {
        String userId = notification.getUserId();
        NotificationRecipient recipient = recipientRepository.findById(userId).orElse(null);
        if (recipient == null || recipient.getEmail() == null || recipient.getEmail().isBlank()) {
            log.warn("No e-mail address registered for user {}, skipping e-mail delivery", userId);
            return;
        }

        Context context = new Context();
        context.setVariable("title", notification.getTitle());
        context.setVariable("message", notification.getMessage());
        context.setVariable("type", notification.getType() != null ? notification.getType().getLabel() : "");
        context.setVariable("createdAt", notification.getCreatedAt());
        context.setVariable("actionUrl", notification.getMetadata() != null
                ? notification.getMetadata().get(Notification.ACTION_URL_KEY) : null);

        try {
            String htmlContent = templateEngine.process(TEMPLATE, context);
            MimeMessage mimeMessage = mailSender.createMimeMessage();
            MimeMessageHelper helper = new MimeMessageHelper(mimeMessage, true, "UTF-8");
            helper.setFrom(properties.getChannels().getEmail().getFrom());
            helper.setTo(recipient.getEmail());
            helper.setSubject(notification.getTitle());
            helper.setText(htmlContent, true);
            mailSender.send(mimeMessage);
            log.info("E-mail notification {} sent to user {}", notification.getId(), userId);
        } catch (MessagingException | MailException e) {
            log.error("Failed to send e-mail notification {} to user {}: {}", notification.getId(), userId, e.getMessage());
        }
    }
}
