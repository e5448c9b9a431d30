package villagecompute.portfolio.services;

import io.quarkus.mailer.Mail;
import io.quarkus.mailer.Mailer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import villagecompute.portfolio.config.ContactSecurityConfig;
import villagecompute.portfolio.data.models.ContactMessage;

import java.util.Optional;

/**
 * Outbound email for accepted contact messages.
 *
 * <p>
 * Sends a plain-text notification to the site owner and, when enabled, a confirmation to the submitter. Only messages
 * that were accepted and not flagged as spam reach this service. Delivery failures are logged and swallowed; the
 * message is already stored and visible in the admin inbox.
 */
@ApplicationScoped
public class ContactNotificationService {

    private static final Logger LOG = Logger.getLogger(ContactNotificationService.class);

    @Inject
    Mailer mailer;

    @Inject
    ContactSecurityConfig config;

    @ConfigProperty(
            name = "contact.notify.site-name",
            defaultValue = "Portfolio")
    String siteName;

    /**
     * Notifies the owner and confirms receipt to the submitter.
     *
     * @param message
     *            stored, non-spam message
     * @return true if the owner notification was sent
     */
    public boolean notifyNewMessage(ContactMessage message) {
        boolean ownerNotified = sendOwnerNotification(message);
        if (config.isSendConfirmation()) {
            sendConfirmation(message);
        }
        return ownerNotified;
    }

    private boolean sendOwnerNotification(ContactMessage message) {
        Optional<String> ownerEmail = config.getOwnerEmail();
        if (ownerEmail.isEmpty()) {
            LOG.debugf("No owner email configured, skipping notification for message %s", message.id);
            return false;
        }

        String subject = "[" + siteName + "] New contact message"
                + (message.subject != null && !message.subject.isBlank() ? ": " + message.subject : "");
        String text = "From: " + message.name + " <" + message.email + ">\n" + "Received: " + message.createdAt + "\n"
                + String.format("Spam score: %.2f", message.spamScore) + "\n\n" + message.body + "\n";

        try {
            mailer.send(Mail.withText(ownerEmail.get(), subject, text).setReplyTo(message.email));
            LOG.infof("Sent contact notification: messageId=%s", message.id);
            return true;
        } catch (Exception e) {
            LOG.errorf(e, "Failed to send contact notification: messageId=%s", message.id);
            return false;
        }
    }

    private void sendConfirmation(ContactMessage message) {
        String subject = "Thanks for reaching out to " + siteName;
        String text = "Hi " + message.name + ",\n\n" + "Thanks for your message. It has been received and you will get a"
                + " reply as soon as possible.\n\n" + "-- " + siteName + "\n";

        try {
            mailer.send(Mail.withText(message.email, subject, text));
            LOG.debugf("Sent contact confirmation: messageId=%s", message.id);
        } catch (Exception e) {
            LOG.errorf(e, "Failed to send contact confirmation: messageId=%s", message.id);
        }
    }
}
