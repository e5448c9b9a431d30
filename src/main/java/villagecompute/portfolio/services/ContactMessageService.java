package villagecompute.portfolio.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;
import villagecompute.portfolio.api.types.ContactMessageType;
import villagecompute.portfolio.api.types.SpamSignalType;
import villagecompute.portfolio.data.models.ContactMessage;
import villagecompute.portfolio.exceptions.ResourceNotFoundException;
import villagecompute.portfolio.services.SpamScoringService.SpamAnalysis;

import java.util.List;
import java.util.UUID;

/**
 * Admin inbox operations on stored contact messages.
 */
@ApplicationScoped
public class ContactMessageService {

    private static final Logger LOG = Logger.getLogger(ContactMessageService.class);

    static final int MAX_PAGE_SIZE = 100;

    @Inject
    SpamScoringService spamScoringService;

    public List<ContactMessageType> list(Boolean spam, int page, int size) {
        int safePage = Math.max(0, page);
        int safeSize = Math.min(Math.max(1, size), MAX_PAGE_SIZE);
        return ContactMessage.findPage(spam, safePage, safeSize).stream().map(ContactMessageType::fromEntity).toList();
    }

    public long countUnread() {
        return ContactMessage.countUnread();
    }

    /**
     * Loads one message with its spam signals recomputed for diagnostics.
     *
     * <p>
     * The stored score and spam flag are returned untouched; the recomputed score and signals reflect the current
     * heuristics and are labelled as such in the response.
     *
     * @throws ResourceNotFoundException
     *             if no message has this id
     */
    public ContactMessageType get(UUID id) {
        ContactMessage message = require(id);
        SpamAnalysis analysis = spamScoringService.analyze(message.name, message.email, message.subject,
                message.body);
        List<SpamSignalType> signals = analysis.triggeredSignals().stream().map(SpamSignalType::fromSignal).toList();
        return ContactMessageType.withDiagnostics(message, signals, analysis.score());
    }

    @Transactional
    public ContactMessageType markAsRead(UUID id) {
        ContactMessage message = require(id);
        message.markAsRead();
        LOG.infof("Contact message marked as read: id=%s", id);
        return ContactMessageType.fromEntity(message);
    }

    @Transactional
    public void delete(UUID id) {
        ContactMessage message = require(id);
        message.delete();
        LOG.infof("Contact message deleted: id=%s", id);
    }

    private static ContactMessage require(UUID id) {
        ContactMessage message = ContactMessage.findById(id);
        if (message == null) {
            throw new ResourceNotFoundException("Contact message not found: " + id);
        }
        return message;
    }
}
