package fr.tictak.pulse.service.channel;

import fr.tictak.pulse.config.webSocket.SessionMessenger;
import fr.tictak.pulse.dto.out.PushEnvelope;
import fr.tictak.pulse.model.Notification;
import fr.tictak.pulse.model.enums.DeliveryChannel;
import org.springframework.stereotype.Component;

/**
 * Pushes the notification to every live session of the owner. Users without a live session simply miss the push;
 * the notification is still stored and listed.
 */
@Component
public class InAppChannelSender implements ChannelSender {

    private final SessionMessenger messenger;

    public InAppChannelSender(SessionMessenger messenger) {
        this.messenger = messenger;
    }

    @Override
    public DeliveryChannel channel() {
        return DeliveryChannel.IN_APP;
    }

    @Override
    public boolean isEnabled() {
        return true;
    }

    @Override
    public void deliver(Notification notification) {
        messenger.toUser(notification.getUserId(), PushEnvelope.notification(notification));
    }
}
