package fr.tictak.pulse.service.channel;

import fr.tictak.pulse.model.Notification;
import fr.tictak.pulse.model.enums.DeliveryChannel;

/**
 * One delivery channel. Implementations must not let a delivery failure escape past the dispatcher's
 * per-channel isolation; out-of-band channels run asynchronously and log their own failures.
 */
public interface ChannelSender {

    DeliveryChannel channel();

    /**
     * Whether the channel is configured on this deployment. A disabled channel is skipped silently.
     */
    boolean isEnabled();

    void deliver(Notification notification);
}
