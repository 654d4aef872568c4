package com.alertmigrator.service.core.channel;

import com.alertmigrator.legacy.model.DashboardAlertSettings.NotificationRef;
import com.alertmigrator.legacy.model.NotificationChannel;
import java.util.Collection;
import java.util.Optional;

/**
 * A legacy alert's reference to a notification channel: the channel UID, or its numeric id when the alert only knows
 * the id and no channel with that id carries a UID. The two kinds never compare equal, so a UID that happens to look
 * numeric cannot stand in for an id.
 */
public record ChannelRef(Kind kind, String value) {

    public enum Kind {
        UID,
        ID
    }

    public ChannelRef {
        if (kind == null) {
            throw new IllegalArgumentException("channel reference kind must be set");
        }
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException("channel reference must not be empty");
        }
    }

    public static ChannelRef ofUid(String uid) {
        return new ChannelRef(Kind.UID, uid);
    }

    public static ChannelRef ofId(long id) {
        return new ChannelRef(Kind.ID, Long.toString(id));
    }

    /** Resolves an id reference to the channel's UID where possible; empty when the reference carries neither. */
    public static Optional<ChannelRef> from(NotificationRef ref, Collection<NotificationChannel> channels) {
        if (ref == null) {
            return Optional.empty();
        }
        if (ref.id() != null && ref.id() > 0) {
            long id = ref.id();
            return Optional.of(channels.stream()
                    .filter(c -> c.id() == id && c.hasUid())
                    .findFirst()
                    .map(c -> ofUid(c.uid()))
                    .orElseGet(() -> ofId(id)));
        }
        if (ref.uid() != null && !ref.uid().isEmpty()) {
            return Optional.of(ofUid(ref.uid()));
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return kind == Kind.ID ? "id:" + value : value;
    }
}
