package com.alertmigrator.service.core.rule;

import com.alertmigrator.service.core.channel.ChannelRef;
import com.alertmigrator.unified.model.AlertRule;
import java.util.List;

/** A migrated rule and the legacy channels it notified, routed once receivers exist. */
public record TranslatedAlert(AlertRule rule, List<ChannelRef> channels) {
    public TranslatedAlert {
        channels = List.copyOf(channels);
    }
}
