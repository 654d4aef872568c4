package com.alertmigrator.service.core.channel;

import com.alertmigrator.unified.model.AlertmanagerUserConfig;
import com.alertmigrator.unified.model.AlertmanagerUserConfig.AlertingConfig;
import com.alertmigrator.unified.model.Receiver;
import com.alertmigrator.unified.model.Route;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Receivers and routing tree built from an org's channels.
 *
 * @param receiverNamesByRef receiver name keyed by legacy channel UID and by channel id
 * @param defaultReceiverNames receivers of the channels flagged as default
 */
public record OrgReceivers(
        List<Receiver> receivers,
        Route route,
        Map<ChannelRef, String> receiverNamesByRef,
        Set<String> defaultReceiverNames) {

    public OrgReceivers {
        receivers = List.copyOf(receivers);
        receiverNamesByRef = Map.copyOf(receiverNamesByRef);
        defaultReceiverNames = Set.copyOf(defaultReceiverNames);
    }

    public Optional<String> receiverName(ChannelRef ref) {
        return Optional.ofNullable(receiverNamesByRef.get(ref));
    }

    public AlertmanagerUserConfig toConfig() {
        return new AlertmanagerUserConfig(Map.of(), new AlertingConfig(route, receivers));
    }
}
