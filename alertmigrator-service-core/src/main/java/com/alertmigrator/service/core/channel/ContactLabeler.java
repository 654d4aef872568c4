package com.alertmigrator.service.core.channel;

import com.alertmigrator.service.core.support.MigrationConstants;
import com.alertmigrator.service.core.telemetry.MigrationTelemetry;
import com.alertmigrator.service.core.telemetry.MigrationTelemetry.WarningKind;
import com.alertmigrator.unified.model.AlertRule;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Computes the contact-list label routing a rule to the receivers of its legacy channels. Rules that would only
 * reach the default receivers get no label and fall through to the root route.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ContactLabeler {

    private final MigrationTelemetry telemetry;

    public AlertRule apply(AlertRule rule, List<ChannelRef> refs, OrgReceivers receivers) {
        return contactList(rule.title(), refs, receivers)
                .map(value -> rule.withLabel(MigrationConstants.CONTACT_LABEL, value))
                .orElse(rule);
    }

    public Optional<String> contactList(String ruleTitle, List<ChannelRef> refs, OrgReceivers receivers) {
        if (refs.isEmpty()) {
            return Optional.empty();
        }

        Set<String> names = new TreeSet<>();
        for (ChannelRef ref : refs) {
            Optional<String> name = receivers.receiverName(ref);
            if (name.isPresent()) {
                names.add(name.get());
            } else {
                log.warn("Alert linked to obsolete notification channel, ignoring: rule={} channel={}", ruleTitle, ref);
                telemetry.recordWarning(WarningKind.OBSOLETE_CHANNEL_REFERENCE);
            }
        }

        if (names.isEmpty() || receivers.defaultReceiverNames().containsAll(names)) {
            return Optional.empty();
        }
        names.addAll(receivers.defaultReceiverNames());
        return Optional.of(names.stream().map(ReceiverBuilder::quote).collect(Collectors.joining(",")));
    }
}
