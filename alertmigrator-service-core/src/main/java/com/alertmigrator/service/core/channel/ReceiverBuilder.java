package com.alertmigrator.service.core.channel;

import static com.alertmigrator.service.core.support.MigrationConstants.ALERT_NAME_LABEL;
import static com.alertmigrator.service.core.support.MigrationConstants.CONTACT_LABEL;
import static com.alertmigrator.service.core.support.MigrationConstants.DEFAULT_RECEIVER_NAME;
import static com.alertmigrator.service.core.support.MigrationConstants.DISABLED_REPEAT_INTERVAL;
import static com.alertmigrator.service.core.support.MigrationConstants.FOLDER_TITLE_LABEL;

import com.alertmigrator.legacy.model.NotificationChannel;
import com.alertmigrator.service.core.channel.SecureSettingsMigrator.MigratedSettings;
import com.alertmigrator.service.core.migration.OrgMigrationContext;
import com.alertmigrator.service.core.support.PrometheusDurations;
import com.alertmigrator.service.core.telemetry.MigrationTelemetry;
import com.alertmigrator.service.core.telemetry.MigrationTelemetry.WarningKind;
import com.alertmigrator.unified.model.IntegrationConfig;
import com.alertmigrator.unified.model.MatchType;
import com.alertmigrator.unified.model.ObjectMatcher;
import com.alertmigrator.unified.model.Receiver;
import com.alertmigrator.unified.model.Route;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Builds one receiver per notification channel, a root route for the default channels and one child route per
 * receiver matching the contact-list label.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReceiverBuilder {

    static final List<String> ROOT_GROUP_BY = List.of(FOLDER_TITLE_LABEL, ALERT_NAME_LABEL);

    private static final String REGEX_META = "\\.+*?()|[]{}^$";

    private final SecureSettingsMigrator settingsMigrator;
    private final MigrationTelemetry telemetry;

    public OrgReceivers build(OrgMigrationContext ctx, List<NotificationChannel> channels) {
        Set<String> names = new HashSet<>();
        List<Receiver> receivers = new ArrayList<>();
        List<Route> routes = new ArrayList<>();
        Map<ChannelRef, String> namesByRef = new HashMap<>();
        List<NotificationChannel> defaults = new ArrayList<>();
        Set<String> defaultNames = new LinkedHashSet<>();

        for (NotificationChannel channel : channels) {
            if (ChannelType.isDiscontinued(channel.type())) {
                log.warn(
                        "Discontinued notification channel skipped: orgId={} type={} name={} uid={}",
                        ctx.orgId(),
                        channel.type(),
                        channel.name(),
                        channel.uid());
                telemetry.recordWarning(WarningKind.DISCONTINUED_CHANNEL);
                continue;
            }

            String name = uniqueName(channel.name(), names);
            if (!name.equals(channel.name())) {
                log.warn(
                        "Contact name changed to stay unique: orgId={} name={} newName={}",
                        ctx.orgId(),
                        channel.name(),
                        name);
            }
            receivers.add(new Receiver(name, List.of(integration(ctx, channel, name))));
            routes.add(channelRoute(name, channel));

            // first channel wins when legacy UIDs collide
            if (channel.hasUid()) {
                namesByRef.putIfAbsent(ChannelRef.ofUid(channel.uid()), name);
            }
            if (channel.id() != 0) {
                namesByRef.putIfAbsent(ChannelRef.ofId(channel.id()), name);
            }
            if (channel.isDefault()) {
                defaults.add(channel);
                defaultNames.add(name);
            }
        }

        Route root;
        if (defaults.size() == 1) {
            String name = defaultNames.iterator().next();
            root = new Route(name, ROOT_GROUP_BY, List.of(), false, repeatInterval(defaults.get(0)), routes);
        } else {
            String name = uniqueName(DEFAULT_RECEIVER_NAME, names);
            List<IntegrationConfig> integrations = new ArrayList<>();
            Duration repeat = DISABLED_REPEAT_INTERVAL;
            for (NotificationChannel channel : defaults) {
                // a second integration per default channel, with its own UID
                integrations.add(integration(ctx, channel, channel.name()));
                if (channel.sendReminder()
                        && !channel.frequency().isZero()
                        && channel.frequency().compareTo(repeat) < 0) {
                    repeat = channel.frequency();
                }
            }
            receivers.add(new Receiver(name, integrations));
            String repeatInterval = defaults.isEmpty() ? null : PrometheusDurations.format(repeat);
            root = new Route(name, ROOT_GROUP_BY, List.of(), false, repeatInterval, routes);
        }

        log.debug(
                "Built receivers: orgId={} receivers={} defaults={} root={}",
                ctx.orgId(),
                receivers.size(),
                defaults.size(),
                root.receiver());
        return new OrgReceivers(receivers, root, namesByRef, defaultNames);
    }

    private IntegrationConfig integration(OrgMigrationContext ctx, NotificationChannel channel, String name) {
        String uid = ctx.uids().allocate(channel.uid());
        if (channel.hasUid() && !uid.equals(channel.uid())) {
            log.warn(
                    "Channel UID collides with a migrated record, generated a new one: orgId={} id={} old={} new={}",
                    ctx.orgId(),
                    channel.id(),
                    channel.uid(),
                    uid);
            telemetry.recordWarning(WarningKind.REGENERATED_CHANNEL_UID);
        } else if (!channel.hasUid()) {
            log.info(
                    "Notification channel had an empty UID, generated one: orgId={} id={} uid={}",
                    ctx.orgId(),
                    channel.id(),
                    uid);
        }
        MigratedSettings settings =
                settingsMigrator.migrate(channel.type(), channel.settings(), channel.secureSettings());
        return new IntegrationConfig(
                uid,
                name,
                channel.type(),
                channel.disableResolveMessage(),
                settings.settings(),
                settings.secureSettings());
    }

    static Route channelRoute(String receiverName, NotificationChannel channel) {
        ObjectMatcher matcher =
                new ObjectMatcher(CONTACT_LABEL, MatchType.REGEXP, ".*" + quoteMeta(quote(receiverName)) + ".*");
        return new Route(receiverName, List.of(), List.of(matcher), true, repeatInterval(channel), List.of());
    }

    static String repeatInterval(NotificationChannel channel) {
        Duration repeat = channel.sendReminder() && !channel.frequency().isZero()
                ? channel.frequency()
                : DISABLED_REPEAT_INTERVAL;
        return PrometheusDurations.format(repeat);
    }

    /**
     * Quotes are the separator of the contact-list label, so they are replaced. Names still colliding get a short
     * hash of the original name appended.
     */
    static String uniqueName(String original, Set<String> taken) {
        String name = original.replace('"', '_');
        String hashed = original;
        while (taken.contains(name)) {
            name = name + "_" + shortHash(hashed);
            hashed = name;
        }
        taken.add(name);
        return name;
    }

    static String shortHash(String value) {
        try {
            byte[] digest = MessageDigest.getInstance("MD5").digest(value.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder(6);
            for (int i = 0; i < 3; i++) sb.append(String.format("%02x", digest[i]));
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
    }

    static String quote(String value) {
        return "\"" + value + "\"";
    }

    /** Escapes every regex metacharacter with a backslash. */
    static String quoteMeta(String value) {
        StringBuilder sb = new StringBuilder(value.length() + 8);
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (REGEX_META.indexOf(c) >= 0) {
                sb.append('\\');
            }
            sb.append(c);
        }
        return sb.toString();
    }
}
