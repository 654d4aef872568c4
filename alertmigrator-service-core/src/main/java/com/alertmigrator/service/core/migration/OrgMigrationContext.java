package com.alertmigrator.service.core.migration;

import com.alertmigrator.dashboard.model.Folder;
import com.alertmigrator.legacy.model.NotificationChannel;
import com.alertmigrator.service.core.channel.ChannelRef;
import com.alertmigrator.service.core.rule.TitleDeduplicator;
import com.alertmigrator.service.core.support.MigrationConstants;
import com.alertmigrator.service.core.uid.ShortUidGenerator;
import com.alertmigrator.service.core.uid.UidSet;
import com.alertmigrator.unified.model.Silence;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Everything one org pass accumulates: seen UIDs, per-folder title deduplicators, folder caches, the folders it
 * created, pending silences and the channel references of each translated rule. Not thread-safe; one instance per
 * org and run.
 */
public class OrgMigrationContext {

    private final long orgId;
    private final boolean caseInsensitive;
    private final UidSet uids;
    private final ShortUidGenerator ruleUidGenerator;
    private final List<NotificationChannel> channels;

    private final Map<String, TitleDeduplicator> titlesByFolder = new HashMap<>();
    private final Map<String, Folder> aclFoldersByName = new HashMap<>();
    private final Set<String> createdFolderUids = new LinkedHashSet<>();
    private final List<Silence> silences = new ArrayList<>();
    private final Map<String, List<ChannelRef>> channelRefsByRule = new LinkedHashMap<>();
    private Folder generalFolder;

    public OrgMigrationContext(
            long orgId, boolean caseInsensitive, ShortUidGenerator uidGenerator, List<NotificationChannel> channels) {
        this.orgId = orgId;
        this.caseInsensitive = caseInsensitive;
        this.uids = new UidSet(caseInsensitive, uidGenerator);
        this.ruleUidGenerator = uidGenerator;
        this.channels = List.copyOf(channels);
    }

    public long orgId() {
        return orgId;
    }

    /** UIDs of migrated notifiers. */
    public UidSet uids() {
        return uids;
    }

    public String newRuleUid() {
        return ruleUidGenerator.generate();
    }

    public List<NotificationChannel> channels() {
        return channels;
    }

    public TitleDeduplicator titleDeduplicator(String folderUid) {
        return titlesByFolder.computeIfAbsent(
                folderUid, uid -> new TitleDeduplicator(MigrationConstants.MAX_TITLE_LENGTH, caseInsensitive));
    }

    public Optional<Folder> aclFolder(String name) {
        return Optional.ofNullable(aclFoldersByName.get(name));
    }

    public void cacheAclFolder(String name, Folder folder) {
        aclFoldersByName.put(name, folder);
    }

    public Optional<Folder> generalFolder() {
        return Optional.ofNullable(generalFolder);
    }

    public void cacheGeneralFolder(Folder folder) {
        this.generalFolder = folder;
    }

    public void recordCreatedFolder(String folderUid) {
        createdFolderUids.add(folderUid);
    }

    public List<String> createdFolderUids() {
        return List.copyOf(createdFolderUids);
    }

    public void addSilence(Silence silence) {
        silences.add(silence);
    }

    public List<Silence> silences() {
        return List.copyOf(silences);
    }

    /**
     * Records the channels a rule should notify.
     *
     * @return {@code false} when the rule UID was already recorded
     */
    public boolean recordRuleChannels(String ruleUid, List<ChannelRef> refs) {
        return channelRefsByRule.putIfAbsent(ruleUid, List.copyOf(refs)) == null;
    }

    public List<ChannelRef> channelRefs(String ruleUid) {
        return channelRefsByRule.getOrDefault(ruleUid, List.of());
    }
}
