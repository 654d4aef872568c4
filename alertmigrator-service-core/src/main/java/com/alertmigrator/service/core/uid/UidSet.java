package com.alertmigrator.service.core.uid;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * UIDs handed out during one migration run. When {@code caseInsensitive} is set (stores with case-insensitive
 * collation), two UIDs differing only in case count as the same.
 */
public class UidSet {

    static final int MAX_ATTEMPTS = 5;

    private final Set<String> seen = new HashSet<>();
    private final boolean caseInsensitive;
    private final ShortUidGenerator generator;

    public UidSet(boolean caseInsensitive, ShortUidGenerator generator) {
        this.caseInsensitive = caseInsensitive;
        this.generator = generator;
    }

    public boolean contains(String uid) {
        return seen.contains(key(uid));
    }

    public void add(String uid) {
        seen.add(key(uid));
    }

    /**
     * Keeps {@code preferred} when it is non-empty and unseen, otherwise generates a replacement. The returned UID is
     * recorded either way.
     */
    public String allocate(String preferred) {
        if (preferred != null && !preferred.isEmpty() && !contains(preferred)) {
            add(preferred);
            return preferred;
        }
        return generateUid();
    }

    /**
     * Returns a fresh UID that was not seen before and records it.
     *
     * @throws UidGenerationException when {@value #MAX_ATTEMPTS} candidates all collide
     */
    public String generateUid() {
        for (int i = 0; i < MAX_ATTEMPTS; i++) {
            String candidate = generator.generate();
            if (!contains(candidate)) {
                add(candidate);
                return candidate;
            }
        }
        throw new UidGenerationException(MAX_ATTEMPTS);
    }

    private String key(String uid) {
        return caseInsensitive ? uid.toLowerCase(Locale.ROOT) : uid;
    }
}
