package com.esports.scraper.service.merge;

import com.esports.scraper.model.NormalizedFields;
import com.esports.scraper.model.RecordType;
import com.esports.scraper.model.ScheduledTime;
import com.esports.scraper.service.normalize.Names;
import org.springframework.lang.Nullable;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.ZoneOffset;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Record identity. A native id gives {@code match:353177}; without one the
 * identity is a content key, {@code match:h:<sha256(lower(name)|date)>}.
 */
public final class RecordKeys {

    private RecordKeys() {
    }

    public static String nativeKey(final RecordType type, final String nativeId) {
        return prefix(type) + nativeId.trim();
    }

    /**
     * Content key from the lower-cased name and the UTC start day, or
     * {@code null} when the record has no name.
     */
    @Nullable
    public static String contentKey(final RecordType type, @Nullable final String name,
                                    @Nullable final ScheduledTime time) {
        String nameKey = Names.key(name);
        if (nameKey == null) {
            return null;
        }
        String day = time != null && time.isKnown()
                ? time.value().withOffsetSameInstant(ZoneOffset.UTC).toLocalDate().toString()
                : "";
        return prefix(type) + "h:" + sha256(nameKey + "|" + day);
    }

    /**
     * The identity a freshly normalized record is filed under before alias
     * resolution. A record with neither id nor name is keyed by its page and
     * its position on that page.
     */
    public static String primaryKey(final NormalizedFields f) {
        if (f.nativeId() != null) {
            return nativeKey(f.type(), f.nativeId());
        }
        String content = contentKey(f.type(), f.name(), f.scheduledTime());
        return content != null
                ? content
                : prefix(f.type()) + "h:" + sha256(f.sourceUrl() + "#" + f.ordinal() + "#" + f.position());
    }

    private static String prefix(final RecordType type) {
        return type.name().toLowerCase(Locale.ROOT) + ":";
    }

    static String sha256(final String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 not available", ex);
        }
    }
}
