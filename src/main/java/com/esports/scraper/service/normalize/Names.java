package com.esports.scraper.service.normalize;

import org.apache.commons.lang3.StringUtils;
import org.springframework.lang.Nullable;

import java.text.Normalizer;
import java.util.Locale;

/**
 * Display and identity forms of names. Display form keeps the upstream's
 * casing; identity comparisons go through {@link #key(String)}.
 */
public final class Names {

    private Names() {
    }

    /**
     * NFC-normalized, whitespace collapsed and trimmed. Never truncated.
     */
    @Nullable
    public static String display(@Nullable final String raw) {
        if (raw == null) {
            return null;
        }
        String nfc = Normalizer.normalize(raw, Normalizer.Form.NFC).replace('\u00A0', ' ');
        return StringUtils.trimToNull(StringUtils.normalizeSpace(nfc));
    }

    @Nullable
    public static String key(@Nullable final String raw) {
        String d = display(raw);
        return d == null ? null : d.toLowerCase(Locale.ROOT);
    }
}
