package com.esports.scraper.parser.vlr;

import org.apache.commons.lang3.StringUtils;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.springframework.lang.Nullable;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Small Jsoup helpers shared by the VLR page parsers.
 */
final class VlrHtml {

    /** Match pages live at {@code /<id>/<slug>}. */
    static final Pattern MATCH_ID = Pattern.compile("^(?:https?://[^/]+)?/(\\d+)(?:/|$)");

    /** Event pages live at {@code /event/<id>/<slug>}, also under {@code /event/matches/<id>}. */
    static final Pattern EVENT_ID = Pattern.compile("/event/(?:matches/)?(\\d+)(?:/|$)");

    private VlrHtml() {
    }

    /**
     * Text of the first element matched by the first selector that yields a
     * non-blank value, or {@code null}.
     */
    @Nullable
    static String text(final Element scope, final String... selectors) {
        for (String selector : selectors) {
            Element el = scope.selectFirst(selector);
            if (el != null && StringUtils.isNotBlank(el.text())) {
                return el.text().trim();
            }
        }
        return null;
    }

    /**
     * Like {@link #text}, but only the element's own text, without children.
     */
    @Nullable
    static String ownText(final Element scope, final String selector) {
        Element el = scope.selectFirst(selector);
        return el == null ? null : StringUtils.trimToNull(el.ownText());
    }

    /**
     * Elements of the first selector that matches anything.
     */
    static Elements firstMatching(final Element scope, final String... selectors) {
        for (String selector : selectors) {
            Elements found = scope.select(selector);
            if (!found.isEmpty()) {
                return found;
            }
        }
        return new Elements();
    }

    /** Non-blank texts of the given elements, in document order. */
    static List<String> texts(final Elements elements) {
        return elements.stream()
                .map(Element::text)
                .map(StringUtils::trimToNull)
                .filter(StringUtils::isNotEmpty)
                .toList();
    }

    @Nullable
    static String group(final Pattern pattern, @Nullable final String input) {
        if (input == null) {
            return null;
        }
        Matcher m = pattern.matcher(input);
        return m.find() ? m.group(1) : null;
    }

    @Nullable
    static String at(final List<String> values, final int index) {
        return index < values.size() ? values.get(index) : null;
    }
}
