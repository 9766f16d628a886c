package dev.badgersnacks.buildsync.fetch;

import dev.badgersnacks.buildsync.model.WowClass;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.Arrays;
import java.util.Optional;

/**
 * Finds the talent build code embedded in a build page. The page links to the Wowhead talent
 * calculator as {@code .../talent-calc/blizzard/<class>/<spec>/<code>} or, on older pages, as
 * {@code .../talent-calc/blizzard/<code>}; this is the only place that knows about that markup.
 */
public final class BuildCodeLocator {

    static final String CALCULATOR_PATH = "talent-calc/blizzard/";
    private static final String LINK_SELECTOR = "a[href*=wowhead.com/" + CALCULATOR_PATH + "]";

    /**
     * Returns the code of the first calculator link, in document order, that belongs to the given
     * class and specialization. Links carrying no class or specialization are only used when no
     * such link exists; the first of them wins.
     */
    public Optional<String> locate(String html, String classSlug, String specSlug) {
        if (html == null || html.isBlank()) {
            return Optional.empty();
        }
        Document document = Jsoup.parse(html);
        Optional<String> firstBare = Optional.empty();
        for (Element link : document.select(LINK_SELECTOR)) {
            String href = link.attr("href");
            Optional<String> code = codeFrom(href, classSlug, specSlug);
            if (code.isPresent()) {
                return code;
            }
            if (firstBare.isEmpty()) {
                firstBare = bareCodeFrom(href);
            }
        }
        return firstBare;
    }

    /**
     * Code of a {@code <class>/<spec>/.../<code>} link for the given class and specialization.
     */
    static Optional<String> codeFrom(String href, String classSlug, String specSlug) {
        String[] parts = segments(href);
        if (parts.length < 3) {
            return Optional.empty();
        }
        if (!parts[0].equalsIgnoreCase(classSlug) || !parts[1].equalsIgnoreCase(specSlug)) {
            return Optional.empty();
        }
        return Optional.of(parts[parts.length - 1]);
    }

    /**
     * Code of a link that carries nothing but the code. A lone class slug is the calculator's
     * landing page, not a build.
     */
    static Optional<String> bareCodeFrom(String href) {
        String[] parts = segments(href);
        if (parts.length != 1 || isClassSlug(parts[0])) {
            return Optional.empty();
        }
        return Optional.of(parts[0]);
    }

    private static String[] segments(String href) {
        int idx = href.indexOf(CALCULATOR_PATH);
        if (idx < 0) {
            return new String[0];
        }
        String rest = href.substring(idx + CALCULATOR_PATH.length());
        int cut = indexOfAny(rest, '?', '#');
        if (cut >= 0) {
            rest = rest.substring(0, cut);
        }
        return Arrays.stream(rest.split("/"))
                .map(String::trim)
                .filter(part -> !part.isEmpty())
                .toArray(String[]::new);
    }

    private static boolean isClassSlug(String value) {
        return Arrays.stream(WowClass.values()).anyMatch(wowClass -> wowClass.slug().equalsIgnoreCase(value));
    }

    private static int indexOfAny(String value, char first, char second) {
        int a = value.indexOf(first);
        int b = value.indexOf(second);
        if (a < 0) {
            return b;
        }
        return b < 0 ? a : Math.min(a, b);
    }
}
