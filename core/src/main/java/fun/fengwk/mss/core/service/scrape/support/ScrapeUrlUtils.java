package fun.fengwk.mss.core.service.scrape.support;

import org.springframework.util.StringUtils;

import java.net.URI;
import java.util.Locale;

/**
 * Url helpers shared by extraction and the interactive crawl.
 *
 * @author fengwk
 */
public final class ScrapeUrlUtils {

    private static final String ILLEGAL_CHARS = " \"<>\\^`{|}";

    private static final char[] HEX_DIGITS = "0123456789ABCDEF".toCharArray();

    private ScrapeUrlUtils() {
    }

    /**
     * Resolve {@code candidate} against {@code baseUrl}.
     *
     * @return absolute http(s) url, or null when the candidate cannot be resolved to one
     */
    public static String toAbsolute(String baseUrl, String candidate) {
        if (!StringUtils.hasText(candidate)) {
            return null;
        }
        String trimmed = encodeIllegalChars(candidate.trim());
        try {
            URI resolved;
            if (StringUtils.hasText(baseUrl)) {
                URI base = parse(baseUrl);
                // URI#resolve drops the separator when the base has an empty path.
                if (!StringUtils.hasText(base.getRawPath())) {
                    base = base.resolve("/");
                }
                resolved = base.resolve(trimmed);
            } else {
                resolved = URI.create(trimmed);
            }
            return isAbsoluteHttpUrl(resolved) ? resolved.toString() : null;
        } catch (IllegalArgumentException ex) {
            return null;
        }
    }

    public static boolean isAbsoluteHttpUrl(String url) {
        if (!StringUtils.hasText(url)) {
            return false;
        }
        try {
            return isAbsoluteHttpUrl(parse(url));
        } catch (IllegalArgumentException ex) {
            return false;
        }
    }

    public static boolean isSameOrigin(String left, String right) {
        if (!isAbsoluteHttpUrl(left) || !isAbsoluteHttpUrl(right)) {
            return false;
        }
        URI leftUri = parse(left);
        URI rightUri = parse(right);
        return leftUri.getScheme().equalsIgnoreCase(rightUri.getScheme())
            && leftUri.getHost().equalsIgnoreCase(rightUri.getHost())
            && effectivePort(leftUri) == effectivePort(rightUri);
    }

    /**
     * Key used for visited-url bookkeeping: fragment dropped, scheme and host lower-cased.
     */
    public static String normalizeForVisit(String url) {
        if (!isAbsoluteHttpUrl(url)) {
            return url;
        }
        URI uri = parse(url);
        String path = StringUtils.hasText(uri.getRawPath()) ? uri.getRawPath() : "/";
        String query = uri.getRawQuery() == null ? "" : "?" + uri.getRawQuery();
        int port = effectivePort(uri);
        return uri.getScheme().toLowerCase(Locale.ROOT) + "://" + uri.getHost().toLowerCase(Locale.ROOT)
            + ":" + port + path + query;
    }

    private static URI parse(String url) {
        return URI.create(encodeIllegalChars(url.trim()));
    }

    /**
     * Percent-encode characters browsers accept in hrefs but {@link URI} rejects. Brackets are kept in the
     * authority, where they delimit IPv6 hosts.
     */
    static String encodeIllegalChars(String url) {
        int authorityEnd = authorityEnd(url);
        StringBuilder encoded = null;
        for (int i = 0; i < url.length(); i++) {
            char ch = url.charAt(i);
            boolean illegal = ILLEGAL_CHARS.indexOf(ch) >= 0 || ((ch == '[' || ch == ']') && i >= authorityEnd);
            if (illegal && encoded == null) {
                encoded = new StringBuilder(url.length() + 16).append(url, 0, i);
            }
            if (encoded == null) {
                continue;
            }
            if (illegal) {
                encoded.append('%').append(HEX_DIGITS[(ch >> 4) & 0xF]).append(HEX_DIGITS[ch & 0xF]);
            } else {
                encoded.append(ch);
            }
        }
        return encoded == null ? url : encoded.toString();
    }

    private static int authorityEnd(String url) {
        int schemeEnd = url.indexOf("://");
        if (schemeEnd < 0) {
            return 0;
        }
        int start = schemeEnd + 3;
        for (int i = start; i < url.length(); i++) {
            char ch = url.charAt(i);
            if (ch == '/' || ch == '?' || ch == '#') {
                return i;
            }
        }
        return url.length();
    }

    private static boolean isAbsoluteHttpUrl(URI uri) {
        if (uri == null || !uri.isAbsolute() || uri.getHost() == null) {
            return false;
        }
        String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
        return "http".equals(scheme) || "https".equals(scheme);
    }

    private static int effectivePort(URI uri) {
        if (uri.getPort() != -1) {
            return uri.getPort();
        }
        return "https".equalsIgnoreCase(uri.getScheme()) ? 443 : 80;
    }

}
