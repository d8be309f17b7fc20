package com.webservice.customerio.util;

import com.google.common.escape.Escaper;
import com.google.common.net.UrlEscapers;
import lombok.experimental.UtilityClass;

import java.util.regex.Pattern;

@UtilityClass
public class UrlUtil {

    private static final Escaper ENCODER = UrlEscapers.urlPathSegmentEscaper();

    /**
     * Universal, non case-sensitive, protocol-agnostic URL pattern
     */
    private static final Pattern ABSOLUTE_URL_PATTERN = Pattern.compile("^[a-z][a-z0-9-+.]*?://", Pattern.CASE_INSENSITIVE);

    public String encodePathSegment(String segment) {
        return ENCODER.escape(segment);
    }

    /**
     * Joins base url and relative path with exactly one slash, e.g. {@code https://host/v1} + {@code events}.
     */
    public String join(String base, String path) {
        String left = base;
        while (left.endsWith("/")) {
            left = left.substring(0, left.length() - 1);
        }
        String right = path;
        while (right.startsWith("/")) {
            right = right.substring(1);
        }
        return left + "/" + right;
    }

    public boolean isAbsoluteUrl(String url) {
        return ABSOLUTE_URL_PATTERN.matcher(url).find();
    }
}
