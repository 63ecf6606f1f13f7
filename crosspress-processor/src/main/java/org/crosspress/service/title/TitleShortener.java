package org.crosspress.service.title;

import org.crosspress.config.AppProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Shortens article titles for display in a table of contents.
 * <p>
 * Boilerplate suffixes are removed first. A title that still exceeds the budget is cut
 * at its first natural break point when the leading segment is substantial, and
 * otherwise truncated at a word boundary with an ellipsis.
 */
@Component
public class TitleShortener {

    public static final int MIN_LENGTH = 10;
    static final int MIN_SEGMENT_LENGTH = 20;
    static final String ELLIPSIS = "...";

    private static final List<String> BREAK_TOKENS = List.of(":", " - ", " \u2013 ", ", ");
    private static final Pattern ORDINAL_SUFFIX = Pattern.compile("\\s*\\(\\d+\\)\\s*$");
    private static final Pattern MARKETS_WRAP_SUFFIX = Pattern.compile("\\s*:\\s*Markets\\s*Wrap\\s*$", Pattern.CASE_INSENSITIVE);

    private final List<Pattern> suffixPatterns;
    private final int defaultMaxLength;

    @Autowired
    public TitleShortener(AppProperties appProperties) {
        this(appProperties.getProcessor().getTitleSources(), appProperties.getProcessor().getMaxTitleLength());
    }

    public TitleShortener(List<String> sources, int defaultMaxLength) {
        if (defaultMaxLength < MIN_LENGTH) {
            throw new IllegalArgumentException("Maximum title length must be at least " + MIN_LENGTH + ": " + defaultMaxLength);
        }
        this.defaultMaxLength = defaultMaxLength;
        this.suffixPatterns = buildSuffixPatterns(sources);
    }

    public String shorten(String title) {
        return shorten(title, defaultMaxLength);
    }

    public String shorten(String title, int maxLength) {
        if (maxLength < MIN_LENGTH) {
            throw new IllegalArgumentException("Maximum title length must be at least " + MIN_LENGTH + ": " + maxLength);
        }
        if (title == null || title.isEmpty()) {
            return "";
        }

        String stripped = stripSuffixes(title);
        if (stripped.length() <= maxLength) {
            return stripped.trim();
        }

        for (String token : BREAK_TOKENS) {
            int index = stripped.indexOf(token);
            if (index < 0) {
                continue;
            }
            String segment = stripped.substring(0, index);
            if (segment.length() >= MIN_SEGMENT_LENGTH && segment.length() <= maxLength) {
                return stripSuffixes(segment).trim();
            }
        }

        String truncated = stripped.substring(0, maxLength - ELLIPSIS.length());
        int lastSpace = truncated.lastIndexOf(' ');
        if (lastSpace > maxLength * 0.6) {
            truncated = truncated.substring(0, lastSpace);
        }
        return truncated.trim() + ELLIPSIS;
    }

    /**
     * Removes boilerplate suffixes until none applies, so "Title (2): Markets Wrap" loses both.
     */
    String stripSuffixes(String title) {
        String current = title;
        String previous;
        do {
            previous = current;
            for (Pattern pattern : suffixPatterns) {
                current = pattern.matcher(current).replaceFirst("");
            }
        } while (!current.equals(previous));
        return current;
    }

    private static List<Pattern> buildSuffixPatterns(List<String> sources) {
        List<Pattern> patterns = new ArrayList<>();
        List<String> names = sources == null ? List.of() : sources;
        for (String source : names) {
            if (source == null || source.isBlank()) {
                continue;
            }
            String quoted = Pattern.quote(source.trim());
            patterns.add(Pattern.compile("\\s*[-\u2013\u2014]\\s*" + quoted + ".*$", Pattern.CASE_INSENSITIVE | Pattern.DOTALL));
        }
        patterns.add(ORDINAL_SUFFIX);
        for (String source : names) {
            if (source == null || source.isBlank()) {
                continue;
            }
            String quoted = Pattern.quote(source.trim());
            patterns.add(Pattern.compile("\\s*\\|\\s*" + quoted + ".*$", Pattern.CASE_INSENSITIVE | Pattern.DOTALL));
        }
        patterns.add(MARKETS_WRAP_SUFFIX);
        return List.copyOf(patterns);
    }
}
