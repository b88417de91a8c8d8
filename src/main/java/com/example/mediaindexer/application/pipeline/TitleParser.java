package com.example.mediaindexer.application.pipeline;

import com.example.mediaindexer.domain.model.ParsedTitle;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Extracts a searchable title, a release year and episode numbers from a media file name.
 */
@Component
public class TitleParser {

    private static final Pattern SEASON_EPISODE = Pattern.compile(
            "(?i)^(.*?)[\\s._-]*s(\\d{1,2})[\\s._-]*e(\\d{1,3})(?!\\d)");
    private static final Pattern CROSS_EPISODE = Pattern.compile(
            "(?i)^(.*?)[\\s._-]+(\\d{1,2})x(\\d{2,3})(?!\\d)");
    private static final Pattern YEAR = Pattern.compile(
            "^(.*?)[\\s._(\\[-]+((?:19|20)\\d{2})(?=[\\s._)\\]-]|$)");
    private static final Pattern BRACKETED = Pattern.compile("[\\[(][^\\])]*[\\])]");
    private static final Pattern SEPARATORS = Pattern.compile("[._]+");
    private static final Pattern SPACES = Pattern.compile("\\s+");

    public ParsedTitle parse(String fileName) {
        if (fileName == null) {
            return new ParsedTitle(null, null, null, null);
        }
        String stem = stripExtension(fileName.trim());
        Integer season = null;
        Integer episode = null;
        String rest = stem;

        Matcher matcher = SEASON_EPISODE.matcher(stem);
        if (!matcher.find()) {
            matcher = CROSS_EPISODE.matcher(stem);
            if (!matcher.find()) {
                matcher = null;
            }
        }
        if (matcher != null && !matcher.group(1).trim().isEmpty()) {
            rest = matcher.group(1);
            season = Integer.valueOf(matcher.group(2));
            episode = Integer.valueOf(matcher.group(3));
        }

        Integer year = null;
        Matcher yearMatcher = YEAR.matcher(rest);
        if (yearMatcher.find() && !clean(yearMatcher.group(1)).isEmpty()) {
            year = Integer.valueOf(yearMatcher.group(2));
            rest = yearMatcher.group(1);
        }
        String title = clean(rest);
        return new ParsedTitle(title.isEmpty() ? null : title, year, season, episode);
    }

    private String stripExtension(String name) {
        int dot = name.lastIndexOf('.');
        if (dot <= 0 || name.length() - dot > 6) {
            return name;
        }
        String ext = name.substring(dot + 1).toLowerCase(Locale.ROOT);
        return ext.chars().allMatch(Character::isLetterOrDigit) ? name.substring(0, dot) : name;
    }

    private String clean(String raw) {
        String text = BRACKETED.matcher(raw).replaceAll(" ");
        text = SEPARATORS.matcher(text).replaceAll(" ");
        text = SPACES.matcher(text).replaceAll(" ").trim();
        while (text.endsWith("-")) {
            text = text.substring(0, text.length() - 1).trim();
        }
        return text;
    }
}
