package com.tony.baseballStats.model;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Nom d'un snapshot : {@code <prefix>_<YYYY-MM-DD>_<YYYY-MM-DD>_<suffixe>.json} (suffixe éventuellement vide).
 * Un nom hors convention donne un token sans intervalle.
 */
public record SourceToken(String fileName, DateRange range) {

    private static final String DATE = "(\\d{4}-\\d{2}-\\d{2})";

    public static SourceToken parse(String fileName, String prefix) {
        Pattern pattern = Pattern.compile("^" + Pattern.quote(prefix) + "_" + DATE + "_" + DATE + "_.*\\.json$");
        Matcher matcher = pattern.matcher(fileName);
        if (!matcher.matches()) {
            return new SourceToken(fileName, null);
        }
        try {
            LocalDate start = LocalDate.parse(matcher.group(1));
            LocalDate end = LocalDate.parse(matcher.group(2));
            if (start.isAfter(end)) {
                return new SourceToken(fileName, null);
            }
            return new SourceToken(fileName, new DateRange(start, end));
        } catch (DateTimeParseException e) {
            // ex : 2024-13-45
            return new SourceToken(fileName, null);
        }
    }

    public static String format(String prefix, LocalDate start, LocalDate end, String suffix) {
        return prefix + "_" + start + "_" + end + "_" + suffix + ".json";
    }

    public boolean hasRange() {
        return range != null;
    }
}
