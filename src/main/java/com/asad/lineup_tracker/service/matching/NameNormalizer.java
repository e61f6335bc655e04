package com.asad.lineup_tracker.service.matching;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

public final class NameNormalizer {

    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");

    private NameNormalizer() {}

    /** "Nikola Jokić" -> "nikola jokic". Punctuation is kept so "J. Brunson" still reads as initial + name. */
    public static String normalize(String s) {
        if (s == null) return "";
        String decomposed = Normalizer.normalize(s, Normalizer.Form.NFD);
        return COMBINING_MARKS.matcher(decomposed).replaceAll("")
                .toLowerCase(Locale.ROOT)
                .trim();
    }
}
