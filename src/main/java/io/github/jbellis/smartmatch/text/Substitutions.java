package io.github.jbellis.smartmatch.text;

/**
 * Literal substring replacement that leaves already-canonical text alone.
 */
public final class Substitutions {
    private Substitutions() {
    }

    /**
     * Replaces every occurrence of {@code pattern} in {@code text} with {@code replacement}, except
     * occurrences that sit inside an occurrence of {@code replacement} itself. With a rule such as
     * {@code tajin -> tajine} the text "tajine" is left as is rather than growing to "tajinee", and a
     * self-mapping rule never changes anything.
     */
    public static String replaceAll(String text, String pattern, String replacement) {
        if (pattern.isEmpty() || pattern.equals(replacement)) {
            return text;
        }
        int hit = text.indexOf(pattern);
        if (hit < 0) {
            return text;
        }

        // where the pattern sits inside its own replacement, if it does at all
        int offsetInReplacement = replacement.indexOf(pattern);

        var sb = new StringBuilder(text.length() + 16);
        int from = 0;
        while (hit >= 0) {
            int canonicalStart = hit - offsetInReplacement;
            if (offsetInReplacement >= 0 && canonicalStart >= 0 && text.startsWith(replacement, canonicalStart)) {
                int canonicalEnd = canonicalStart + replacement.length();
                sb.append(text, from, canonicalEnd);
                from = canonicalEnd;
            } else {
                sb.append(text, from, hit).append(replacement);
                from = hit + pattern.length();
            }
            hit = text.indexOf(pattern, from);
        }
        sb.append(text, from, text.length());
        return sb.toString();
    }
}
