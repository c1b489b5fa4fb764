package com.storylens.highlight;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.LongSupplier;

/**
 * Finds every occurrence of every indexed pattern in a window of text.
 *
 * Matching is case-insensitive and anchored on word boundaries: a pattern that starts with a
 * letter or digit may not start right after another letter or digit, and likewise at its end.
 * Word characters are exactly the code points for which {@link Character#isLetterOrDigit(int)}
 * holds, so a letter outside the Basic Multilingual Plane counts as one letter rather than two
 * unpaired surrogates. Apostrophes, hyphens and other punctuation are boundaries, so "Aria" is
 * found in "Aria's" but not in "Ariadne".
 * A space inside a pattern matches any run of whitespace in the text.
 *
 * Overlapping and nested occurrences are all reported; see {@link OverlapResolver}.
 */
public class ReferenceScanner {

    private static final int DEADLINE_CHECK_MASK = 0x3FF;

    private final LongSupplier nanoClock;

    public ReferenceScanner() {
        this(System::nanoTime);
    }

    public ReferenceScanner(LongSupplier nanoClock) {
        this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock");
    }

    public List<RawMatch> scan(CharSequence window, EntityIndex index) {
        return scan(window, index, 0L);
    }

    /**
     * @param budgetNanos time allowed for the pass, or 0 for no limit
     * @throws ScanBudgetExceededException when the budget runs out before the window is done
     */
    public List<RawMatch> scan(CharSequence window, EntityIndex index, long budgetNanos) {
        List<RawMatch> matches = new ArrayList<>();
        if (window == null || window.length() == 0 || index == null || index.isEmpty()) {
            return matches;
        }
        long deadline = budgetNanos > 0 ? nanoClock.getAsLong() + budgetNanos : 0L;
        int length = window.length();

        for (int pos = 0; pos < length; pos++) {
            if (deadline != 0L && (pos & DEADLINE_CHECK_MASK) == 0 && pos > 0
                && nanoClock.getAsLong() - deadline > 0) {
                throw new ScanBudgetExceededException(
                    "Scan budget exhausted after " + pos + " of " + length + " chars", pos);
            }
            char first = Character.toLowerCase(window.charAt(pos));
            List<SearchPattern> candidates = index.candidatesStartingWith(first);
            if (candidates.isEmpty()) {
                continue;
            }
            boolean insideWord = pos > 0 && isWordChar(Character.codePointBefore(window, pos));
            for (SearchPattern pattern : candidates) {
                String text = pattern.getText();
                if (insideWord && isWordChar(text.codePointAt(0))) {
                    continue;
                }
                int end = matchAt(window, pos, text);
                if (end < 0) {
                    continue;
                }
                if (end < length && isWordChar(text.codePointBefore(text.length()))
                    && isWordChar(Character.codePointAt(window, end))) {
                    continue;
                }
                matches.add(new RawMatch(pattern.getId(), pos, end));
            }
        }
        return matches;
    }

    /**
     * Compares {@code pattern} against {@code window} from {@code start}.
     *
     * @return the exclusive end offset of the match, or -1
     */
    static int matchAt(CharSequence window, int start, String pattern) {
        int length = window.length();
        int i = start;
        for (int j = 0; j < pattern.length(); j++) {
            char expected = pattern.charAt(j);
            if (expected == ' ') {
                if (i >= length || !Character.isWhitespace(window.charAt(i))) {
                    return -1;
                }
                while (i < length && Character.isWhitespace(window.charAt(i))) {
                    i++;
                }
                continue;
            }
            if (i >= length || Character.toLowerCase(window.charAt(i)) != expected) {
                return -1;
            }
            i++;
        }
        return i;
    }

    public static boolean isWordChar(int codePoint) {
        return Character.isLetterOrDigit(codePoint);
    }
}
