package com.storylens.highlight;

import com.storylens.models.HighlightConfig;

import java.util.Arrays;

/**
 * Chooses the slice of a document that one scan looks at, so scan cost does not grow with
 * document length.
 *
 * Short documents (fewer than {@code windowWords} words) are scanned whole. Longer ones get a
 * window of up to {@code windowWords} words centred on the cursor, widened to a paragraph break
 * when one is within {@code paragraphSnapWords} words. Window edges always fall on word edges.
 * A mention outside the window is not highlighted until the cursor moves near it.
 */
public class WindowPolicy {

    private final HighlightConfig config;

    public WindowPolicy(HighlightConfig config) {
        this.config = config != null ? config : HighlightConfig.defaults();
    }

    public ScanWindow computeWindow(String fullText, int cursorOffset) {
        return computeWindow(fullText, cursorOffset, null);
    }

    public ScanWindow computeWindow(String fullText, int cursorOffset, ScanWindow priorWindow) {
        String text = fullText != null ? fullText : "";
        Words words = Words.of(text);
        int windowWords = Math.max(1, config.getWindowWords());
        if (words.count() < windowWords) {
            return ScanWindow.whole(text);
        }
        int cursorWord = words.wordAt(clamp(cursorOffset, 0, text.length()));

        if (priorWindow != null && canReuse(priorWindow, text, words, cursorWord)) {
            return new ScanWindow(priorWindow.getStart(), priorWindow.getEnd(), false);
        }

        ScanWindow window = slice(text, words, cursorWord, windowWords, false);
        int budget = config.getMaxWindowChars();
        int radius = windowWords;
        while (budget > 0 && window.length() > budget && radius / 2 >= minWords()) {
            radius /= 2;
            window = slice(text, words, cursorWord, radius, true);
        }
        return window;
    }

    /**
     * A degraded window of at most {@code maxWords} words around the cursor, used after a scan
     * ran out of time on the normal window.
     */
    public ScanWindow shrink(String fullText, int cursorOffset, int maxWords) {
        String text = fullText != null ? fullText : "";
        Words words = Words.of(text);
        if (words.count() == 0) {
            return new ScanWindow(0, text.length(), true);
        }
        int cursorWord = words.wordAt(clamp(cursorOffset, 0, text.length()));
        return slice(text, words, cursorWord, Math.max(1, maxWords), true);
    }

    /**
     * Extends {@code window} by up to {@code extraWords} whole words on each side, so a name of
     * up to {@code extraWords + 1} words that crosses an edge lies wholly inside the result.
     */
    public ScanWindow widen(String fullText, ScanWindow window, int extraWords) {
        String text = fullText != null ? fullText : "";
        if (extraWords <= 0 || window.length() == 0
            || (window.getStart() == 0 && window.getEnd() >= text.length())) {
            return window;
        }
        Words words = Words.of(text);
        int start = window.getStart();
        int end = Math.min(window.getEnd(), text.length());

        int first = words.firstStartingAtOrAfter(start);
        if (first < 0) {
            first = words.count();
        }
        int widenedFirst = Math.max(0, first - extraWords);
        if (widenedFirst < first) {
            start = Math.min(start, words.starts[widenedFirst]);
        }

        int last = words.lastEndingAtOrBefore(end);
        int widenedLast = Math.min(words.count() - 1, last + extraWords);
        if (widenedLast > last) {
            end = Math.max(end, words.ends[widenedLast]);
        }
        return new ScanWindow(start, end, window.isDegraded());
    }

    public int minWords() {
        return Math.max(1, config.getMinWindowWords());
    }

    public int windowWords() {
        return Math.max(1, config.getWindowWords());
    }

    private boolean canReuse(ScanWindow prior, String text, Words words, int cursorWord) {
        if (prior.isDegraded() || prior.getEnd() > text.length() || prior.length() == 0) {
            return false;
        }
        int first = words.firstStartingAtOrAfter(prior.getStart());
        int last = words.lastEndingAtOrBefore(prior.getEnd());
        if (first < 0 || last < first) {
            return false;
        }
        if (words.starts[first] != prior.getStart() && !isParagraphEdge(text, prior.getStart())) {
            return false;
        }
        if (words.ends[last] != prior.getEnd() && !isParagraphEdge(text, prior.getEnd())) {
            return false;
        }
        int maxWords = windowWords() + 2 * Math.max(0, config.getParagraphSnapWords());
        if (last - first + 1 > maxWords) {
            return false;
        }
        int margin = Math.max(0, config.getWindowMarginWords());
        return cursorWord - first >= margin && last - cursorWord >= margin;
    }

    private ScanWindow slice(String text, Words words, int cursorWord, int size, boolean degraded) {
        int count = words.count();
        int first = cursorWord - size / 2;
        int last = first + size - 1;
        if (first < 0) {
            first = 0;
            last = Math.min(count - 1, size - 1);
        }
        if (last >= count) {
            last = count - 1;
            first = Math.max(0, last - size + 1);
        }

        int start = words.starts[first];
        int end = words.ends[last];
        int snapWords = Math.max(0, config.getParagraphSnapWords());

        int paragraphStart = start > 0 ? text.lastIndexOf('\n', start - 1) + 1 : 0;
        if (paragraphStart < start) {
            int firstInParagraph = words.firstStartingAtOrAfter(paragraphStart);
            if (firstInParagraph >= 0 && first - firstInParagraph <= snapWords) {
                start = paragraphStart;
            }
        }

        int paragraphEnd = text.indexOf('\n', end);
        if (paragraphEnd < 0) {
            paragraphEnd = text.length();
        }
        if (paragraphEnd > end) {
            int lastInParagraph = words.lastEndingAtOrBefore(paragraphEnd);
            if (lastInParagraph >= 0 && lastInParagraph - last <= snapWords) {
                end = paragraphEnd;
            }
        }
        return new ScanWindow(start, end, degraded);
    }

    private static boolean isParagraphEdge(String text, int offset) {
        return offset == 0 || offset == text.length()
            || text.charAt(offset - 1) == '\n' || text.charAt(offset) == '\n';
    }

    private static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }

    /**
     * Start and end offsets of every whitespace-separated word.
     */
    static final class Words {
        final int[] starts;
        final int[] ends;
        private final int count;

        private Words(int[] starts, int[] ends, int count) {
            this.starts = starts;
            this.ends = ends;
            this.count = count;
        }

        static Words of(String text) {
            int[] starts = new int[16];
            int[] ends = new int[16];
            int count = 0;
            int i = 0;
            int length = text.length();
            while (i < length) {
                while (i < length && Character.isWhitespace(text.charAt(i))) {
                    i++;
                }
                if (i >= length) {
                    break;
                }
                int start = i;
                while (i < length && !Character.isWhitespace(text.charAt(i))) {
                    i++;
                }
                if (count == starts.length) {
                    starts = Arrays.copyOf(starts, count * 2);
                    ends = Arrays.copyOf(ends, count * 2);
                }
                starts[count] = start;
                ends[count] = i;
                count++;
            }
            return new Words(starts, ends, count);
        }

        int count() {
            return count;
        }

        /**
         * Index of the word containing or following {@code offset}; the last word when the
         * offset is past the end of the text.
         */
        int wordAt(int offset) {
            if (count == 0) {
                return 0;
            }
            int idx = Arrays.binarySearch(ends, 0, count, offset);
            if (idx < 0) {
                idx = -idx - 1;
            }
            return Math.min(idx, count - 1);
        }

        int firstStartingAtOrAfter(int offset) {
            int idx = Arrays.binarySearch(starts, 0, count, offset);
            if (idx < 0) {
                idx = -idx - 1;
            }
            return idx < count ? idx : -1;
        }

        int lastEndingAtOrBefore(int offset) {
            int idx = Arrays.binarySearch(ends, 0, count, offset);
            if (idx < 0) {
                idx = -idx - 2;
            }
            return idx;
        }
    }
}
