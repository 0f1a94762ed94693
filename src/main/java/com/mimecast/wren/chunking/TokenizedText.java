package com.mimecast.wren.chunking;

/**
 * Text split once into contiguous token spans with boundary tables.
 *
 * <p>A token is a run of non-whitespace with its trailing whitespace; the first token also owns any leading
 * whitespace, so the spans cover the whole text without gaps.
 * <p>A boundary {@code b} is a cut before token {@code b}. Paragraph boundaries fall on blank lines and before
 * markdown headings; sentence boundaries follow terminal punctuation or a line break. Every paragraph boundary is
 * also a sentence boundary and the end of text is both.
 */
public class TokenizedText {

    private final String text;
    private final int count;
    private final int[] spanStart;
    private final int[] spanEnd;
    private final int[] prevParagraph;
    private final int[] nextParagraph;
    private final int[] prevSentence;
    private final int[] nextSentence;

    /**
     * Tokenizes text.
     *
     * @param text Source text.
     */
    public TokenizedText(String text) {
        this.text = text;
        int length = text.length();

        // Core starts and ends of non-whitespace runs.
        int[] coreStart = new int[Math.max(1, length / 2 + 1)];
        int[] coreEnd = new int[coreStart.length];
        int n = 0;
        int i = 0;
        while (i < length) {
            while (i < length && Character.isWhitespace(text.charAt(i))) {
                i++;
            }
            if (i >= length) {
                break;
            }
            int s = i;
            while (i < length && !Character.isWhitespace(text.charAt(i))) {
                i++;
            }
            coreStart[n] = s;
            coreEnd[n] = i;
            n++;
        }
        this.count = n;

        this.spanStart = new int[n];
        this.spanEnd = new int[n];
        for (int t = 0; t < n; t++) {
            spanStart[t] = t == 0 ? 0 : coreStart[t];
            spanEnd[t] = t + 1 < n ? coreStart[t + 1] : length;
        }

        boolean[] paragraph = new boolean[n + 1];
        boolean[] sentence = new boolean[n + 1];
        for (int b = 1; b < n; b++) {
            int newlines = 0;
            for (int c = coreEnd[b - 1]; c < coreStart[b]; c++) {
                if (text.charAt(c) == '\n') {
                    newlines++;
                }
            }
            paragraph[b] = newlines >= 2 || (newlines == 1 && text.charAt(coreStart[b]) == '#');
            sentence[b] = paragraph[b] || newlines >= 1 || endsSentence(text, coreStart[b - 1], coreEnd[b - 1]);
        }
        if (n > 0) {
            paragraph[n] = true;
            sentence[n] = true;
        }

        this.prevParagraph = new int[n + 1];
        this.prevSentence = new int[n + 1];
        int lastParagraph = 0;
        int lastSentence = 0;
        for (int b = 0; b <= n; b++) {
            if (paragraph[b]) {
                lastParagraph = b;
            }
            if (sentence[b]) {
                lastSentence = b;
            }
            prevParagraph[b] = lastParagraph;
            prevSentence[b] = lastSentence;
        }

        this.nextParagraph = new int[n + 1];
        this.nextSentence = new int[n + 1];
        int following = n;
        int followingSentence = n;
        for (int b = n; b >= 0; b--) {
            if (paragraph[b]) {
                following = b;
            }
            if (sentence[b]) {
                followingSentence = b;
            }
            nextParagraph[b] = following;
            nextSentence[b] = followingSentence;
        }
    }

    private static boolean endsSentence(String text, int start, int end) {
        int c = end - 1;
        while (c > start && "\"')]*_".indexOf(text.charAt(c)) >= 0) {
            c--;
        }
        char last = text.charAt(c);
        return last == '.' || last == '!' || last == '?';
    }

    public String getText() {
        return text;
    }

    public int size() {
        return count;
    }

    /**
     * Gets start offset of token span.
     *
     * @param token Token index.
     * @return Character offset.
     */
    public int spanStart(int token) {
        return spanStart[token];
    }

    /**
     * Gets end offset of token span.
     *
     * @param token Token index.
     * @return Character offset, exclusive.
     */
    public int spanEnd(int token) {
        return spanEnd[token];
    }

    /**
     * Gets largest paragraph boundary not above {@code b}.
     *
     * @param b Boundary index.
     * @return Boundary or 0 if none.
     */
    public int previousParagraph(int b) {
        return prevParagraph[b];
    }

    /**
     * Gets smallest paragraph boundary not below {@code b}.
     *
     * @param b Boundary index.
     * @return Boundary, at most {@link #size()}.
     */
    public int nextParagraph(int b) {
        return nextParagraph[b];
    }

    public int previousSentence(int b) {
        return prevSentence[b];
    }

    public int nextSentence(int b) {
        return nextSentence[b];
    }
}
