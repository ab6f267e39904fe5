package com.eainde.nlg.realize.surface;

/**
 * HTML wrapping of paragraphs and sentences.
 */
public enum SurfaceFormat {
    HEADLINE("", "", "", "", true),
    BODY("<p>", "</p>", "", ". ", false),
    BODY_LIST("<ul>", "</ul>", "<li>", ".</li>", false),
    BODY_ORDERED_LIST("<ol>", "</ol>", "<li>", ".</li>", false);

    private final String paragraphStart;
    private final String paragraphEnd;
    private final String sentenceStart;
    private final String sentenceEnd;
    private final boolean failOnEmpty;

    SurfaceFormat(String paragraphStart, String paragraphEnd, String sentenceStart, String sentenceEnd,
                  boolean failOnEmpty) {
        this.paragraphStart = paragraphStart;
        this.paragraphEnd = paragraphEnd;
        this.sentenceStart = sentenceStart;
        this.sentenceEnd = sentenceEnd;
        this.failOnEmpty = failOnEmpty;
    }

    public String paragraphStart() {
        return paragraphStart;
    }

    public String paragraphEnd() {
        return paragraphEnd;
    }

    public String sentenceStart() {
        return sentenceStart;
    }

    public String sentenceEnd() {
        return sentenceEnd;
    }

    /** Whether an empty sentence is an error rather than skipped. */
    public boolean failOnEmpty() {
        return failOnEmpty;
    }
}
