package com.eainde.nlg.resource;

/**
 * Language id helpers. Headlines run with a {@code -head} variant of the article language.
 */
public final class Languages {

    public static final String HEADLINE_SUFFIX = "-head";

    private Languages() {
    }

    /** {@code en-head} becomes {@code en}. */
    public static String base(String language) {
        int dash = language.indexOf('-');
        return dash < 0 ? language : language.substring(0, dash);
    }

    public static String headline(String language) {
        return base(language) + HEADLINE_SUFFIX;
    }

    public static boolean isHeadline(String language) {
        return language.endsWith(HEADLINE_SUFFIX);
    }
}
