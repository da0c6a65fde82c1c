package wizardrunner.runner;

/**
 * Swaps plain and typographic apostrophes so a data value can match an
 * option that spells the same word with the other glyph.
 */
final class Punctuation {

    static final char PLAIN_APOSTROPHE = '\'';
    static final char RIGHT_SINGLE_QUOTE = '’';
    static final char LEFT_SINGLE_QUOTE = '‘';

    private Punctuation() { }

    /**
     * Plain apostrophes become typographic ones; if there are none, typographic
     * single quotes become plain. Values without either come back unchanged.
     */
    static String normalize(String value) {
        if (value.indexOf(PLAIN_APOSTROPHE) >= 0) {
            return value.replace(PLAIN_APOSTROPHE, RIGHT_SINGLE_QUOTE);
        }
        if (value.indexOf(RIGHT_SINGLE_QUOTE) >= 0 || value.indexOf(LEFT_SINGLE_QUOTE) >= 0) {
            return value.replace(RIGHT_SINGLE_QUOTE, PLAIN_APOSTROPHE)
                        .replace(LEFT_SINGLE_QUOTE, PLAIN_APOSTROPHE);
        }
        return value;
    }
}
