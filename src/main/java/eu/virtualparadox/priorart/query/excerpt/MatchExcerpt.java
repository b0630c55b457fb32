package eu.virtualparadox.priorart.query.excerpt;

/**
 * A matched fragment with some surrounding source text.
 *
 * @param sourceId    source document the fragment was cut from
 * @param startOffset offset of {@code match} in the source text
 * @param before      context preceding the match, possibly empty
 * @param match       the matched chunk text
 * @param after       context following the match, possibly empty
 */
public record MatchExcerpt(String sourceId, int startOffset, String before, String match, String after) {

    public String asString() {
        return before + "[" + match + "]" + after;
    }
}
