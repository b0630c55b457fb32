package eu.virtualparadox.priorart.query.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Already-normalized query document, typically a patent application.
 *
 * @param documentNumber publication or application number, informational only
 * @param title          document title
 * @param abstractText   abstract; kept for callers, not used to compose the query text
 * @param claims         claims in document order; the first one describes the invention
 */
public record StructuredQueryDocument(String documentNumber, String title, String abstractText, List<String> claims) {

    public StructuredQueryDocument {
        claims = claims == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(claims));
    }
}
