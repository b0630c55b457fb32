package eu.virtualparadox.priorart.query;

import eu.virtualparadox.priorart.query.model.RetrievalQuery;
import eu.virtualparadox.priorart.query.model.StructuredQueryDocument;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Turns a {@link RetrievalQuery} into the text that gets embedded.
 * <p>
 * Raw text is used as is. A structured document contributes its title and its first
 * claim, joined by a newline; the abstract is not used.
 * </p>
 * Pure: no I/O, no state.
 */
@Component
public class QueryComposer {

    /**
     * @return a description of what is wrong with {@code query}, or empty if it can be composed
     */
    public Optional<String> validate(final RetrievalQuery query) {
        if (query == null) {
            return Optional.of("query must not be null");
        }
        if (query instanceof RetrievalQuery.RawText raw) {
            return StringUtils.isBlank(raw.text())
                    ? Optional.of("query text must not be blank")
                    : Optional.empty();
        }
        final StructuredQueryDocument document = ((RetrievalQuery.Structured) query).document();
        if (document == null) {
            return Optional.of("structured query must carry a document");
        }
        if (StringUtils.isBlank(document.title())) {
            return Optional.of("query document " + document.documentNumber() + " has no title");
        }
        if (firstClaim(document).isEmpty()) {
            return Optional.of("query document " + document.documentNumber() + " has no claims");
        }
        return Optional.empty();
    }

    /**
     * @throws IllegalArgumentException if {@link #validate(RetrievalQuery)} reports a problem
     */
    public String compose(final RetrievalQuery query) {
        validate(query).ifPresent(problem -> {
            throw new IllegalArgumentException(problem);
        });
        if (query instanceof RetrievalQuery.RawText raw) {
            return raw.text();
        }
        final StructuredQueryDocument document = ((RetrievalQuery.Structured) query).document();
        return document.title() + "\n" + firstClaim(document).orElseThrow();
    }

    private static Optional<String> firstClaim(final StructuredQueryDocument document) {
        return document.claims().stream()
                .filter(StringUtils::isNotBlank)
                .findFirst();
    }
}
