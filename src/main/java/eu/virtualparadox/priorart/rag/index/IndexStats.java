package eu.virtualparadox.priorart.rag.index;

/**
 * @param fingerprint configuration the store was built with
 * @param recordCount number of embedded chunks
 * @param sourceCount number of distinct source documents with at least one record
 * @param dimension   vector length, 0 for an empty store
 */
public record IndexStats(Fingerprint fingerprint, int recordCount, int sourceCount, int dimension) {

}
