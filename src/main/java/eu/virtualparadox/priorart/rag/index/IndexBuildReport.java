package eu.virtualparadox.priorart.rag.index;

import java.util.List;

/**
 * Outcome of one index build.
 *
 * @param store           the built, not yet persisted store
 * @param documentCount   number of source documents handed to the build
 * @param chunkCount      number of chunks produced by the chunker
 * @param droppedChunkIds chunks left out because embedding kept failing
 * @param warnings        non-fatal problems worth showing to the caller (e.g. empty documents)
 */
public record IndexBuildReport(IndexStore store,
                               int documentCount,
                               int chunkCount,
                               List<String> droppedChunkIds,
                               List<String> warnings) {

    public IndexBuildReport {
        droppedChunkIds = List.copyOf(droppedChunkIds);
        warnings = List.copyOf(warnings);
    }

    public boolean isComplete() {
        return droppedChunkIds.isEmpty();
    }
}
