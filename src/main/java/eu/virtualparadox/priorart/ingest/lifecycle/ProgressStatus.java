package eu.virtualparadox.priorart.ingest.lifecycle;

/**
 * Progress of the running (or last) index build.
 *
 * @param processedChunks chunks whose embedding finished, successfully or not
 * @param totalChunks     chunks in the build
 * @param percent         overall progress percentage (0-100)
 */
public record ProgressStatus(int processedChunks, int totalChunks, int percent) {

}
