package eu.virtualparadox.priorart.util;

import ai.onnxruntime.OrtSession;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class OrtInitializer {

    private OrtInitializer() {
        // Prevent instantiation
    }

    /**
     * Session options for the embedding model. Build workers already call the session
     * concurrently, so intra-op threads are split across them.
     *
     * @param concurrentCallers number of embedding calls that may run at the same time
     */
    public static OrtSession.SessionOptions initializeOrt(final int concurrentCallers) {
        try {
            final OrtSession.SessionOptions opts = new OrtSession.SessionOptions();

            // leave one core free for other tasks
            final int availableProcessors = Runtime.getRuntime().availableProcessors() - 1;
            final int intraThreads = Math.max(1, availableProcessors / Math.max(1, concurrentCallers));

            opts.setIntraOpNumThreads(intraThreads);
            opts.setInterOpNumThreads(1);

            log.info("Intra-op threads: {}, Inter-op threads: {}", intraThreads, 1);
            return opts;
        }
        catch (Exception e) {
            throw new IllegalStateException("Failed to initialize ONNX Runtime", e);
        }
    }
}
