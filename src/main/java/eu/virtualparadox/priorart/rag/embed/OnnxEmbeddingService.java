package eu.virtualparadox.priorart.rag.embed;

import ai.djl.huggingface.tokenizers.Encoding;
import ai.djl.huggingface.tokenizers.HuggingFaceTokenizer;
import eu.virtualparadox.priorart.exception.EmbeddingProviderException;
import eu.virtualparadox.priorart.util.OrtInitializer;
import eu.virtualparadox.priorart.util.VectorMath;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.onnxruntime.*;

import java.io.IOException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

/**
 * Local sentence-embedding model run through ONNX Runtime.
 * <p>
 * Expects {@code model.onnx} and {@code tokenizer.json} under the model root. Token vectors
 * are mean-pooled over the attention mask and L2-normalized.
 */
public final class OnnxEmbeddingService implements Embedder {

    private static final Logger logger = LoggerFactory.getLogger(OnnxEmbeddingService.class);

    private static final int MAX_LEN = 512;

    private final Path modelPath;
    private final Path tokenizerPath;
    private final String providerId;
    private final int concurrentCallers;

    private OrtEnvironment env;
    private OrtSession session;
    private HuggingFaceTokenizer tokenizer;

    public OnnxEmbeddingService(final Path modelRoot, final String modelId, final int concurrentCallers) {
        this.modelPath = modelRoot.resolve("model.onnx");
        this.tokenizerPath = modelRoot.resolve("tokenizer.json");
        this.providerId = EmbeddingProvider.ONNX.providerId(modelId);
        this.concurrentCallers = concurrentCallers;
    }

    @PostConstruct
    public void init() throws IOException, OrtException {
        this.env = OrtEnvironment.getEnvironment();
        final OrtSession.SessionOptions options = OrtInitializer.initializeOrt(concurrentCallers);

        this.session = env.createSession(modelPath.toString(), options);
        this.tokenizer = HuggingFaceTokenizer.newInstance(tokenizerPath);

        logger.info("Loaded ONNX embedding model: {}", modelPath);
        logger.info("Model expects inputs: {}", session.getInputNames());
    }

    @PreDestroy
    public void cleanup() throws OrtException {
        if (tokenizer != null) {
            tokenizer.close();
        }
        if (session != null) {
            session.close();
        }
    }

    @Override
    public float[] embed(final String text) {
        if (session == null) {
            throw new EmbeddingProviderException("ONNX embedding model is not initialized");
        }
        try {
            final Encoding encoding = tokenizer.encode(text);
            final long[] ids = encoding.getIds();
            final long[] mask = encoding.getAttentionMask();
            final int len = Math.min(ids.length, MAX_LEN);

            final long[][] inputIdArr = new long[1][len];
            final long[][] attnMaskArr = new long[1][len];
            final long[][] tokenTypeArr = new long[1][len];
            System.arraycopy(ids, 0, inputIdArr[0], 0, len);
            System.arraycopy(mask, 0, attnMaskArr[0], 0, len);

            try (final OnnxTensor inputIds = OnnxTensor.createTensor(env, inputIdArr);
                 final OnnxTensor attentionMask = OnnxTensor.createTensor(env, attnMaskArr);
                 final OnnxTensor tokenTypeTensor = OnnxTensor.createTensor(env, tokenTypeArr)) {

                final Map<String, OnnxTensor> inputs = new HashMap<>();
                if (session.getInputNames().contains("input_ids")) {
                    inputs.put("input_ids", inputIds);
                }
                if (session.getInputNames().contains("attention_mask")) {
                    inputs.put("attention_mask", attentionMask);
                }
                if (session.getInputNames().contains("token_type_ids")) {
                    inputs.put("token_type_ids", tokenTypeTensor);
                }

                try (final OrtSession.Result result = session.run(inputs)) {
                    final float[][][] embeddings = (float[][][]) result.get(0).getValue();
                    final float[] vec = meanPool(embeddings[0], attnMaskArr[0]);
                    VectorMath.normalize(vec);
                    return vec;
                }
            }
        } catch (final OrtException | RuntimeException e) {
            throw new EmbeddingProviderException("ONNX embedding failed: " + e.getMessage(), e);
        }
    }

    @Override
    public String providerId() {
        return providerId;
    }

    private float[] meanPool(final float[][] tokenVectors, final long[] attentionMask) {
        final int hiddenDim = tokenVectors[0].length;
        final float[] pooled = new float[hiddenDim];

        int validCount = 0;
        for (int i = 0; i < tokenVectors.length; i++) {
            if (attentionMask[i] == 1) {
                final float[] tokenVec = tokenVectors[i];
                for (int j = 0; j < hiddenDim; j++) {
                    pooled[j] += tokenVec[j];
                }
                validCount++;
            }
        }

        if (validCount > 0) {
            for (int j = 0; j < hiddenDim; j++) {
                pooled[j] /= validCount;
            }
        }
        return pooled;
    }
}
