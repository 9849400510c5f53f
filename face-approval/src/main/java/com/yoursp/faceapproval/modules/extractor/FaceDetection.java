package com.yoursp.faceapproval.modules.extractor;

import java.util.List;

/**
 * What the extractor found in one image.
 *
 * @param faceCount  number of faces located
 * @param embeddings one embedding per face it could encode; may be shorter
 *                   than {@code faceCount}
 */
public record FaceDetection(int faceCount, List<double[]> embeddings) {

    public FaceDetection {
        embeddings = embeddings != null ? List.copyOf(embeddings) : List.of();
    }
}
