package com.yoursp.faceapproval.modules.extractor;

/**
 * Face detection and embedding capability. Stateless: the same image always
 * yields the same detection.
 */
public interface FeatureExtractor {

    /**
     * @param imageBytes encoded image (JPEG, PNG, ...) that already decoded
     *                   successfully
     * @return detected faces and their embeddings
     * @throws FeatureExtractorUnavailableException if the extractor cannot be
     *                                              reached
     */
    FaceDetection detect(byte[] imageBytes);
}
