package com.yoursp.faceapproval.modules.capture;

import com.yoursp.faceapproval.exception.ApprovalErrorCode;
import com.yoursp.faceapproval.exception.ApprovalException;
import com.yoursp.faceapproval.modules.extractor.FaceDetection;
import com.yoursp.faceapproval.modules.extractor.FeatureExtractor;
import com.yoursp.faceapproval.modules.extractor.FeatureExtractorUnavailableException;
import com.yoursp.faceapproval.service.AuditService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Decode, detect and validate: the shared front half of capture and approval.
 * Every rejection is audited before it is thrown.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FaceEmbeddingService {

    private final FaceImageDecoder imageDecoder;
    private final FeatureExtractor featureExtractor;
    private final AuditService auditService;

    /**
     * @param faceImage request payload
     * @param purpose   "registration" or "approval", used in audit lines
     * @return the embedding of the single face in the image
     */
    public double[] extractSingleEmbedding(String faceImage, String purpose) {
        byte[] imageBytes;
        try {
            imageBytes = imageDecoder.decode(faceImage);
        } catch (ApprovalException e) {
            if (e.getCode() == ApprovalErrorCode.DECODE_FAILURE) {
                auditService.record("ERROR: Image decode failed for " + purpose + " - " + e.getMessage());
            } else {
                auditService.record("ERROR: Invalid face data received for " + purpose);
            }
            throw e;
        }

        FaceDetection detection;
        try {
            detection = featureExtractor.detect(imageBytes);
        } catch (FeatureExtractorUnavailableException e) {
            auditService.record("ERROR: Face extractor unavailable for " + purpose);
            throw e;
        }

        if (detection.faceCount() == 0) {
            auditService.record("ERROR: No face detected for " + purpose);
            throw new ApprovalException(ApprovalErrorCode.NO_FACE_DETECTED,
                    "No face detected in the image. Please ensure your face is clearly visible, "
                            + "well-lit, and centered in the camera.");
        }

        if (detection.faceCount() > 1) {
            auditService.record("WARNING: Multiple faces detected (" + detection.faceCount() + ") for " + purpose);
            throw new ApprovalException(ApprovalErrorCode.MULTIPLE_FACES_DETECTED,
                    "Multiple faces detected (" + detection.faceCount()
                            + "). Please ensure only one person is in frame.");
        }

        if (detection.embeddings().isEmpty() || detection.embeddings().get(0).length == 0) {
            auditService.record("ERROR: Failed to generate face encoding for " + purpose);
            throw new ApprovalException(ApprovalErrorCode.ENCODING_FAILURE,
                    "Failed to process face. Please try again with better lighting.");
        }

        double[] embedding = detection.embeddings().get(0);
        log.debug("Single face extracted for {}: dimensions={}", purpose, embedding.length);
        return embedding;
    }
}
