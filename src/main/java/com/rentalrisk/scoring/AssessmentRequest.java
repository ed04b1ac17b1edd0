package com.rentalrisk.scoring;

/**
 * @param bookingId optional; when present the booking's parameters feed the booking sub-score
 */
public record AssessmentRequest(
    String productId,
    String renterId,
    String bookingId,
    boolean includeRecommendations
) {

    public static AssessmentRequest of(String productId, String renterId, String bookingId) {
        return new AssessmentRequest(productId, renterId, bookingId, true);
    }
}
