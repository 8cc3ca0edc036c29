package com.phillippitts.telesession.exception;

/**
 * Thrown when a participant sends an offer while the other participant already owns
 * the negotiation.
 */
public class ConflictingOfferException extends SessionException {

    private final String offererId;

    public ConflictingOfferException(String sessionId, String offererId) {
        super(ErrorCode.CONFLICTING_OFFER, sessionId, "Offer already made by " + offererId);
        this.offererId = offererId;
    }

    public String getOffererId() {
        return offererId;
    }
}
