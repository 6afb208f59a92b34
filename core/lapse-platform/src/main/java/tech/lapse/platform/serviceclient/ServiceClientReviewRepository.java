package tech.lapse.platform.serviceclient;

/**
 * Append-only store of service client reviews.
 */
public interface ServiceClientReviewRepository {

    void append(ServiceClientReview review);
}
