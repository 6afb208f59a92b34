package tech.lapse.platform.serviceclient.mapper;

import tech.lapse.platform.serviceclient.ServiceClientReview;
import tech.lapse.platform.serviceclient.entity.ServiceClientReviewEntity;

public final class ServiceClientReviewMapper {

    private ServiceClientReviewMapper() {
    }

    public static ServiceClientReviewEntity toEntity(ServiceClientReview review) {
        ServiceClientReviewEntity entity = new ServiceClientReviewEntity();
        entity.id = review.id();
        entity.serviceClientId = review.serviceClientId();
        entity.reviewedByUserId = review.reviewedByUserId();
        entity.status = review.status();
        entity.notes = review.notes() != null ? review.notes() : "";
        entity.createdAt = review.createdAt();
        return entity;
    }
}
