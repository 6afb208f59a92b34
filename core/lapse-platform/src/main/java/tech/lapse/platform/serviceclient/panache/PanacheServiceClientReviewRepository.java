package tech.lapse.platform.serviceclient.panache;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.EntityManager;
import tech.lapse.platform.serviceclient.ServiceClientReview;
import tech.lapse.platform.serviceclient.ServiceClientReviewRepository;
import tech.lapse.platform.serviceclient.entity.ServiceClientReviewEntity;
import tech.lapse.platform.serviceclient.mapper.ServiceClientReviewMapper;
import tech.lapse.platform.shared.EntityType;
import tech.lapse.platform.shared.TsidGenerator;

import java.time.Instant;

/**
 * EntityManager-based implementation of ServiceClientReviewRepository.
 */
@ApplicationScoped
public class PanacheServiceClientReviewRepository implements ServiceClientReviewRepository {

    @Inject
    EntityManager em;

    @Override
    public void append(ServiceClientReview review) {
        ServiceClientReviewEntity entity = ServiceClientReviewMapper.toEntity(review);
        if (entity.id == null) {
            entity.id = TsidGenerator.generate(EntityType.SERVICE_CLIENT_REVIEW);
        }
        if (entity.createdAt == null) {
            entity.createdAt = Instant.now();
        }
        em.persist(entity);
    }
}
