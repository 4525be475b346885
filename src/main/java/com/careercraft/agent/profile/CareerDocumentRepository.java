package com.careercraft.agent.profile;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface CareerDocumentRepository extends MongoRepository<CareerDocument, String> {
}
