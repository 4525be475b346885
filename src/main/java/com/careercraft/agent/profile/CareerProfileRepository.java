package com.careercraft.agent.profile;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface CareerProfileRepository extends MongoRepository<CareerProfile, String> {
}
