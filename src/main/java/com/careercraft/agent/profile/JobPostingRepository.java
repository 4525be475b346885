package com.careercraft.agent.profile;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface JobPostingRepository extends MongoRepository<JobPosting, String> {

    List<JobPosting> findByUserIdOrderByCreatedAtDesc(String userId);

    Optional<JobPosting> findByIdAndUserId(String id, String userId);

    /**
     * Case-insensitive match on title or company.
     */
    @Query(value = "{ 'userId': ?0, $or: [ { 'title': { $regex: ?1, $options: 'i' } }, " +
                   "{ 'company': { $regex: ?1, $options: 'i' } } ] }",
           sort = "{ 'createdAt': -1 }")
    List<JobPosting> searchByUser(String userId, String pattern);
}
