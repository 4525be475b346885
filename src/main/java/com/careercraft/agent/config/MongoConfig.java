package com.careercraft.agent.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.config.EnableMongoAuditing;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;

/**
 * Mongo holds the career data the tools read and write, and the per-turn traces.
 * Auditing fills {@code @CreatedDate} and {@code @LastModifiedDate} on save.
 */
@Configuration
@EnableMongoAuditing
@EnableMongoRepositories(basePackages = {
    "com.careercraft.agent.profile",
    "com.careercraft.agent.observability"
})
public class MongoConfig {
}
