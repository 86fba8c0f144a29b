package com.example.learningsession.repo;

import com.example.learningsession.model.OutboxEvent;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface OutboxRepo extends MongoRepository<OutboxEvent, String> {
    List<OutboxEvent> findTop50ByProcessedFalseOrderByTsAsc();
    long countByProcessedFalse();
}
