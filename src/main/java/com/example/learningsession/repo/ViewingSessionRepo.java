package com.example.learningsession.repo;

import com.example.learningsession.model.ViewingSession;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface ViewingSessionRepo extends MongoRepository<ViewingSession, String> {}
