package com.example.learningsession.store;

import java.util.*;
import java.util.stream.Collectors;

import org.bson.Document;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.BasicQuery;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Component;

@Component
public class MongoStoreClient implements StoreClient {

    private final MongoTemplate mongo;

    @Autowired
    public MongoStoreClient(MongoTemplate mongo) {
        this.mongo = mongo;
    }

    @Override
    public List<Map<String, Object>> find(String collection, Map<String, Object> filter, Map<String, Integer> sort, Integer limit) {
        Query q = new BasicQuery(new Document(filter == null ? Map.of() : filter));
        if (sort != null && !sort.isEmpty()) {
            List<Sort.Order> orders = sort.entrySet().stream()
                .map(e -> new Sort.Order(e.getValue() != null && e.getValue() < 0 ? Sort.Direction.DESC : Sort.Direction.ASC, e.getKey()))
                .collect(Collectors.toList());
            q.with(Sort.by(orders));
        }
        if (limit != null && limit > 0) q.limit(limit);
        List<Document> docs = mongo.find(q, Document.class, collection);
        return docs.stream().map(d -> (Map<String,Object>) d).collect(Collectors.toList());
    }
}
