package com.example.learningsession.store;

import java.util.List;
import java.util.Map;

public interface StoreClient {
    List<Map<String,Object>> find(String collection, Map<String,Object> filter, Map<String,Integer> sort, Integer limit);
}
