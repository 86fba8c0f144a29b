package com.example.learningsession.bridge;

import lombok.Value;

@Value
public class CacheUpdate {
    String cacheKey;
    Object snapshot;
}
