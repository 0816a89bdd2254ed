package com.example.fileshelf.cache;

public enum CacheKind {
    ENTRY,
    ENTRIES, // list query, qualified by its filter
    USER,
    SESSION
}
