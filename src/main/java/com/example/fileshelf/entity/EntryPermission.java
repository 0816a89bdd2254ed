package com.example.fileshelf.entity;

public enum EntryPermission {
    PRIVATE,

    PUBLIC,
    PUBLIC_READONLY,

    INCLUSIVE,
    INCLUSIVE_READONLY,

    OTHER
}
