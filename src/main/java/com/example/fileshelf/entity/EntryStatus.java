package com.example.fileshelf.entity;

public enum EntryStatus {
    PENDING, // object upload not confirmed yet
    FINALIZED
}
