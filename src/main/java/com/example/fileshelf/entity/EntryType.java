package com.example.fileshelf.entity;

public enum EntryType {
    FILE,
    DIRECTORY,
    OTHER
}
