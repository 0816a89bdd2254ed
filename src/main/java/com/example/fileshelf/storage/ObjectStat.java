package com.example.fileshelf.storage;

public record ObjectStat(String objectName, long size) {
}
