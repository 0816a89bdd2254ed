package com.example.fileshelf.dto;

/**
 * A new entry plus the URL its payload should be uploaded to. Directories carry no
 * upload URL.
 */
public record AddEntryResponse(EntryDto entry, String uploadUrl) {
}
