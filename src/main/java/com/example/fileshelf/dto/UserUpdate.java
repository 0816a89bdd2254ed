package com.example.fileshelf.dto;

/**
 * Partial update of a user profile. Null fields are left untouched.
 */
public record UserUpdate(String username, String displayName, String password) {
}
