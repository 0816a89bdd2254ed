package com.example.fileshelf.dto;

import com.example.fileshelf.entity.User;

import java.time.Instant;

/**
 * Public view of a {@link User}; never carries the password hash.
 */
public record UserDto(String id, String username, String displayName, Instant createdAt, Instant updatedAt) {

    public static UserDto from(User user) {
        return new UserDto(user.getId(), user.getUsername(), user.getDisplayName(),
                user.getCreatedAt(), user.getUpdatedAt());
    }
}
