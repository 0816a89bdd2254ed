package com.example.fileshelf.dto;

import com.example.fileshelf.entity.UserSession;

import java.time.Instant;

public record SessionDto(String id, String userId, Instant validUntil, Instant createdAt) {

    public static SessionDto from(UserSession session) {
        return new SessionDto(session.getId(), session.getUserId(), session.getValidUntil(), session.getCreatedAt());
    }

    public boolean isExpiredAt(Instant now) {
        return !validUntil.isAfter(now);
    }
}
