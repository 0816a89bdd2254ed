package com.example.fileshelf.dto;

public record MessageResponse(String message) {

    public static MessageResponse ok() {
        return new MessageResponse("ok");
    }
}
