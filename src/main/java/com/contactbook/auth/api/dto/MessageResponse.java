package com.contactbook.auth.api.dto;

public record MessageResponse(String message) {
}
