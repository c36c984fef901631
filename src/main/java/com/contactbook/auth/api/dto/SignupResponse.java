package com.contactbook.auth.api.dto;

public record SignupResponse(UserView user, String detail) {
}
