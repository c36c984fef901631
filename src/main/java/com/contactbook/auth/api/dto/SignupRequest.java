package com.contactbook.auth.api.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record SignupRequest(
        @NotBlank @Size(min = 6, max = 12) String username,
        @NotBlank @Email String email,
        @NotBlank @Size(min = 6, max = 20) String password
) {
}
