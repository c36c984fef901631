package com.contactbook.contact.api.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Past;
import jakarta.validation.constraints.Size;

import java.time.LocalDate;

/**
 * 创建/更新联系人请求。更新为整体替换，所有字段必填。
 */
public record ContactRequest(
        @NotBlank @Size(max = 100) String firstName,
        @NotBlank @Size(max = 100) String lastName,
        @NotBlank @Email @Size(max = 100) String email,
        @NotBlank @Size(min = 12, max = 13) String phone,
        @NotNull @Past @JsonFormat(pattern = "yyyy-MM-dd") LocalDate birthDate
) {
}
