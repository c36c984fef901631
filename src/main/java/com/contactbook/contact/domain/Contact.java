package com.contactbook.contact.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;

/**
 * 联系人记录。`ownerId` 指向所属用户，所有读写都按它过滤。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Contact {

    private Long id;
    private String firstName;
    private String lastName;
    private String email;
    private String phone;
    private LocalDate birthDate;
    private Long ownerId;
    private Instant createdAt;
    private Instant updatedAt;
}
