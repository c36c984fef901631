package com.contactbook.contact.api.dto;

import com.contactbook.contact.domain.Contact;

import java.time.LocalDate;

public record ContactResponse(
        Long id,
        String firstName,
        String lastName,
        String email,
        String phone,
        LocalDate birthDate,
        Long ownerId
) {

    public static ContactResponse from(Contact contact) {
        return new ContactResponse(
                contact.getId(),
                contact.getFirstName(),
                contact.getLastName(),
                contact.getEmail(),
                contact.getPhone(),
                contact.getBirthDate(),
                contact.getOwnerId()
        );
    }
}
