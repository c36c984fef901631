package com.contactbook.support;

import com.contactbook.contact.domain.Contact;
import com.contactbook.contact.domain.ContactField;
import com.contactbook.contact.mapper.ContactMapper;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicLong;

public class InMemoryContactMapper implements ContactMapper {

    private final Map<Long, Contact> rows = new TreeMap<>();
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public List<Contact> findByOwner(Long ownerId) {
        return rows.values().stream()
                .filter(contact -> Objects.equals(contact.getOwnerId(), ownerId))
                .map(InMemoryContactMapper::copy)
                .toList();
    }

    @Override
    public Contact findByIdAndOwner(Long id, Long ownerId) {
        Contact row = rows.get(id);
        if (row == null || !Objects.equals(row.getOwnerId(), ownerId)) {
            return null;
        }
        return copy(row);
    }

    @Override
    public List<Contact> findByOwnerAndField(Long ownerId, ContactField field, Object value) {
        return rows.values().stream()
                .filter(contact -> Objects.equals(contact.getOwnerId(), ownerId))
                .filter(contact -> Objects.equals(valueOf(contact, field), value))
                .map(InMemoryContactMapper::copy)
                .toList();
    }

    @Override
    public void insert(Contact contact) {
        contact.setId(sequence.incrementAndGet());
        rows.put(contact.getId(), copy(contact));
    }

    @Override
    public int update(Contact contact) {
        Contact row = rows.get(contact.getId());
        if (row == null || !Objects.equals(row.getOwnerId(), contact.getOwnerId())) {
            return 0;
        }
        row.setFirstName(contact.getFirstName());
        row.setLastName(contact.getLastName());
        row.setEmail(contact.getEmail());
        row.setPhone(contact.getPhone());
        row.setBirthDate(contact.getBirthDate());
        row.setUpdatedAt(contact.getUpdatedAt());
        return 1;
    }

    @Override
    public int deleteByIdAndOwner(Long id, Long ownerId) {
        Contact row = rows.get(id);
        if (row == null || !Objects.equals(row.getOwnerId(), ownerId)) {
            return 0;
        }
        rows.remove(id);
        return 1;
    }

    public int size() {
        return rows.size();
    }

    private static Object valueOf(Contact contact, ContactField field) {
        return switch (field) {
            case FIRST_NAME -> contact.getFirstName();
            case LAST_NAME -> contact.getLastName();
            case EMAIL -> contact.getEmail();
            case PHONE -> contact.getPhone();
            case BIRTH_DATE -> contact.getBirthDate();
        };
    }

    private static Contact copy(Contact contact) {
        if (contact == null) {
            return null;
        }
        return new Contact(contact.getId(), contact.getFirstName(), contact.getLastName(), contact.getEmail(),
                contact.getPhone(), contact.getBirthDate(), contact.getOwnerId(), contact.getCreatedAt(), contact.getUpdatedAt());
    }
}
