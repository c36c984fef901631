package com.contactbook.contact.service.impl;

import com.contactbook.common.exception.BusinessException;
import com.contactbook.common.exception.ErrorCode;
import com.contactbook.common.util.TextNormalizer;
import com.contactbook.contact.api.dto.ContactRequest;
import com.contactbook.contact.api.dto.ContactResponse;
import com.contactbook.contact.domain.Contact;
import com.contactbook.contact.domain.ContactField;
import com.contactbook.contact.mapper.ContactMapper;
import com.contactbook.contact.service.ContactService;
import com.contactbook.contact.service.UpcomingBirthdayFilter;
import com.contactbook.user.domain.User;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * 联系人服务实现。
 *
 * <p>职责：</p>
 * <ul>
 *   <li>按所属用户列出、读取、检索联系人</li>
 *   <li>创建时绑定操作用户，更新时整体替换可变字段</li>
 *   <li>校验生日必须早于今天</li>
 * </ul>
 *
 * <p>错误处理：不存在或不属于当前用户统一抛出 {@link ErrorCode#CONTACT_NOT_FOUND}。</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ContactServiceImpl implements ContactService {

    static final int NAME_MAX = 100;
    static final int EMAIL_MAX = 100;
    static final int PHONE_MIN = 12;
    static final int PHONE_MAX = 13;

    private final ContactMapper contactMapper;
    private final Clock clock;

    @Override
    @Transactional(readOnly = true)
    public List<ContactResponse> list(User owner) {
        return toResponses(contactMapper.findByOwner(owner.getId()));
    }

    @Override
    @Transactional(readOnly = true)
    public ContactResponse get(User owner, long contactId) {
        return ContactResponse.from(requireOwned(owner, contactId));
    }

    /**
     * 按字段等值检索。
     *
     * <p>字段名必须在 {@link ContactField} 白名单内，否则返回 400；值按字段类型解析后参与比较。</p>
     */
    @Override
    @Transactional(readOnly = true)
    public List<ContactResponse> findByField(User owner, String fieldName, String value) {
        ContactField field = ContactField.require(fieldName);
        Object typedValue = field.parseValue(value);
        return toResponses(contactMapper.findByOwnerAndField(owner.getId(), field, typedValue));
    }

    @Override
    @Transactional(readOnly = true)
    public List<ContactResponse> upcomingBirthdays(User owner) {
        List<Contact> contacts = contactMapper.findByOwner(owner.getId());
        return toResponses(UpcomingBirthdayFilter.select(contacts, LocalDate.now(clock)));
    }

    @Override
    @Transactional
    public ContactResponse create(User owner, ContactRequest request) {
        validateBirthDate(request.birthDate());
        Instant now = Instant.now(clock);
        Contact contact = Contact.builder()
                .ownerId(owner.getId())
                .createdAt(now)
                .updatedAt(now)
                .build();
        apply(contact, request);
        contactMapper.insert(contact);
        log.info("Contact created id={} ownerId={}", contact.getId(), owner.getId());
        return ContactResponse.from(contact);
    }

    @Override
    @Transactional
    public ContactResponse update(User owner, long contactId, ContactRequest request) {
        validateBirthDate(request.birthDate());
        Contact patch = Contact.builder()
                .id(contactId)
                .ownerId(owner.getId())
                .updatedAt(Instant.now(clock))
                .build();
        apply(patch, request);
        if (contactMapper.update(patch) == 0) {
            throw new BusinessException(ErrorCode.CONTACT_NOT_FOUND);
        }
        // 更新后回读，保证返回数据为最新快照
        return ContactResponse.from(requireOwned(owner, contactId));
    }

    @Override
    @Transactional
    public ContactResponse delete(User owner, long contactId) {
        Contact existing = requireOwned(owner, contactId);
        contactMapper.deleteByIdAndOwner(contactId, owner.getId());
        log.info("Contact deleted id={} ownerId={}", contactId, owner.getId());
        return ContactResponse.from(existing);
    }

    private Contact requireOwned(User owner, long contactId) {
        Contact contact = contactMapper.findByIdAndOwner(contactId, owner.getId());
        if (contact == null) {
            throw new BusinessException(ErrorCode.CONTACT_NOT_FOUND);
        }
        return contact;
    }

    private void validateBirthDate(LocalDate birthDate) {
        if (birthDate == null || !birthDate.isBefore(LocalDate.now(clock))) {
            throw new BusinessException(ErrorCode.INVALID_BIRTH_DATE);
        }
    }

    private static void apply(Contact contact, ContactRequest request) {
        contact.setFirstName(TextNormalizer.trimToLength(request.firstName(), "firstName", 1, NAME_MAX));
        contact.setLastName(TextNormalizer.trimToLength(request.lastName(), "lastName", 1, NAME_MAX));
        contact.setEmail(TextNormalizer.trimToLength(request.email(), "email", 1, EMAIL_MAX));
        contact.setPhone(TextNormalizer.trimToLength(request.phone(), "phone", PHONE_MIN, PHONE_MAX));
        contact.setBirthDate(request.birthDate());
    }

    private static List<ContactResponse> toResponses(List<Contact> contacts) {
        return contacts.stream().map(ContactResponse::from).toList();
    }
}
