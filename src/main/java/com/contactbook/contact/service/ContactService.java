package com.contactbook.contact.service;

import com.contactbook.contact.api.dto.ContactRequest;
import com.contactbook.contact.api.dto.ContactResponse;
import com.contactbook.user.domain.User;

import java.util.List;

/**
 * 联系人服务。所有操作都限定在操作用户自己的联系人范围内，
 * 不属于该用户的记录一律按“不存在”处理。
 */
public interface ContactService {

    List<ContactResponse> list(User owner);

    ContactResponse get(User owner, long contactId);

    List<ContactResponse> findByField(User owner, String fieldName, String value);

    List<ContactResponse> upcomingBirthdays(User owner);

    ContactResponse create(User owner, ContactRequest request);

    ContactResponse update(User owner, long contactId, ContactRequest request);

    /**
     * @return 删除前的联系人快照
     */
    ContactResponse delete(User owner, long contactId);
}
