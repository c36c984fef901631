package com.contactbook.contact.api;

import com.contactbook.auth.service.AuthGate;
import com.contactbook.common.exception.BusinessException;
import com.contactbook.common.exception.ErrorCode;
import com.contactbook.contact.api.dto.ContactRequest;
import com.contactbook.contact.api.dto.ContactResponse;
import com.contactbook.contact.service.ContactService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.net.URI;
import java.util.List;

/**
 * 联系人接口。
 *
 * <p>用户身份从 {@link Jwt} 解析，不接受前端传入的 userId。</p>
 */
@RestController
@RequestMapping("/api/contacts")
@Validated
@RequiredArgsConstructor
public class ContactController {

    private final ContactService contactService;
    private final AuthGate authGate;

    @GetMapping("/all")
    public List<ContactResponse> list(@AuthenticationPrincipal Jwt jwt) {
        return contactService.list(authGate.resolveIdentity(jwt));
    }

    @GetMapping("/bday")
    public List<ContactResponse> upcomingBirthdays(@AuthenticationPrincipal Jwt jwt) {
        return contactService.upcomingBirthdays(authGate.resolveIdentity(jwt));
    }

    @GetMapping("/{contactId}")
    public ContactResponse get(@AuthenticationPrincipal Jwt jwt,
                               @PathVariable("contactId") @Min(1) long contactId) {
        return contactService.get(authGate.resolveIdentity(jwt), contactId);
    }

    /**
     * 按字段检索，无匹配时返回 404。
     */
    @GetMapping("/{fieldName}/{fieldValue}")
    public List<ContactResponse> findByField(@AuthenticationPrincipal Jwt jwt,
                                             @PathVariable("fieldName") String fieldName,
                                             @PathVariable("fieldValue") String fieldValue) {
        List<ContactResponse> contacts = contactService.findByField(authGate.resolveIdentity(jwt), fieldName, fieldValue);
        if (contacts.isEmpty()) {
            throw new BusinessException(ErrorCode.CONTACT_NOT_FOUND);
        }
        return contacts;
    }

    @PostMapping
    public ResponseEntity<ContactResponse> create(@AuthenticationPrincipal Jwt jwt,
                                                  @Valid @RequestBody ContactRequest request) {
        ContactResponse created = contactService.create(authGate.resolveIdentity(jwt), request);
        return ResponseEntity.created(URI.create("/api/contacts/" + created.id())).body(created);
    }

    @PutMapping("/{contactId}")
    public ContactResponse update(@AuthenticationPrincipal Jwt jwt,
                                  @PathVariable("contactId") @Min(1) long contactId,
                                  @Valid @RequestBody ContactRequest request) {
        return contactService.update(authGate.resolveIdentity(jwt), contactId, request);
    }

    @DeleteMapping("/{contactId}")
    public ResponseEntity<Void> delete(@AuthenticationPrincipal Jwt jwt,
                                       @PathVariable("contactId") @Min(1) long contactId) {
        contactService.delete(authGate.resolveIdentity(jwt), contactId);
        return ResponseEntity.noContent().build();
    }
}
