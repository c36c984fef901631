package com.contactbook.contact.mapper;

import com.contactbook.contact.domain.Contact;
import com.contactbook.contact.domain.ContactField;
import com.contactbook.user.domain.User;
import com.contactbook.user.mapper.UserMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mybatis.spring.boot.test.autoconfigure.MybatisTest;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.jdbc.Sql;
import org.springframework.test.context.jdbc.SqlConfig;

import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 在 H2（MySQL 模式）上执行真实的 ContactMapper.xml，验证每条语句都按 owner_id 隔离。
 */
@MybatisTest
@ActiveProfiles("h2")
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Sql(scripts = "classpath:db/schema.sql", config = @SqlConfig(transactionMode = SqlConfig.TransactionMode.ISOLATED))
class ContactMapperTest {

    private static final Instant NOW = Instant.parse("2024-06-10T09:00:00Z");

    @Autowired
    private ContactMapper contactMapper;

    @Autowired
    private UserMapper userMapper;

    private long aliceId;
    private long bobId;

    @BeforeEach
    void setUp() {
        aliceId = insertUser("alice01", "alice@example.com");
        bobId = insertUser("bob0001", "bob@example.com");
    }

    @Test
    void findByOwnerReturnsOnlyOwnRowsInIdOrder() {
        Contact first = insertContact(aliceId, "John", "x@y.com", LocalDate.of(1990, 1, 1));
        insertContact(bobId, "Bobby", "x@y.com", LocalDate.of(1991, 1, 1));
        Contact second = insertContact(aliceId, "Jack", "j@y.com", LocalDate.of(1992, 1, 1));

        List<Contact> contacts = contactMapper.findByOwner(aliceId);

        assertThat(contacts).extracting(Contact::getId).containsExactly(first.getId(), second.getId());
        assertThat(contacts).allSatisfy(contact -> assertThat(contact.getOwnerId()).isEqualTo(aliceId));
        assertThat(contacts.get(0).getBirthDate()).isEqualTo(LocalDate.of(1990, 1, 1));
        assertThat(contacts.get(0).getCreatedAt()).isEqualTo(NOW);
    }

    @Test
    void findByIdIsScopedToOwner() {
        Contact contact = insertContact(aliceId, "John", "x@y.com", LocalDate.of(1990, 1, 1));

        assertThat(contactMapper.findByIdAndOwner(contact.getId(), aliceId)).isNotNull();
        assertThat(contactMapper.findByIdAndOwner(contact.getId(), bobId)).isNull();
    }

    @Test
    void updateOfForeignRowTouchesNothing() {
        Contact contact = insertContact(aliceId, "John", "x@y.com", LocalDate.of(1990, 1, 1));

        Contact hijack = copyOf(contact);
        hijack.setOwnerId(bobId);
        hijack.setFirstName("Mallory");
        assertThat(contactMapper.update(hijack)).isZero();
        assertThat(contactMapper.findByIdAndOwner(contact.getId(), aliceId).getFirstName()).isEqualTo("John");

        Contact replacement = copyOf(contact);
        replacement.setFirstName("Jane");
        replacement.setPhone("+380509999999");
        assertThat(contactMapper.update(replacement)).isEqualTo(1);
        Contact stored = contactMapper.findByIdAndOwner(contact.getId(), aliceId);
        assertThat(stored.getFirstName()).isEqualTo("Jane");
        assertThat(stored.getPhone()).isEqualTo("+380509999999");
    }

    @Test
    void deleteOfForeignRowTouchesNothing() {
        Contact contact = insertContact(aliceId, "John", "x@y.com", LocalDate.of(1990, 1, 1));

        assertThat(contactMapper.deleteByIdAndOwner(contact.getId(), bobId)).isZero();
        assertThat(contactMapper.findByIdAndOwner(contact.getId(), aliceId)).isNotNull();

        assertThat(contactMapper.deleteByIdAndOwner(contact.getId(), aliceId)).isEqualTo(1);
        assertThat(contactMapper.findByIdAndOwner(contact.getId(), aliceId)).isNull();
    }

    @Test
    void fieldSearchMatchesExactValueWithinOwner() {
        Contact own = insertContact(aliceId, "John", "x@y.com", LocalDate.of(1990, 1, 1));
        insertContact(aliceId, "Jack", "other@y.com", LocalDate.of(1991, 1, 1));
        insertContact(bobId, "Bobby", "x@y.com", LocalDate.of(1990, 1, 1));

        assertThat(contactMapper.findByOwnerAndField(aliceId, ContactField.EMAIL, "x@y.com"))
                .extracting(Contact::getId).containsExactly(own.getId());
        assertThat(contactMapper.findByOwnerAndField(aliceId, ContactField.EMAIL, "X@Y.COM")).isEmpty();
        assertThat(contactMapper.findByOwnerAndField(aliceId, ContactField.BIRTH_DATE, LocalDate.of(1990, 1, 1)))
                .extracting(Contact::getId).containsExactly(own.getId());
    }

    @Test
    void everyWhitelistedColumnIsQueryable() {
        Contact own = insertContact(aliceId, "John", "x@y.com", LocalDate.of(1990, 1, 1));

        for (ContactField field : ContactField.values()) {
            Object value = switch (field) {
                case FIRST_NAME -> own.getFirstName();
                case LAST_NAME -> own.getLastName();
                case EMAIL -> own.getEmail();
                case PHONE -> own.getPhone();
                case BIRTH_DATE -> own.getBirthDate();
            };
            assertThat(contactMapper.findByOwnerAndField(aliceId, field, value))
                    .as(field.getColumn())
                    .extracting(Contact::getId).containsExactly(own.getId());
            assertThat(contactMapper.findByOwnerAndField(bobId, field, value)).as(field.getColumn()).isEmpty();
        }
    }

    private long insertUser(String username, String email) {
        User user = User.builder()
                .username(username)
                .email(email)
                .passwordHash("$2a$04$hash")
                .confirmed(true)
                .createdAt(NOW)
                .updatedAt(NOW)
                .build();
        userMapper.insert(user);
        return user.getId();
    }

    private Contact insertContact(long ownerId, String firstName, String email, LocalDate birthDate) {
        Contact contact = Contact.builder()
                .firstName(firstName)
                .lastName("Doe")
                .email(email)
                .phone("+380501234567")
                .birthDate(birthDate)
                .ownerId(ownerId)
                .createdAt(NOW)
                .updatedAt(NOW)
                .build();
        contactMapper.insert(contact);
        return contact;
    }

    private static Contact copyOf(Contact contact) {
        return new Contact(contact.getId(), contact.getFirstName(), contact.getLastName(), contact.getEmail(),
                contact.getPhone(), contact.getBirthDate(), contact.getOwnerId(), contact.getCreatedAt(),
                NOW.plus(1, ChronoUnit.MINUTES));
    }
}
