package com.contactbook.contact.service;

import com.contactbook.contact.domain.Contact;

import java.time.LocalDate;
import java.time.MonthDay;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * 近期生日筛选。
 * <p>
 * 取生日的月/日落在“今年”的日期，晚于今天且相差不足 7 天的联系人入选，保持输入顺序。
 * 不跨年：今年的生日已过或就是今天的都不入选。2 月 29 日在平年按 2 月 28 日计算。
 */
public final class UpcomingBirthdayFilter {

    static final long WINDOW_DAYS = 7;

    private UpcomingBirthdayFilter() {
    }

    public static List<Contact> select(List<Contact> contacts, LocalDate today) {
        return contacts.stream()
                .filter(contact -> contact.getBirthDate() != null)
                .filter(contact -> isUpcoming(contact.getBirthDate(), today))
                .toList();
    }

    static boolean isUpcoming(LocalDate birthDate, LocalDate today) {
        LocalDate nextBirthday = MonthDay.from(birthDate).atYear(today.getYear());
        if (!nextBirthday.isAfter(today)) {
            return false;
        }
        return ChronoUnit.DAYS.between(today, nextBirthday) < WINDOW_DAYS;
    }
}
