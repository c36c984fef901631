package com.contactbook.common.util;

import com.contactbook.common.exception.BusinessException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TextNormalizerTest {

    @Test
    void trimsBeforeCheckingBounds() {
        assertThat(TextNormalizer.trimToLength("  tester01 ", "username", 6, 12)).isEqualTo("tester01");
        assertThat(TextNormalizer.trimToLength("123456", "username", 6, 12)).isEqualTo("123456");
    }

    @Test
    void rejectsValuesOutsideBoundsOnceTrimmed() {
        assertThatThrownBy(() -> TextNormalizer.trimToLength("     abc", "username", 6, 12))
                .isInstanceOf(BusinessException.class)
                .hasMessage("username: size must be between 6 and 12");
        assertThatThrownBy(() -> TextNormalizer.trimToLength("   ", "firstName", 1, 100))
                .isInstanceOf(BusinessException.class);
        assertThatThrownBy(() -> TextNormalizer.trimToLength(null, "phone", 12, 13))
                .isInstanceOf(BusinessException.class);
    }
}
