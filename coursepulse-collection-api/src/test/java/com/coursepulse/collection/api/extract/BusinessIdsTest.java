package com.coursepulse.collection.api.extract;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.UUID;
import org.junit.jupiter.api.Test;

class BusinessIdsTest {

    @Test
    void orElseKeepsPresentIdsAndFillsMissingOnes() {
        UUID user = UUID.randomUUID();
        UUID course = UUID.randomUUID();
        UUID otherUser = UUID.randomUUID();

        BusinessIds merged = BusinessIds.ofUser(user).orElse(new BusinessIds(otherUser, course, null));

        assertThat(merged.userId()).isEqualTo(user);
        assertThat(merged.courseId()).isEqualTo(course);
        assertThat(merged.lessonId()).isNull();
    }

    @Test
    void noneIsEmptyAndNoneExtractorReturnsIt() {
        assertThat(BusinessIds.none().isEmpty()).isTrue();
        assertThat(new BusinessIdExtractor.None().extract(new Object[0], null)).isSameAs(BusinessIds.none());
        assertThat(BusinessIds.none().orElse(null)).isSameAs(BusinessIds.none());
    }
}
