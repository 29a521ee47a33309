package com.flamingo.ai.ragindex.vectorstore;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.ragindex.exception.InvalidQueryException;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("MetadataFilter Tests")
class MetadataFilterTest {

  private static final Map<String, Object> METADATA =
      Map.of("lang", "en", "page", 3, "draft", false, "tags", List.of("finance", "q3"));

  @Nested
  @DisplayName("Parsing")
  class Parsing {

    @Test
    @DisplayName("should treat null and empty maps as no filter")
    void shouldReturnNone_forNullOrEmpty() {
      assertThat(MetadataFilter.parse(null).isEmpty()).isTrue();
      assertThat(MetadataFilter.parse(Map.of())).isEqualTo(MetadataFilter.none());
    }

    @Test
    @DisplayName("should read a scalar as equality")
    void shouldReadScalarAsEquality() {
      MetadataFilter filter = MetadataFilter.parse(Map.of("lang", "en"));

      assertThat(filter.getConditions())
          .containsExactly(
              new MetadataFilter.Condition("lang", MetadataFilter.Operator.EQ, List.of("en")));
    }

    @Test
    @DisplayName("should reject an unknown operator")
    void shouldRejectUnknownOperator() {
      assertThatThrownBy(() -> MetadataFilter.parse(Map.of("page", Map.of("$gt", 2))))
          .isInstanceOf(InvalidQueryException.class)
          .hasMessageContaining("$gt");
    }

    @Test
    @DisplayName("should require a list for $in")
    void shouldRequireListForIn() {
      assertThatThrownBy(() -> MetadataFilter.parse(Map.of("page", Map.of("$in", 2))))
          .isInstanceOf(InvalidQueryException.class);
    }

    @Test
    @DisplayName("should reject nested objects as operands")
    void shouldRejectNestedOperands() {
      assertThatThrownBy(
              () -> MetadataFilter.parse(Map.of("page", Map.of("$eq", Map.of("a", 1)))))
          .isInstanceOf(InvalidQueryException.class);
    }

    @Test
    @DisplayName("should reject an empty operator map")
    void shouldRejectEmptyOperatorMap() {
      assertThatThrownBy(() -> MetadataFilter.parse(Map.of("page", Map.of())))
          .isInstanceOf(InvalidQueryException.class);
    }
  }

  @Nested
  @DisplayName("Matching")
  class Matching {

    @Test
    @DisplayName("should compare numbers and booleans by string form")
    void shouldCompareByStringForm() {
      assertThat(MetadataFilter.parse(Map.of("page", 3)).matches(METADATA)).isTrue();
      assertThat(MetadataFilter.parse(Map.of("page", "3")).matches(METADATA)).isTrue();
      assertThat(MetadataFilter.parse(Map.of("draft", false)).matches(METADATA)).isTrue();
    }

    @Test
    @DisplayName("should support $ne, $in and $nin")
    void shouldSupportOperators() {
      assertThat(MetadataFilter.parse(Map.of("lang", Map.of("$ne", "de"))).matches(METADATA))
          .isTrue();
      assertThat(
              MetadataFilter.parse(Map.of("page", Map.of("$in", List.of(1, 3)))).matches(METADATA))
          .isTrue();
      assertThat(
              MetadataFilter.parse(Map.of("page", Map.of("$nin", List.of(3)))).matches(METADATA))
          .isFalse();
    }

    @Test
    @DisplayName("should match a list value when any element matches")
    void shouldMatchListElements() {
      assertThat(MetadataFilter.equalTo("tags", "q3").matches(METADATA)).isTrue();
      assertThat(MetadataFilter.equalTo("tags", "q4").matches(METADATA)).isFalse();
    }

    @Test
    @DisplayName("should treat a missing field as not equal")
    void shouldHandleMissingField() {
      assertThat(MetadataFilter.equalTo("author", "x").matches(METADATA)).isFalse();
      assertThat(MetadataFilter.parse(Map.of("author", Map.of("$ne", "x"))).matches(METADATA))
          .isTrue();
    }

    @Test
    @DisplayName("should require every condition")
    void shouldRequireAllConditions() {
      MetadataFilter filter = MetadataFilter.equalTo("lang", "en").and("page", 4);

      assertThat(filter.matches(METADATA)).isFalse();
      assertThat(filter.toMap()).containsOnlyKeys("lang", "page");
    }
  }
}
