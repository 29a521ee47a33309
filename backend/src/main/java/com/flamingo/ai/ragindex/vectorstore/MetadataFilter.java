package com.flamingo.ai.ragindex.vectorstore;

import com.flamingo.ai.ragindex.exception.InvalidQueryException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Conjunction of conditions on record metadata.
 *
 * <p>Parsed from a JSON-style map: {@code {"lang": "en"}} is an equality test, {@code {"page":
 * {"$in": [1, 2]}}} uses an operator. Supported operators are {@code $eq}, {@code $ne}, {@code
 * $in} and {@code $nin}. Values are compared by their string form. A metadata value that is a
 * list matches when any of its elements does.
 */
public final class MetadataFilter {

  private static final MetadataFilter NONE = new MetadataFilter(List.of());

  private final List<Condition> conditions;

  private MetadataFilter(List<Condition> conditions) {
    this.conditions = List.copyOf(conditions);
  }

  /** Filter that matches every record. */
  public static MetadataFilter none() {
    return NONE;
  }

  /** Filter matching records whose {@code field} equals {@code value}. */
  public static MetadataFilter equalTo(String field, Object value) {
    return new MetadataFilter(
        List.of(new Condition(field, Operator.EQ, List.of(String.valueOf(value)))));
  }

  /**
   * Parses a filter map.
   *
   * @param filter the filter, may be null or empty
   * @return the parsed filter
   * @throws InvalidQueryException if the map uses an unknown operator or an unsupported shape
   */
  public static MetadataFilter parse(Map<String, ?> filter) {
    if (filter == null || filter.isEmpty()) {
      return NONE;
    }
    List<Condition> conditions = new ArrayList<>();
    for (Map.Entry<String, ?> entry : filter.entrySet()) {
      String field = entry.getKey();
      if (field == null || field.isBlank()) {
        throw new InvalidQueryException("Filter field names must not be blank");
      }
      Object value = entry.getValue();
      if (value instanceof Map<?, ?> operators) {
        if (operators.isEmpty()) {
          throw new InvalidQueryException("Filter on '" + field + "' has no operator");
        }
        for (Map.Entry<?, ?> op : operators.entrySet()) {
          Operator operator = Operator.fromToken(String.valueOf(op.getKey()), field);
          conditions.add(new Condition(field, operator, operands(field, operator, op.getValue())));
        }
      } else {
        conditions.add(new Condition(field, Operator.EQ, operands(field, Operator.EQ, value)));
      }
    }
    return new MetadataFilter(conditions);
  }

  public List<Condition> getConditions() {
    return conditions;
  }

  public boolean isEmpty() {
    return conditions.isEmpty();
  }

  /** Returns a filter that also requires {@code field} to equal {@code value}. */
  public MetadataFilter and(String field, Object value) {
    List<Condition> combined = new ArrayList<>(conditions);
    combined.add(new Condition(field, Operator.EQ, List.of(String.valueOf(value))));
    return new MetadataFilter(combined);
  }

  /**
   * Evaluates the filter against a record's metadata.
   *
   * @param metadata the metadata, may be null
   * @return true if every condition holds
   */
  public boolean matches(Map<String, Object> metadata) {
    for (Condition condition : conditions) {
      if (!condition.matches(metadata)) {
        return false;
      }
    }
    return true;
  }

  /** Serializes the filter back to its map form. */
  public Map<String, Object> toMap() {
    Map<String, Object> map = new LinkedHashMap<>();
    for (Condition condition : conditions) {
      Object operand =
          condition.operator().isMultiValued() ? condition.values() : condition.values().get(0);
      @SuppressWarnings("unchecked")
      Map<String, Object> ops =
          (Map<String, Object>) map.computeIfAbsent(condition.field(), k -> new LinkedHashMap<>());
      ops.put(condition.operator().getToken(), operand);
    }
    return map;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof MetadataFilter other && conditions.equals(other.conditions);
  }

  @Override
  public int hashCode() {
    return Objects.hash(conditions);
  }

  @Override
  public String toString() {
    return "MetadataFilter" + toMap();
  }

  private static List<String> operands(String field, Operator operator, Object value) {
    if (operator.isMultiValued()) {
      if (!(value instanceof Collection<?> collection)) {
        throw new InvalidQueryException(
            "Operator " + operator.getToken() + " on '" + field + "' requires a list");
      }
      List<String> values = new ArrayList<>(collection.size());
      for (Object element : collection) {
        values.add(scalar(field, element));
      }
      return values;
    }
    return List.of(scalar(field, value));
  }

  private static String scalar(String field, Object value) {
    if (value instanceof String || value instanceof Number || value instanceof Boolean) {
      return String.valueOf(value);
    }
    throw new InvalidQueryException(
        "Filter on '" + field + "' must compare against a string, number or boolean");
  }

  /** Comparison operators. */
  public enum Operator {
    EQ("$eq", false),
    NE("$ne", false),
    IN("$in", true),
    NIN("$nin", true);

    private final String token;
    private final boolean multiValued;

    Operator(String token, boolean multiValued) {
      this.token = token;
      this.multiValued = multiValued;
    }

    public String getToken() {
      return token;
    }

    public boolean isMultiValued() {
      return multiValued;
    }

    static Operator fromToken(String token, String field) {
      for (Operator operator : values()) {
        if (operator.token.equals(token)) {
          return operator;
        }
      }
      throw new InvalidQueryException(
          "Unsupported filter operator '" + token + "' on '" + field + "'");
    }
  }

  /**
   * A single condition.
   *
   * @param field metadata key
   * @param operator comparison
   * @param values operands in string form; one element unless the operator is multi-valued
   */
  public record Condition(String field, Operator operator, List<String> values) {

    boolean matches(Map<String, Object> metadata) {
      Object actual = metadata == null ? null : metadata.get(field);
      boolean hit = anyEquals(actual);
      return switch (operator) {
        case EQ, IN -> hit;
        case NE, NIN -> !hit;
      };
    }

    private boolean anyEquals(Object actual) {
      if (actual == null) {
        return false;
      }
      if (actual instanceof Collection<?> collection) {
        for (Object element : collection) {
          if (element != null && values.contains(String.valueOf(element))) {
            return true;
          }
        }
        return false;
      }
      return values.contains(String.valueOf(actual));
    }
  }
}
