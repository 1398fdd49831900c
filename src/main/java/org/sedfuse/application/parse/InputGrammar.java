package org.sedfuse.application.parse;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.sedfuse.validation.Strings;

/**
 * <strong>What:</strong> Ordered list of named input fields, each with the pattern its raw text must match.
 * <p><strong>Why:</strong> Input files differ in which columns they carry; the grammar is configured once per batch
 * and compiled into a single anchored expression so malformed lines fail as a whole.</p>
 * <p><strong>Role:</strong> Immutable configuration object consumed by {@link InputLineParser}.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @since 0.1.0
 */
public final class InputGrammar {
  /** Latitude field. */
  public static final String LAT = "lat";
  /** Longitude field. */
  public static final String LON = "lon";
  /** Primary catalog object name field. */
  public static final String NAME = "name";
  /** Redshift field. */
  public static final String REDSHIFT = "z";
  /** Alternate identifier field. */
  public static final String ALTERNATE_ID = "id";

  /** Fields with a fixed meaning; every other configured field is carried as an extra. */
  public static final Set<String> SEMANTIC_FIELDS = Set.of(LAT, LON, NAME, REDSHIFT, ALTERNATE_ID);

  /** Default field order. */
  public static final List<String> DEFAULT_FIELDS = List.of(LAT, LON, NAME, REDSHIFT, ALTERNATE_ID, "rm", "rm_err");

  static final String DECIMAL_PATTERN = "[+-]?\\d*\\.?\\d*";
  static final String EXPONENT_DECIMAL_PATTERN = "[+-]?\\d*\\.?\\d*(?:[eE][+-]?\\d+)?";
  static final String TEXT_PATTERN = ".*?";

  private final List<Field> fields;
  private final Pattern compiled;
  private final int[] groupIndexes;

  private InputGrammar(List<Field> fields) {
    if (fields.isEmpty()) {
      throw new IllegalArgumentException("grammar requires at least one field");
    }
    this.fields = List.copyOf(fields);
    this.groupIndexes = new int[fields.size()];
    StringBuilder regex = new StringBuilder("^\\s*");
    int group = 1;
    for (int i = 0; i < fields.size(); i++) {
      Field field = fields.get(i);
      if (i > 0) {
        regex.append("\\s+");
      }
      // quoted alternative first so a quoted value may contain whitespace
      regex.append("(?:\"(").append(field.pattern()).append(")\"|(").append(field.pattern()).append("))");
      groupIndexes[i] = group;
      group += 2 * (1 + Pattern.compile(field.pattern()).matcher("").groupCount());
    }
    regex.append("\\s*$");
    this.compiled = Pattern.compile(regex.toString());
  }

  /**
   * Returns the grammar with {@link #DEFAULT_FIELDS} and default patterns.
   *
   * @return default grammar
   */
  public static InputGrammar defaults() {
    return of(DEFAULT_FIELDS, Map.of());
  }

  /**
   * Builds a grammar from field names and optional per-field pattern overrides.
   *
   * @param fieldNames ordered field names; each must be an identifier and unique
   * @param patternOverrides patterns replacing the default pattern of the named fields
   * @return compiled grammar
   * @throws IllegalArgumentException if a name is invalid or duplicated, an override names an unknown field, or a
   *     pattern does not compile or does not accept the empty string
   */
  public static InputGrammar of(List<String> fieldNames, Map<String, String> patternOverrides) {
    Objects.requireNonNull(fieldNames, "fieldNames");
    Map<String, String> overrides = patternOverrides == null ? Map.of() : patternOverrides;
    Set<String> seen = new HashSet<>();
    List<Field> fields = new ArrayList<>(fieldNames.size());
    for (String raw : fieldNames) {
      String name = Strings.requireIdentifier("field", raw == null ? null : raw.trim());
      if (!seen.add(name)) {
        throw new IllegalArgumentException("duplicate field: " + name);
      }
      fields.add(new Field(name, overrides.getOrDefault(name, defaultPattern(name))));
    }
    for (String key : overrides.keySet()) {
      if (!seen.contains(key)) {
        throw new IllegalArgumentException("pattern configured for unknown field: " + key);
      }
    }
    return new InputGrammar(fields);
  }

  /**
   * Returns the pattern used for {@code name} when none is configured.
   *
   * @param name field name
   * @return default regular expression
   */
  public static String defaultPattern(String name) {
    return switch (name) {
      case LAT, LON -> DECIMAL_PATTERN;
      case REDSHIFT -> EXPONENT_DECIMAL_PATTERN;
      default -> TEXT_PATTERN;
    };
  }

  public List<Field> fields() {
    return fields;
  }

  /**
   * Returns the configured field names in order.
   *
   * @return field names
   */
  public List<String> fieldNames() {
    List<String> names = new ArrayList<>(fields.size());
    for (Field field : fields) {
      names.add(field.name());
    }
    return Collections.unmodifiableList(names);
  }

  /**
   * Returns the configured fields that are not semantic fields, in order.
   *
   * @return extra field names
   */
  public List<String> extraFieldNames() {
    List<String> names = new ArrayList<>();
    for (Field field : fields) {
      if (!SEMANTIC_FIELDS.contains(field.name())) {
        names.add(field.name());
      }
    }
    return Collections.unmodifiableList(names);
  }

  Pattern compiled() {
    return compiled;
  }

  Map<String, String> extract(Matcher matcher) {
    Map<String, String> values = new LinkedHashMap<>();
    for (int i = 0; i < fields.size(); i++) {
      String value = matcher.group(groupIndexes[i]);
      if (value == null) {
        value = matcher.group(unquotedGroup(i));
      }
      if (value != null && !value.isEmpty()) {
        values.put(fields.get(i).name(), value);
      }
    }
    return values;
  }

  private int unquotedGroup(int field) {
    return groupIndexes[field] + 1 + Pattern.compile(fields.get(field).pattern()).matcher("").groupCount();
  }

  @Override
  public String toString() {
    return "InputGrammar" + fieldNames();
  }

  /**
   * One named field and the pattern its raw text must match.
   *
   * @param name identifier-style field name
   * @param pattern regular expression that also accepts the empty string
   */
  public record Field(String name, String pattern) {
    public Field {
      Strings.requireIdentifier("field", name);
      Objects.requireNonNull(pattern, "pattern");
      Pattern compiledPattern;
      try {
        compiledPattern = Pattern.compile(pattern);
      } catch (PatternSyntaxException ex) {
        throw new IllegalArgumentException("invalid pattern for field " + name + ": " + ex.getDescription(), ex);
      }
      if (!compiledPattern.matcher("").matches()) {
        throw new IllegalArgumentException("pattern for field " + name + " must accept the empty string");
      }
    }
  }
}
