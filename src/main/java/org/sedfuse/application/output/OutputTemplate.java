package org.sedfuse.application.output;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IllegalFormatException;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import org.sedfuse.domain.sed.Measurement;

/**
 * <strong>What:</strong> Compiled output line template with {@code {field}} and {@code {field:%fmt}}
 * placeholders.
 * <p><strong>Why:</strong> Templates come from configuration; compiling them up front rejects unknown fields and
 * malformed format specifiers before any source is processed.</p>
 * <p><strong>Role:</strong> Immutable rendering strategy used by {@link ResultAggregator}.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * <p>Known fields are the {@link MeasurementField} keys plus the configured extra input fields. Extras that a line
 * did not supply render as {@value #MISSING}. Numbers are formatted with {@link Locale#ROOT}.</p>
 *
 * @since 0.1.0
 */
public final class OutputTemplate {
  /** Result file layout; numeric columns carry nine decimals so they re-parse to the rendered values. */
  public static final String DEFAULT_TEMPLATE =
      "{index}  {name} {z:%.9f} {num}   {freq:%.9e} {flux:%.9e} {source}  {flag} {lat:%.9f} {lon:%.9f}"
          + " {offset:%.9f}  {extinction:%.9e}  {rm} {rm_err} {input_offset:%.9f}";

  /** Rendering of an extra field absent from the input line. */
  public static final String MISSING = "-";

  private static final Pattern FIELD_NAME = Pattern.compile("[A-Za-z][A-Za-z0-9_]*");

  private final String source;
  private final List<Segment> segments;
  private final Set<String> extraFields;

  private OutputTemplate(String source, List<Segment> segments, Set<String> extraFields) {
    this.source = source;
    this.segments = List.copyOf(segments);
    this.extraFields = extraFields;
  }

  /**
   * Compiles a template.
   *
   * @param template template text
   * @param extraFields names of the configured extra input fields
   * @return compiled template
   * @throws IllegalArgumentException on unbalanced braces, unknown fields, or invalid format specifiers
   */
  public static OutputTemplate compile(String template, List<String> extraFields) {
    Objects.requireNonNull(template, "template");
    Set<String> extras = Collections.unmodifiableSet(new LinkedHashSet<>(
        Objects.requireNonNullElse(extraFields, List.of())));
    List<Segment> segments = new ArrayList<>();
    StringBuilder literal = new StringBuilder();
    int i = 0;
    while (i < template.length()) {
      char c = template.charAt(i);
      if (c == '}') {
        throw new IllegalArgumentException("unbalanced '}' at index " + i + " in template");
      }
      if (c != '{') {
        literal.append(c);
        i++;
        continue;
      }
      int close = template.indexOf('}', i + 1);
      if (close < 0) {
        throw new IllegalArgumentException("unterminated placeholder at index " + i + " in template");
      }
      if (literal.length() > 0) {
        segments.add(new Literal(literal.toString()));
        literal.setLength(0);
      }
      segments.add(placeholder(template.substring(i + 1, close), extras));
      i = close + 1;
    }
    if (literal.length() > 0) {
      segments.add(new Literal(literal.toString()));
    }
    return new OutputTemplate(template, segments, extras);
  }

  private static Placeholder placeholder(String body, Set<String> extras) {
    int colon = body.indexOf(':');
    String name = (colon < 0 ? body : body.substring(0, colon)).trim();
    Optional<String> format = colon < 0 ? Optional.empty() : Optional.of(body.substring(colon + 1));
    if (name.indexOf('{') >= 0 || !FIELD_NAME.matcher(name).matches()) {
      throw new IllegalArgumentException("malformed placeholder {" + body + "}");
    }
    Optional<MeasurementField> field = MeasurementField.byKey(name);
    if (field.isEmpty() && !extras.contains(name)) {
      throw new IllegalArgumentException("unknown template field: " + name);
    }
    if (format.isPresent()) {
      if (format.get().isEmpty() || format.get().indexOf('{') >= 0) {
        throw new IllegalArgumentException("malformed format in placeholder {" + body + "}");
      }
      Object sample = field.map(MeasurementField::sample).orElse(MISSING);
      try {
        String.format(Locale.ROOT, format.get(), sample);
      } catch (IllegalFormatException ex) {
        throw new IllegalArgumentException("invalid format '" + format.get() + "' for field " + name, ex);
      }
    }
    return new Placeholder(name, field, format);
  }

  /**
   * Renders one measurement.
   *
   * @param measurement measurement to render
   * @return rendered line without a line terminator
   */
  public String render(Measurement measurement) {
    StringBuilder out = new StringBuilder();
    for (Segment segment : segments) {
      if (segment instanceof Literal literal) {
        out.append(literal.text());
      } else if (segment instanceof Placeholder placeholder) {
        Object value = placeholder.field().isPresent()
            ? placeholder.field().get().valueOf(measurement)
            : measurement.extras().getOrDefault(placeholder.name(), MISSING);
        out.append(placeholder.format().isPresent()
            ? String.format(Locale.ROOT, placeholder.format().get(), value)
            : String.valueOf(value));
      }
    }
    return out.toString();
  }

  /**
   * Returns the placeholder names in template order.
   *
   * @return field names, duplicates preserved
   */
  public List<String> fieldNames() {
    List<String> names = new ArrayList<>();
    for (Segment segment : segments) {
      if (segment instanceof Placeholder placeholder) {
        names.add(placeholder.name());
      }
    }
    return Collections.unmodifiableList(names);
  }

  public Set<String> extraFields() {
    return extraFields;
  }

  public String source() {
    return source;
  }

  private sealed interface Segment permits Literal, Placeholder {}

  private record Literal(String text) implements Segment {}

  private record Placeholder(String name, Optional<MeasurementField> field, Optional<String> format)
      implements Segment {}
}
