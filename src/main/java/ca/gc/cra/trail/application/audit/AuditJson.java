package ca.gc.cra.trail.application.audit;

import ca.gc.cra.trail.domain.audit.AuditRecord;
import ca.gc.cra.trail.domain.redaction.Detector;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import java.io.IOException;
import java.util.Map;
import java.util.Objects;

/**
 * Canonical JSON form of audit records.
 *
 * <p>Canonical means compact output with object keys sorted at every level and snake_case property names. The
 * same form is used for the stored file, the delivered message, and the hash input, so a record read back from
 * disk hashes to the value it was signed with.</p>
 *
 * @since 0.1.0
 */
public final class AuditJson {
  private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};
  private static final ObjectMapper MAPPER = JsonMapper.builder()
      .propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
      .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
      .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
      .addModule(new SimpleModule("trail-detector").addSerializer(Detector.class, new DetectorSerializer()))
      .build();

  private AuditJson() {}

  /**
   * Serializes a record in canonical form.
   *
   * @param record record to serialize
   * @return compact JSON text
   */
  public static String write(AuditRecord record) {
    return canonical(Objects.requireNonNull(record, "record"));
  }

  /**
   * Converts a record into a generic map, as it would read back from its JSON form.
   *
   * @param record record to convert
   * @return mutable map view
   */
  public static Map<String, Object> toMap(AuditRecord record) {
    return MAPPER.convertValue(Objects.requireNonNull(record, "record"), MAP_TYPE);
  }

  /**
   * Parses serialized record JSON into a generic map.
   *
   * @param json record JSON
   * @return mutable map view
   * @throws IllegalArgumentException when the text is not a JSON object
   */
  public static Map<String, Object> parse(String json) {
    Objects.requireNonNull(json, "json");
    try {
      Map<String, Object> map = MAPPER.readValue(json, MAP_TYPE);
      if (map == null) {
        throw new IllegalArgumentException("Audit record JSON is empty");
      }
      return map;
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("Invalid audit record JSON: " + ex.getOriginalMessage(), ex);
    }
  }

  /**
   * Serializes any value in canonical form.
   *
   * @param value value to serialize (records, maps, lists, scalars)
   * @return compact JSON text with sorted keys
   */
  public static String canonical(Object value) {
    try {
      return MAPPER.writeValueAsString(value);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Unable to serialize audit data", ex);
    }
  }

  private static final class DetectorSerializer extends StdSerializer<Detector> {
    private DetectorSerializer() {
      super(Detector.class);
    }

    @Override
    public void serialize(Detector value, JsonGenerator gen, SerializerProvider provider) throws IOException {
      gen.writeString(value.wireName());
    }
  }
}
