package org.ptycho.diffraction.json;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.file.Path;

import org.ptycho.diffraction.util.FileUtil;

/**
 * JSON mapping for settings snapshots, statistics and bad pixel documents.
 *
 * Value classes are mapped through their fields so that they can stay immutable.
 * Unknown properties are ignored so that older settings files keep loading.
 *
 * @author Diffraction Assembly Developers
 */
public class JsonUtils {

    public static final ObjectMapper COMPACT_MAPPER = new ObjectMapper().
            setSerializationInclusion(JsonInclude.Include.NON_NULL).
            setVisibility(PropertyAccessor.FIELD, JsonAutoDetect.Visibility.ANY).
            setVisibility(PropertyAccessor.GETTER, JsonAutoDetect.Visibility.NONE).
            setVisibility(PropertyAccessor.IS_GETTER, JsonAutoDetect.Visibility.NONE).
            setVisibility(PropertyAccessor.SETTER, JsonAutoDetect.Visibility.NONE).
            configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false).
            configure(DeserializationFeature.FAIL_ON_MISSING_CREATOR_PROPERTIES, false);

    public static final ObjectMapper MAPPER = COMPACT_MAPPER.copy().
            enable(SerializationFeature.INDENT_OUTPUT);

    /**
     * Typed conversions for one value class.
     */
    public static class Helper<T> {

        private final ObjectMapper mapper;
        private final Class<T> valueType;

        public Helper(final Class<T> valueType) {
            this(MAPPER, valueType);
        }

        public Helper(final ObjectMapper mapper,
                      final Class<T> valueType) {
            this.mapper = mapper;
            this.valueType = valueType;
        }

        public String toJson(final T value)
                throws IllegalArgumentException {
            try {
                return mapper.writeValueAsString(value);
            } catch (final IOException e) {
                throw new IllegalArgumentException("failed to serialize " + valueType.getSimpleName(), e);
            }
        }

        public T fromJson(final String json)
                throws IllegalArgumentException {
            try {
                return mapper.readValue(json, valueType);
            } catch (final IOException e) {
                throw new IllegalArgumentException("failed to parse " + valueType.getSimpleName(), e);
            }
        }

        public T fromJson(final Reader json)
                throws IllegalArgumentException {
            try {
                return mapper.readValue(json, valueType);
            } catch (final IOException e) {
                throw new IllegalArgumentException("failed to parse " + valueType.getSimpleName(), e);
            }
        }

        /**
         * Reads a value from the specified file (gunzipped when the name ends with .gz).
         *
         * @throws IOException
         *   if the file cannot be opened or does not hold a valid value.
         */
        public T readFile(final Path path)
                throws IOException {
            try (final Reader reader = FileUtil.DEFAULT_INSTANCE.getExtensionBasedReader(path.toString())) {
                return mapper.readValue(reader, valueType);
            }
        }

        /**
         * Writes the value to the specified file (gzipped when the name ends with .gz).
         */
        public void writeFile(final T value,
                              final Path path)
                throws IOException {
            try (final Writer writer = FileUtil.DEFAULT_INSTANCE.getExtensionBasedWriter(path.toString())) {
                mapper.writeValue(writer, value);
            }
        }

    }

}
