package org.janelia.fuzzer.json;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.type.CollectionType;

import java.io.IOException;
import java.io.Reader;
import java.text.SimpleDateFormat;
import java.util.List;
import java.util.TimeZone;

/**
 * Utilities for working with JSON data.
 *
 * @author Eric Trautman
 */
public class JsonUtils {

    private static final String ISO_8601_FORMAT_STRING = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'";

    /** Indented output, used for logged parameter dumps. */
    public static final ObjectMapper MAPPER = fieldMapperBuilder().
            enable(SerializationFeature.INDENT_OUTPUT).
            build();

    /**
     * Mapper for hand written input files where property names are typically
     * capitalized (e.g. "FileName", "RegionOfInterest").
     */
    public static final ObjectMapper CASE_INSENSITIVE_MAPPER = fieldMapperBuilder().
            enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_PROPERTIES).
            build();

    private static JsonMapper.Builder fieldMapperBuilder() {
        final SimpleDateFormat dateFormat = new SimpleDateFormat(ISO_8601_FORMAT_STRING);
        dateFormat.setTimeZone(TimeZone.getTimeZone("GMT"));
        return JsonMapper.builder().
                serializationInclusion(JsonInclude.Include.NON_NULL).
                visibility(PropertyAccessor.FIELD, JsonAutoDetect.Visibility.ANY).
                visibility(PropertyAccessor.GETTER, JsonAutoDetect.Visibility.NONE).
                visibility(PropertyAccessor.IS_GETTER, JsonAutoDetect.Visibility.NONE).
                visibility(PropertyAccessor.SETTER, JsonAutoDetect.Visibility.NONE).
                disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES,
                        DeserializationFeature.FAIL_ON_MISSING_CREATOR_PROPERTIES).
                defaultDateFormat(dateFormat);
    }

    public static class Helper<T> {

        private final ObjectMapper mapper;
        private final CollectionType collectionType;

        public Helper(final ObjectMapper mapper,
                      final Class<T> valueType) {
            this.mapper = mapper;
            this.collectionType = this.mapper.getTypeFactory().constructCollectionType(List.class, valueType);
        }

        public List<T> fromJsonArray(final Reader json)
                throws IllegalArgumentException {
            try {
                return mapper.readValue(json, collectionType);
            } catch (final IOException e) {
                throw new IllegalArgumentException(e);
            }
        }

    }

}
