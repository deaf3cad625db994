/* ____  ______________  ________________________  __________
 * \   \/   /      \   \/   /   __/   /      \   \/   /      \
 *  \______/___/\___\______/___/_____/___/\___\______/___/\___\
 *
 * The MIT License (MIT)
 *
 * Copyright 2023 Vavr, https://vavr.io
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */
package ch.randelshofer.vavr.safe;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import com.fasterxml.jackson.databind.type.TypeFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Shared Jackson mappers.
 * <p>
 * {@link #MAPPER} reads JSON objects into {@link LinkedHashMap}s, so the
 * field order of the document survives decoding. {@link #CANONICAL} sorts
 * bean properties, map keys and the elements of sets, and is used where equal
 * values must render to equal text.
 */
final class JsonSupport {
    static final ObjectMapper MAPPER = JsonMapper.builder().build();

    static final ObjectMapper CANONICAL = JsonMapper.builder()
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .addModule(new SimpleModule("canonical-sets").addSerializer(new SortedSetSerializer()))
            .build();

    private JsonSupport() {
    }

    static JavaType typeOf(Class<?> type) {
        Objects.requireNonNull(type, "type is null");
        return MAPPER.constructType(type);
    }

    static JavaType typeOf(TypeReference<?> type) {
        Objects.requireNonNull(type, "type is null");
        return MAPPER.constructType(type);
    }

    static String write(Object value) throws JsonProcessingException {
        return MAPPER.writeValueAsString(value);
    }

    /**
     * Reads a JSON object. JSON {@code null} yields an empty map.
     */
    static <V> LinkedHashMap<String, V> readObject(String json, JavaType valueType) throws JsonProcessingException {
        Objects.requireNonNull(json, "json is null");
        TypeFactory types = MAPPER.getTypeFactory();
        JavaType mapType = types.constructMapType(LinkedHashMap.class, types.constructType(String.class), valueType);
        LinkedHashMap<String, V> result = MAPPER.readValue(json, mapType);
        return result == null ? new LinkedHashMap<>() : result;
    }

    /**
     * Reads a JSON array. JSON {@code null} yields an empty list.
     */
    static <T> List<T> readArray(String json, JavaType elementType) throws JsonProcessingException {
        Objects.requireNonNull(json, "json is null");
        JavaType listType = MAPPER.getTypeFactory().constructCollectionType(ArrayList.class, elementType);
        List<T> result = MAPPER.readValue(json, listType);
        return result == null ? new ArrayList<>() : result;
    }

    /**
     * Writes a {@link Set} as a JSON array whose elements are sorted by their
     * canonical JSON text, so the iteration order of the set does not matter.
     */
    @SuppressWarnings("rawtypes")
    static final class SortedSetSerializer extends StdSerializer<Set> {
        SortedSetSerializer() {
            super(Set.class);
        }

        @Override
        public void serialize(Set value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            List<String> elements = new ArrayList<>(value.size());
            for (Object element : value) {
                elements.add(CANONICAL.writeValueAsString(element));
            }
            Collections.sort(elements);
            gen.writeStartArray(value, elements.size());
            for (String element : elements) {
                gen.writeRawValue(element);
            }
            gen.writeEndArray();
        }
    }
}
