/*
 * Copyright 2026 Mark Andrew Ray-Smith
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package dev.mars.fspec.lock;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.core.util.Separators;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Jackson mapping between managed file content and caller types.
 * <p>
 * Output is indented by two spaces with {@code "key": value} entries, one
 * element per line for both objects and arrays.
 */
final class JsonCodec {

    private static final DefaultIndenter INDENTER = new DefaultIndenter("  ", "\n");

    private final ObjectMapper mapper;
    private final ObjectWriter writer;

    JsonCodec() {
        this(new ObjectMapper());
    }

    JsonCodec(ObjectMapper mapper) {
        this.mapper = mapper;
        DefaultPrettyPrinter printer = new DefaultPrettyPrinter()
                .withSeparators(Separators.createDefaultInstance()
                        .withObjectFieldValueSpacing(Separators.Spacing.AFTER));
        printer.indentObjectsWith(INDENTER);
        printer.indentArraysWith(INDENTER);
        this.writer = mapper.writer(printer);
    }

    JavaType type(Class<?> type) {
        return mapper.constructType(type);
    }

    JavaType type(TypeReference<?> type) {
        return mapper.getTypeFactory().constructType(type);
    }

    /**
     * @throws FileParseException if {@code content} is not JSON of the requested type
     */
    <T> T read(Path path, byte[] content, JavaType type) {
        try {
            return mapper.readValue(content, type);
        } catch (IOException e) {
            throw new FileParseException(path, e);
        }
    }

    /**
     * Value of {@code type} built from an empty JSON object, used when a
     * transaction starts on a file that does not exist yet.
     */
    <T> T empty(Path path, JavaType type) {
        try {
            return mapper.readValue("{}", type);
        } catch (JsonProcessingException e) {
            throw new LockedFileException("Cannot start " + path + " from an empty object as " + type, e);
        }
    }

    byte[] write(Path path, Object value) {
        try {
            return writer.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new LockedFileException("Failed to serialize content for " + path, e);
        }
    }
}
