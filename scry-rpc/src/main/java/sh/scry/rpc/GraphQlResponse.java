// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scry.rpc;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JavaType;
import org.jspecify.annotations.Nullable;

import sh.scry.rpc.internal.JsonMappers;

/**
 * Decoded GraphQL response envelope.
 *
 * <p>Typed views over {@code data} are produced lazily with Jackson, so row
 * records only need to declare the fields they care about.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GraphQlResponse(@Nullable Map<String, Object> data, @Nullable List<GraphQlError> errors) {

    public boolean hasErrors() {
        return errors != null && !errors.isEmpty();
    }

    public List<String> errorMessages() {
        if (errors == null) {
            return List.of();
        }
        final List<String> messages = new ArrayList<>(errors.size());
        for (GraphQlError error : errors) {
            messages.add(error == null || error.message() == null ? "Unknown error" : error.message());
        }
        return messages;
    }

    /**
     * Converts {@code data.<field>} into a list of rows; a missing or null field yields an empty list.
     */
    public <T> List<T> list(final String field, final Class<T> rowType) {
        final Object raw = data == null ? null : data.get(field);
        if (raw == null) {
            return List.of();
        }
        final JavaType type = JsonMappers.MAPPER.getTypeFactory().constructCollectionType(List.class, rowType);
        return JsonMappers.MAPPER.convertValue(raw, type);
    }

    /**
     * Converts {@code data.<field>} into a single row, empty when the field is null.
     */
    public <T> Optional<T> object(final String field, final Class<T> rowType) {
        final Object raw = data == null ? null : data.get(field);
        if (raw == null) {
            return Optional.empty();
        }
        return Optional.of(JsonMappers.MAPPER.convertValue(raw, rowType));
    }
}
