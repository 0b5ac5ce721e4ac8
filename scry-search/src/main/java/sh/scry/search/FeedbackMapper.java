// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scry.search;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.jspecify.annotations.Nullable;

import sh.scry.core.model.Feedback;
import sh.scry.core.model.FeedbackResponse;
import sh.scry.core.types.Hex;
import sh.scry.rpc.model.FeedbackFileRow;
import sh.scry.rpc.model.FeedbackRow;
import sh.scry.rpc.model.ResponseRow;

/**
 * Maps backend feedback rows to {@link Feedback}.
 *
 * <p>Identity comes from the row id {@code chainId:tokenId:reviewer:index}. Older
 * deployments stored tags as {@code bytes32}; those are decoded to text with
 * trailing zero bytes removed, and tags that decode to nothing are omitted.
 */
final class FeedbackMapper {

    private FeedbackMapper() {
    }

    static Feedback fromRow(final FeedbackRow row) {
        final String[] parts = row.id().split(":");
        final String agentId = parts.length >= 2 ? parts[0] + ":" + parts[1] : orEmpty(row.agentId());
        final String reviewer = parts.length > 2 ? parts[2] : lower(row.clientAddress());
        final long index = parts.length > 3 ? parseIndex(parts[3]) : parseIndex(row.feedbackIndex());

        final List<String> tags = new ArrayList<>(2);
        addTag(tags, row.tag1());
        addTag(tags, row.tag2());

        final FeedbackFileRow file = row.feedbackFile();
        return new Feedback(
                Feedback.idOf(agentId, reviewer, index),
                agentId,
                reviewer,
                index,
                parseValue(row.value()),
                tags,
                row.endpoint(),
                row.feedbackUri(),
                row.createdAt(),
                Boolean.TRUE.equals(row.revoked()),
                file == null ? null : file.text(),
                file == null ? null : file.capability(),
                file == null ? null : file.skill(),
                file == null ? null : file.task(),
                responses(row.responses()));
    }

    /**
     * Decodes a stored tag; plain strings pass through, {@code 0x} values are read as UTF-8 bytes.
     *
     * @return the tag text, or null when it is empty or not decodable
     */
    static @Nullable String decodeTag(final @Nullable String raw) {
        if (raw == null || raw.isEmpty()) {
            return null;
        }
        if (!Hex.hasPrefix(raw)) {
            return raw;
        }
        final byte[] bytes;
        try {
            bytes = Hex.decode(raw);
        } catch (IllegalArgumentException e) {
            return null;
        }
        int end = bytes.length;
        while (end > 0 && bytes[end - 1] == 0) {
            end--;
        }
        if (end == 0) {
            return null;
        }
        try {
            final String text = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.IGNORE)
                    .onUnmappableCharacter(CodingErrorAction.IGNORE)
                    .decode(ByteBuffer.wrap(bytes, 0, end))
                    .toString();
            return text.isEmpty() ? null : text;
        } catch (CharacterCodingException e) {
            return null;
        }
    }

    static @Nullable Double parseValue(final @Nullable String value) {
        if (value == null) {
            return null;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static void addTag(final List<String> tags, final @Nullable String raw) {
        final String tag = decodeTag(raw);
        if (tag != null) {
            tags.add(tag);
        }
    }

    private static List<FeedbackResponse> responses(final @Nullable List<ResponseRow> rows) {
        if (rows == null) {
            return List.of();
        }
        final List<FeedbackResponse> out = new ArrayList<>(rows.size());
        for (ResponseRow row : rows) {
            out.add(new FeedbackResponse(row.responder(), row.responseUri(), row.createdAt()));
        }
        return out;
    }

    private static long parseIndex(final @Nullable String value) {
        if (value == null) {
            return 1L;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            return 1L;
        }
    }

    private static String lower(final @Nullable String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT);
    }

    private static String orEmpty(final @Nullable String value) {
        return value == null ? "" : value;
    }
}
