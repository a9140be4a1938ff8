/*
 * Copyright © 2017-2023 Andrey D. Shindarev. All rights reserved.
 * This program is made available under the terms of the BSD 3-Clause License.
 * Contacts: ashindarev@gmail.com
 */
package com.github.sftwnd.crayfish.alarms.registry;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;

import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Optional;

/**
 * Alarm text limited to {@link #MAX_BYTES} bytes in UTF-8. Longer text is cut silently on a code point boundary.
 */
public final class AlarmMessage {

    public static final int MAX_BYTES = 63;

    private final String text;

    private AlarmMessage(@NonNull String text) {
        this.text = text;
    }

    /**
     * Construct bounded message from the text
     * @param text source text (null is treated as empty)
     * @return message with at most {@link #MAX_BYTES} bytes
     */
    public static @NonNull AlarmMessage of(@Nullable String text) {
        return new AlarmMessage(truncate(Optional.ofNullable(text).orElse("")));
    }

    public @NonNull String getText() {
        return text;
    }

    private static String truncate(String text) {
        if (text.getBytes(StandardCharsets.UTF_8).length <= MAX_BYTES) {
            return text;
        }
        int bytes = 0;
        int end = 0;
        while (end < text.length()) {
            int codePoint = text.codePointAt(end);
            int size = utf8Length(codePoint);
            if (bytes + size > MAX_BYTES) {
                break;
            }
            bytes += size;
            end += Character.charCount(codePoint);
        }
        return text.substring(0, end);
    }

    private static int utf8Length(int codePoint) {
        return codePoint < 0x80 ? 1
             : codePoint < 0x800 ? 2 // NOSONAR java:S3358 Ternary operators should not be nested
             : codePoint < 0x10000 ? 3 // NOSONAR java:S3358 Ternary operators should not be nested
             : 4;
    }

    @Override
    public boolean equals(Object obj) {
        return this == obj || (obj instanceof AlarmMessage && Objects.equals(text, ((AlarmMessage) obj).text));
    }

    @Override
    public int hashCode() {
        return text.hashCode();
    }

    @Override
    public String toString() {
        return text;
    }

}
