package com.guildhub.core.util;

import java.nio.charset.StandardCharsets;

public final class BytesUtils {
    private BytesUtils() {
    }

    /**
     * Encoded size of a text frame on the wire.
     */
    public static long utf8Length(String text) {
        if (text == null) {
            return 0L;
        }
        return text.getBytes(StandardCharsets.UTF_8).length;
    }
}
