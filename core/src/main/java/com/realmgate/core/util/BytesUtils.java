package com.realmgate.core.util;

import com.google.common.base.Utf8;

public final class BytesUtils {
    private BytesUtils() {
    }

    /**
     * @return UTF-8 encoded size of a text frame, 0 for null
     */
    public static long utf8Length(String text) {
        return text == null ? 0 : Utf8.encodedLength(text);
    }
}
