package net.maasbridge.resource.handler;

import java.util.Locale;

/**
 * Renderings a caller can ask for with the {@code format} query parameter.
 */
public enum ResponseFormat {
    JSON("application/json"),
    XML("application/xml");

    private final String mimeType;

    ResponseFormat(String mimeType) {
        this.mimeType = mimeType;
    }

    public String mimeType() {
        return mimeType;
    }

    /** Unknown or absent values mean JSON. */
    public static ResponseFormat fromParameter(String value) {
        if (value != null && value.trim().toLowerCase(Locale.ROOT).equals("xml")) {
            return XML;
        }
        return JSON;
    }
}
