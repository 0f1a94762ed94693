package com.mimecast.wren.mime.headers;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ordered MIME headers container.
 *
 * <p>Lookups are case insensitive and return the first occurrence.
 */
public class MimeHeaders {

    /**
     * Headers in original order.
     */
    private final List<MimeHeader> headers = new ArrayList<>();

    /**
     * Adds header.
     *
     * @param header MimeHeader instance.
     * @return Self.
     */
    public MimeHeaders put(MimeHeader header) {
        headers.add(header);
        return this;
    }

    /**
     * Gets first header by name.
     *
     * @param name Header name.
     * @return Optional of MimeHeader.
     */
    public Optional<MimeHeader> get(String name) {
        for (MimeHeader header : headers) {
            if (header.getName().equalsIgnoreCase(name)) {
                return Optional.of(header);
            }
        }
        return Optional.empty();
    }

    /**
     * Gets all headers by name.
     *
     * @param name Header name.
     * @return List of MimeHeader.
     */
    public List<MimeHeader> getAll(String name) {
        List<MimeHeader> list = new ArrayList<>();
        for (MimeHeader header : headers) {
            if (header.getName().equalsIgnoreCase(name)) {
                list.add(header);
            }
        }
        return list;
    }

    /**
     * Gets decoded value of first header by name.
     *
     * @param name Header name.
     * @return Decoded value or null.
     */
    public String getDecoded(String name) {
        return get(name).map(MimeHeader::getDecodedValue).orElse(null);
    }

    /**
     * Gets all headers.
     *
     * @return Unmodifiable list of MimeHeader.
     */
    public List<MimeHeader> get() {
        return Collections.unmodifiableList(headers);
    }

    /**
     * Gets headers as a map of name to decoded values.
     *
     * @return Map of String to List of String.
     */
    public Map<String, List<String>> toMap() {
        Map<String, List<String>> map = new LinkedHashMap<>();
        for (MimeHeader header : headers) {
            map.computeIfAbsent(header.getName(), k -> new ArrayList<>()).add(header.getDecodedValue());
        }
        return map;
    }

    public int size() {
        return headers.size();
    }
}
