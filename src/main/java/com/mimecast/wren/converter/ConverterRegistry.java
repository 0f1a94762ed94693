package com.mimecast.wren.converter;

import com.mimecast.wren.extraction.Attachment;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Ordered converter registry.
 * <p>The first registered converter supporting an attachment wins.
 */
public class ConverterRegistry {

    private final List<Converter> converters = new ArrayList<>();

    /**
     * Registers converter at lowest priority.
     *
     * @param converter Converter instance.
     * @return Self.
     */
    public ConverterRegistry register(Converter converter) {
        converters.add(converter);
        return this;
    }

    /**
     * Finds converter for attachment.
     *
     * @param attachment Attachment instance.
     * @return Optional of Converter.
     */
    public Optional<Converter> find(Attachment attachment) {
        for (Converter converter : converters) {
            if (converter.supports(attachment)) {
                return Optional.of(converter);
            }
        }
        return Optional.empty();
    }

    public List<Converter> getConverters() {
        return Collections.unmodifiableList(converters);
    }
}
