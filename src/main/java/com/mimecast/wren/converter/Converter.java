package com.mimecast.wren.converter;

import com.mimecast.wren.exception.ConversionException;
import com.mimecast.wren.extraction.Attachment;

/**
 * Attachment converter interface.
 * <p>Turns one attachment into AI ready text and side artifacts.
 */
public interface Converter {

    /**
     * Gets converter name, used in reports and metadata.
     *
     * @return Name.
     */
    String getName();

    /**
     * Checks if this converter handles the attachment.
     *
     * @param attachment Attachment instance.
     * @return Boolean.
     */
    boolean supports(Attachment attachment);

    /**
     * Converts attachment.
     *
     * @param attachment Attachment instance.
     * @param context    ConversionContext instance.
     * @return ConversionResult instance.
     * @throws ConversionException Unsupported format, validation, external service or processing failure.
     */
    ConversionResult convert(Attachment attachment, ConversionContext context) throws ConversionException;
}
