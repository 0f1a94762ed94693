/**
 * Attachment conversion framework.
 *
 * <p>Converters implement {@link com.mimecast.wren.converter.Converter}, usually through
 * {@link com.mimecast.wren.converter.AbstractConverter}, and are selected in priority order by the
 * {@link com.mimecast.wren.converter.ConverterRegistry}.
 * <p>Results are held in memory as {@link com.mimecast.wren.converter.OutputArtifact} entries and written by the
 * storage layer.
 */
package com.mimecast.wren.converter;
