/**
 * OCR backed PDF conversion.
 * <p>{@link com.mimecast.wren.converter.ocr.OcrService} is the single attempt service contract,
 * {@link com.mimecast.wren.converter.ocr.MistralOcrClient} its HTTP implementation.
 */
package com.mimecast.wren.converter.ocr;
