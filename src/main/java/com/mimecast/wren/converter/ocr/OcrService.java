package com.mimecast.wren.converter.ocr;

import com.mimecast.wren.resilience.ServiceCallException;

import java.io.File;
import java.io.IOException;

/**
 * OCR service interface.
 * <p>One invocation is one attempt; retries and circuit breaking are applied by the caller.
 */
public interface OcrService {

    /**
     * Gets endpoint name, used to select the circuit breaker.
     *
     * @return Endpoint name.
     */
    String getEndpoint();

    /**
     * Runs OCR on a document.
     *
     * @param filename Document name reported to the service.
     * @param document Document file.
     * @param request  OcrRequest instance.
     * @return OcrDocument instance.
     * @throws ServiceCallException Classified service failure.
     * @throws IOException          Network failure.
     */
    OcrDocument process(String filename, File document, OcrRequest request) throws ServiceCallException, IOException;
}
