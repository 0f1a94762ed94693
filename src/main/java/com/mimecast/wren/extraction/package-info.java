/**
 * Body text, attachment and inline image extraction.
 *
 * <p>Builds on the {@link com.mimecast.wren.mime} part tree and produces an
 * {@link com.mimecast.wren.extraction.ExtractionResult} with positional markers linking the body text to every
 * extracted attachment and image.
 */
package com.mimecast.wren.extraction;
