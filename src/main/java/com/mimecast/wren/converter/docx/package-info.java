/**
 * Word processor document conversion to markdown with metadata, style and image side artifacts and chunked output.
 */
package com.mimecast.wren.converter.docx;
