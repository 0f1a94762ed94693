/**
 * MIME header parsing and lookup.
 */
package com.mimecast.wren.mime.headers;
