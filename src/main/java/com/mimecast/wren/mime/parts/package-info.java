/**
 * MIME part tree.
 */
package com.mimecast.wren.mime.parts;
