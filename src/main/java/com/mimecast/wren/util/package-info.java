/**
 * Filename handling and decoding helpers.
 */
package com.mimecast.wren.util;
