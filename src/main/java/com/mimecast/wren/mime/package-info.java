/**
 * MIME message parsing.
 *
 * <p>The {@link com.mimecast.wren.mime.EmailParser} turns raw message bytes into a tree of
 * {@link com.mimecast.wren.mime.parts.MimePart} nodes with dotted ids.
 * <br>Features include:
 * <ul>
 *     <li>Multi-line header folding</li>
 *     <li>Multipart messages (mixed, related, alternative) with literal boundary matching</li>
 *     <li>Embedded rfc822 messages as subtrees</li>
 *     <li>Content encodings (Base64, Quoted-Printable)</li>
 *     <li>Charset detection for undeclared or invalid charsets</li>
 * </ul>
 *
 * <p>Only an empty input or a missing header block is fatal.
 * <br>Every other structural problem degrades and is reported as a warning.
 *
 * @see com.mimecast.wren.mime.EmailParser
 * @see com.mimecast.wren.mime.headers.MimeHeaders
 * @see com.mimecast.wren.mime.parts.MimePart
 */
package com.mimecast.wren.mime;
