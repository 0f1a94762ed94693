/**
 * Attachment security checks.
 *
 * <p>The {@link com.mimecast.wren.security.AttachmentValidator} always returns an explicit
 * {@link com.mimecast.wren.security.ValidationOutcome}; callers that need an exception use
 * {@link com.mimecast.wren.security.ValidationOutcome#throwIfDenied()}.
 */
package com.mimecast.wren.security;
