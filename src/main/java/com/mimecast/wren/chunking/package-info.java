/**
 * Text chunking for language model consumption.
 *
 * <p>Three strategies share one tokenization pass and one chunking loop:
 * <ul>
 *     <li>{@link com.mimecast.wren.chunking.TokenChunker} fixed windows</li>
 *     <li>{@link com.mimecast.wren.chunking.SemanticChunker} boundary at or below the limit</li>
 *     <li>{@link com.mimecast.wren.chunking.HybridChunker} nearest boundary either side</li>
 * </ul>
 */
package com.mimecast.wren.chunking;
