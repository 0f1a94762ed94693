/**
 * Map backed configuration.
 *
 * <p>Configuration is read from a JSON5 file into nested maps.
 * <br>Typed section classes extend {@link com.mimecast.wren.config.ConfigFoundation} and expose defaults.
 *
 * <p>Validation happens once at startup through {@link com.mimecast.wren.config.WrenConfig#validate()}.
 */
package com.mimecast.wren.config;
