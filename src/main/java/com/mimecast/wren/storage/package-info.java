/**
 * Output storage: the filesystem store, the per message layout and the metadata document.
 */
package com.mimecast.wren.storage;
