/**
 * Orchestration of attachment conversion, per message processing and batch runs.
 */
package com.mimecast.wren.processor;
