/**
 * Excel workbook to CSV conversion using Apache POI.
 */
package com.mimecast.wren.converter.spreadsheet;
