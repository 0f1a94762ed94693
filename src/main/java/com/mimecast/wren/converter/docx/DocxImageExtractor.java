package com.mimecast.wren.converter.docx;

import org.apache.commons.codec.digest.DigestUtils;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFPictureData;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Extracts embedded images, deduplicated by SHA-256.
 */
public class DocxImageExtractor {

    /**
     * Extracts images.
     *
     * @param document XWPFDocument instance.
     * @return Unique images in document order, named {@code image_NNN.ext}.
     */
    public List<DocxImage> extract(XWPFDocument document) {
        Map<String, DocxImage> unique = new LinkedHashMap<>();
        for (XWPFPictureData picture : document.getAllPictures()) {
            byte[] data = picture.getData();
            if (data == null || data.length == 0) {
                continue;
            }

            String sha256 = DigestUtils.sha256Hex(data);
            DocxImage existing = unique.get(sha256);
            if (existing != null) {
                existing.addOccurrence();
                continue;
            }

            String extension = picture.suggestFileExtension();
            String fileName = String.format("image_%03d.%s", unique.size() + 1,
                    extension == null || extension.isEmpty() ? "bin" : extension);
            unique.put(sha256, new DocxImage(fileName, picture.getFileName(),
                    picture.getPackagePart().getContentType(), sha256, data));
        }
        return new ArrayList<>(unique.values());
    }

    /**
     * Builds image manifest.
     *
     * @param images Unique images.
     * @return Manifest map.
     */
    public static Map<String, Object> manifest(List<DocxImage> images) {
        long totalSize = 0;
        int total = 0;
        List<Map<String, Object>> entries = new ArrayList<>();
        for (DocxImage image : images) {
            totalSize += image.getData().length;
            total += image.getOccurrences();

            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("file", "images/" + image.getFileName());
            entry.put("original_name", image.getOriginalName());
            entry.put("content_type", image.getContentType());
            entry.put("size", image.getData().length);
            entry.put("sha256", image.getSha256());
            entry.put("occurrences", image.getOccurrences());
            entries.add(entry);
        }

        Map<String, Object> manifest = new LinkedHashMap<>();
        manifest.put("total_images", total);
        manifest.put("unique_images", images.size());
        manifest.put("total_size", totalSize);
        manifest.put("images", entries);
        return manifest;
    }
}
