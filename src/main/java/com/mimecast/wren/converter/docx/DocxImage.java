package com.mimecast.wren.converter.docx;

/**
 * Deduplicated embedded image.
 */
public class DocxImage {

    private final String fileName;
    private final String originalName;
    private final String contentType;
    private final String sha256;
    private final byte[] data;
    private int occurrences = 1;

    /**
     * Constructs a new DocxImage instance.
     *
     * @param fileName     Output file name.
     * @param originalName Package part name.
     * @param contentType  Content type.
     * @param sha256       Content hash.
     * @param data         Image bytes.
     */
    public DocxImage(String fileName, String originalName, String contentType, String sha256, byte[] data) {
        this.fileName = fileName;
        this.originalName = originalName;
        this.contentType = contentType;
        this.sha256 = sha256;
        this.data = data;
    }

    public String getFileName() {
        return fileName;
    }

    public String getOriginalName() {
        return originalName;
    }

    public String getContentType() {
        return contentType;
    }

    public String getSha256() {
        return sha256;
    }

    public byte[] getData() {
        return data;
    }

    public int getOccurrences() {
        return occurrences;
    }

    void addOccurrence() {
        occurrences++;
    }
}
