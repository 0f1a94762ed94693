package com.mimecast.wren.extraction;

/**
 * Marker position in the body text.
 */
public class Position {

    /**
     * Marker kind.
     */
    public enum Kind {
        ATTACHMENT("attachment"),
        IMAGE("image");

        private final String label;

        Kind(String label) {
            this.label = label;
        }

        public String getLabel() {
            return label;
        }
    }

    private final Kind kind;
    private final int index;
    private final int offset;
    private final String filename;
    private final String partId;

    /**
     * Constructs a new Position instance.
     *
     * @param kind     Marker kind.
     * @param index    One based index within kind.
     * @param offset   Character offset of the marker in the body text.
     * @param filename Generated output filename.
     * @param partId   Source part id.
     */
    public Position(Kind kind, int index, int offset, String filename, String partId) {
        this.kind = kind;
        this.index = index;
        this.offset = offset;
        this.filename = filename;
        this.partId = partId;
    }

    /**
     * Gets marker id, for example {@code attachment:2}.
     *
     * @return Marker id.
     */
    public String getMarkerId() {
        return kind.getLabel() + ":" + index;
    }

    public Kind getKind() {
        return kind;
    }

    public int getIndex() {
        return index;
    }

    public int getOffset() {
        return offset;
    }

    public String getFilename() {
        return filename;
    }

    public String getPartId() {
        return partId;
    }
}
