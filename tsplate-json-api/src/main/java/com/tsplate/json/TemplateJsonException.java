package com.tsplate.json;

/**
 * A JSON view of a template could not be written or read back.
 */
public class TemplateJsonException extends RuntimeException {

    /**
     * The JSON documents a provider deals with.
     */
    public enum Document {
        DESCRIPTION("statement description"),
        SOURCE_MAP("source map");

        private final String label;

        Document(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }

    private final Document document;
    private final boolean reading;

    private TemplateJsonException(Document document, boolean reading, Throwable cause) {
        super("Failed to " + (reading ? "read" : "write") + " " + document.label()
            + (cause.getMessage() != null ? ": " + cause.getMessage() : ""), cause);
        this.document = document;
        this.reading = reading;
    }

    public static TemplateJsonException writing(Document document, Throwable cause) {
        return new TemplateJsonException(document, false, cause);
    }

    public static TemplateJsonException reading(Document document, Throwable cause) {
        return new TemplateJsonException(document, true, cause);
    }

    public Document getDocument() {
        return document;
    }

    /**
     * @return true if the failure happened while parsing JSON input
     */
    public boolean isReading() {
        return reading;
    }
}
