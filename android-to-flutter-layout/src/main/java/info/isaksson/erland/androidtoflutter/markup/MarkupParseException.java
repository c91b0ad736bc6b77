package info.isaksson.erland.androidtoflutter.markup;

/** A layout or values document that is not well-formed XML. */
public class MarkupParseException extends Exception {

    private final String documentId;

    public MarkupParseException(String documentId, String message, Throwable cause) {
        super(documentId + ": " + message, cause);
        this.documentId = documentId;
    }

    public String getDocumentId() {
        return documentId;
    }
}
