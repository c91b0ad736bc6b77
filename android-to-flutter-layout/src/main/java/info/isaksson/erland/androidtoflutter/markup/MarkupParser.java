package info.isaksson.erland.androidtoflutter.markup;

import info.isaksson.erland.androidtoflutter.ir.MarkupNode;

import org.xml.sax.Attributes;
import org.xml.sax.helpers.DefaultHandler;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses one layout document into a {@link MarkupNode} tree.
 *
 * <p>Only element structure and attributes are kept, attributes in document order; text,
 * comments and processing instructions are ignored. Attributes in the Android and app
 * namespaces lose their prefix, {@code tools:} attributes keep it, attributes in other
 * namespaces keep their qualified name.</p>
 */
public final class MarkupParser {

    static final String ANDROID_NS = "http://schemas.android.com/apk/res/android";
    static final String APP_NS = "http://schemas.android.com/apk/res-auto";
    static final String TOOLS_NS = "http://schemas.android.com/tools";

    public MarkupNode parse(String xml, String documentId) throws MarkupParseException {
        TreeBuilder builder = new TreeBuilder(documentId);
        XmlDocuments.parse(xml, documentId, builder);
        if (builder.root == null) {
            throw new MarkupParseException(documentId, "document has no root element", null);
        }
        return builder.root;
    }

    /** Parses a file; the document id is the file name without its {@code .xml} extension. */
    public MarkupNode parse(Path file) throws IOException, MarkupParseException {
        String xml = Files.readString(file, StandardCharsets.UTF_8);
        return parse(xml, documentIdOf(file));
    }

    public static String documentIdOf(Path file) {
        String name = file.getFileName().toString();
        return name.endsWith(".xml") ? name.substring(0, name.length() - 4) : name;
    }

    static String attributeName(String uri, String localName, String qName) {
        if (qName.equals("xmlns") || qName.startsWith("xmlns:")) return null;
        if (uri == null || uri.isEmpty()) return qName;
        return switch (uri) {
            case ANDROID_NS, APP_NS -> localName;
            case TOOLS_NS -> "tools:" + localName;
            default -> qName;
        };
    }

    /** Builds nodes bottom-up; a node is created when its end tag is seen. */
    private static final class TreeBuilder extends DefaultHandler {
        private final String documentId;
        private final Deque<Pending> open = new ArrayDeque<>();
        private MarkupNode root;

        TreeBuilder(String documentId) {
            this.documentId = documentId;
        }

        @Override
        public void startElement(String uri, String localName, String qName, Attributes attributes) {
            Map<String, String> attrs = new LinkedHashMap<>();
            for (int i = 0; i < attributes.getLength(); i++) {
                String name = attributeName(attributes.getURI(i), attributes.getLocalName(i), attributes.getQName(i));
                if (name != null) attrs.putIfAbsent(name, attributes.getValue(i));
            }
            open.push(new Pending(qName, attrs));
        }

        @Override
        public void endElement(String uri, String localName, String qName) {
            Pending p = open.pop();
            MarkupNode node = new MarkupNode(p.tag, p.attributes, p.children, documentId);
            if (open.isEmpty()) {
                root = node;
            } else {
                open.peek().children.add(node);
            }
        }
    }

    private static final class Pending {
        final String tag;
        final Map<String, String> attributes;
        final List<MarkupNode> children = new ArrayList<>();

        Pending(String tag, Map<String, String> attributes) {
            this.tag = tag;
            this.attributes = attributes;
        }
    }
}
