package info.isaksson.erland.androidtoflutter.resources;

import info.isaksson.erland.androidtoflutter.markup.MarkupParseException;
import info.isaksson.erland.androidtoflutter.markup.XmlDocuments;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Reads {@code res/values/*.xml} into a {@link ResourceTable}. Qualified value directories
 * ({@code values-night}, {@code values-de}) are ignored.
 */
public final class ResourceTableLoader {

    private static final Logger log = LoggerFactory.getLogger(ResourceTableLoader.class);

    private final List<String> parseErrors = new ArrayList<>();

    public ResourceTable load(Path resDir) throws IOException {
        Map<String, String> colors = new LinkedHashMap<>();
        Map<String, String> strings = new LinkedHashMap<>();
        Map<String, String> dimens = new LinkedHashMap<>();
        Path values = resDir == null ? null : resDir.resolve("values");
        if (values == null || !Files.isDirectory(values)) {
            return ResourceTable.EMPTY;
        }

        List<Path> files;
        try (Stream<Path> s = Files.list(values)) {
            files = s.filter(p -> p.getFileName().toString().endsWith(".xml"))
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .collect(Collectors.toList());
        }
        for (Path f : files) {
            String rel = resDir.relativize(f).toString().replace('\\', '/');
            try {
                Document doc = XmlDocuments.parse(Files.readString(f, StandardCharsets.UTF_8), rel);
                collect(doc, colors, strings, dimens);
            } catch (MarkupParseException e) {
                parseErrors.add(rel + ": parse error (" + e.getMessage() + ")");
                log.warn("Skipping unparsable values file {}: {}", rel, e.getMessage());
            }
        }
        log.debug("Loaded {} colors, {} strings, {} dimens", colors.size(), strings.size(), dimens.size());
        return new ResourceTable(colors, strings, dimens);
    }

    public List<String> getParseErrors() {
        return List.copyOf(parseErrors);
    }

    static void collect(Document doc, Map<String, String> colors, Map<String, String> strings, Map<String, String> dimens) {
        Element root = doc.getDocumentElement();
        if (root == null || !root.getTagName().equals("resources")) return;
        NodeList nodes = root.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node n = nodes.item(i);
            if (n.getNodeType() != Node.ELEMENT_NODE) continue;
            Element e = (Element) n;
            String name = e.getAttribute("name");
            if (name.isEmpty()) continue;
            String value = e.getTextContent() == null ? "" : e.getTextContent().trim();
            switch (e.getTagName()) {
                case "color" -> colors.putIfAbsent(name, value);
                case "string" -> strings.putIfAbsent(name, stripQuotes(value));
                case "dimen" -> dimens.putIfAbsent(name, value);
                case "item" -> {
                    String type = e.getAttribute("type");
                    if (type.equals("color")) colors.putIfAbsent(name, value);
                    else if (type.equals("dimen")) dimens.putIfAbsent(name, value);
                    else if (type.equals("string")) strings.putIfAbsent(name, stripQuotes(value));
                }
                default -> {
                    // styles, arrays and plurals are not used by the mapper
                }
            }
        }
    }

    private static String stripQuotes(String v) {
        if (v.length() >= 2 && v.startsWith("\"") && v.endsWith("\"")) {
            return v.substring(1, v.length() - 1);
        }
        return v;
    }
}
