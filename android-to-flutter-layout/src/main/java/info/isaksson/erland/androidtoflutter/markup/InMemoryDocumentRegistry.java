package info.isaksson.erland.androidtoflutter.markup;

import info.isaksson.erland.androidtoflutter.ir.MarkupNode;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Holds every loaded layout document by id. Immutable after construction, so a single
 * instance can be shared by concurrently translated screens.
 */
public final class InMemoryDocumentRegistry implements DocumentRegistry {

    private final Map<String, MarkupNode> documents;

    public InMemoryDocumentRegistry(Map<String, MarkupNode> documents) {
        this.documents = documents == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new TreeMap<>(documents));
    }

    @Override
    public Optional<MarkupNode> lookup(String documentId) {
        if (documentId == null) return Optional.empty();
        return Optional.ofNullable(documents.get(documentId));
    }

    @Override
    public Set<String> documentIds() {
        return documents.keySet();
    }

    public int size() {
        return documents.size();
    }
}
