package info.isaksson.erland.androidtoflutter.markup;

import info.isaksson.erland.androidtoflutter.ir.MarkupNode;

import java.util.Optional;
import java.util.Set;

/**
 * Document id → parsed layout lookup. Implementations must be side-effect free and
 * idempotent: resolution may look up the same id many times.
 */
public interface DocumentRegistry {

    DocumentRegistry EMPTY = new InMemoryDocumentRegistry(null);

    Optional<MarkupNode> lookup(String documentId);

    Set<String> documentIds();
}
