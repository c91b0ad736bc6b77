package info.isaksson.erland.androidtoflutter.translate;

import info.isaksson.erland.androidtoflutter.ir.code.JCall;
import info.isaksson.erland.androidtoflutter.ir.code.JCast;
import info.isaksson.erland.androidtoflutter.ir.code.JExpression;
import info.isaksson.erland.androidtoflutter.ir.code.JFieldAccess;
import info.isaksson.erland.androidtoflutter.ir.code.JName;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Class-level facts the translator needs: which variables hold views, which names are view
 * bindings, which methods the class declares and how string resources resolve.
 */
public final class TranslationScope {

    public static final TranslationScope EMPTY = builder().build();

    /** Variable or field name → view id, from {@code findViewById(R.id.x)} assignments. */
    public final Map<String, String> viewVariables;

    /** Names of view-binding variables, e.g. {@code binding}. */
    public final Set<String> bindingVariables;

    /** Methods declared in the class; calls to them become calls to the translated Dart methods. */
    public final Set<String> classMethods;

    /** View ids present in the paired layout; empty when unknown. */
    public final Set<String> knownViewIds;

    /** String resource name → text. */
    public final Function<String, Optional<String>> strings;

    private TranslationScope(Builder b) {
        this.viewVariables = Collections.unmodifiableMap(new LinkedHashMap<>(b.viewVariables));
        this.bindingVariables = Collections.unmodifiableSet(new LinkedHashSet<>(b.bindingVariables));
        this.classMethods = Collections.unmodifiableSet(new LinkedHashSet<>(b.classMethods));
        this.knownViewIds = Collections.unmodifiableSet(new LinkedHashSet<>(b.knownViewIds));
        this.strings = b.strings;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * View id referenced by {@code e}: a tracked variable, {@code this.field}, a binding field
     * or an inline {@code findViewById(R.id.x)}. Null otherwise.
     */
    public String viewIdOf(JExpression e, Map<String, String> aliases) {
        JExpression x = e;
        while (x instanceof JCast c) x = c.expression();
        if (x instanceof JName n) return variable(n.name(), aliases);
        if (x instanceof JFieldAccess f && f.scope() instanceof JName owner) {
            if (owner.name().equals("this")) return variable(f.name(), aliases);
            if (bindingVariables.contains(owner.name())) return bindingViewId(f.name());
        }
        if (x instanceof JCall c && isViewLookup(c)) return resourceName(c.argument(0), "id");
        return null;
    }

    /** {@code binding.loginButton} → {@code loginButton} when the layout uses it, else {@code login_button}. */
    public String bindingViewId(String field) {
        if (knownViewIds.contains(field)) return field;
        return snakeCase(field);
    }

    public String string(String name) {
        return strings.apply(name).orElse(name);
    }

    public static boolean isViewLookup(JCall c) {
        return (c.name().equals("findViewById") || c.name().equals("requireViewById"))
                && resourceName(c.argument(0), "id") != null;
    }

    /** {@code R.<type>.<name>} (also {@code android.R...}) → name; else null. */
    public static String resourceName(JExpression e, String type) {
        if (!(e instanceof JFieldAccess f)) return null;
        String qn = f.qualifiedName();
        if (qn == null) return null;
        String[] parts = qn.split("\\.");
        if (parts.length < 3) return null;
        boolean match = parts[parts.length - 3].equals("R") && (type == null || parts[parts.length - 2].equals(type));
        return match ? parts[parts.length - 1] : null;
    }

    static String snakeCase(String camel) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < camel.length(); i++) {
            char c = camel.charAt(i);
            if (Character.isUpperCase(c)) {
                if (i > 0) sb.append('_');
                sb.append(Character.toLowerCase(c));
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    private String variable(String name, Map<String, String> aliases) {
        String id = aliases == null ? null : aliases.get(name);
        return id != null ? id : viewVariables.get(name);
    }

    public static final class Builder {
        private final Map<String, String> viewVariables = new LinkedHashMap<>();
        private final Set<String> bindingVariables = new LinkedHashSet<>();
        private final Set<String> classMethods = new LinkedHashSet<>();
        private final Set<String> knownViewIds = new LinkedHashSet<>();
        private Function<String, Optional<String>> strings = name -> Optional.empty();

        private Builder() {}

        public Builder viewVariable(String name, String viewId) {
            if (name != null && viewId != null) viewVariables.put(name, viewId);
            return this;
        }

        public Builder bindingVariable(String name) {
            if (name != null) bindingVariables.add(name);
            return this;
        }

        public Builder classMethod(String name) {
            if (name != null) classMethods.add(name);
            return this;
        }

        public Builder knownViewIds(Set<String> ids) {
            if (ids != null) knownViewIds.addAll(ids);
            return this;
        }

        public Builder strings(Function<String, Optional<String>> strings) {
            if (strings != null) this.strings = strings;
            return this;
        }

        public TranslationScope build() {
            return new TranslationScope(this);
        }
    }
}
