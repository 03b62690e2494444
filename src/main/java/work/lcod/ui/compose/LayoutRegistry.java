package work.lcod.ui.compose;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.ui.compiled.CompiledLayoutProgram;

/**
 * Name to lowered layout cache. Entries are either registered up front or produced on first use by an
 * optional loader; a loader returning null means the name is unknown.
 */
public final class LayoutRegistry {
    private static final Logger LOG = LoggerFactory.getLogger(LayoutRegistry.class);

    private final Map<String, CompiledLayoutProgram> layouts = new ConcurrentHashMap<>();
    private final Function<String, CompiledLayoutProgram> loader;

    public LayoutRegistry() {
        this(name -> null);
    }

    public LayoutRegistry(Function<String, CompiledLayoutProgram> loader) {
        this.loader = Objects.requireNonNull(loader, "loader");
    }

    public LayoutRegistry register(String name, CompiledLayoutProgram layout) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(layout, "layout");
        layouts.put(name, layout);
        return this;
    }

    public Optional<CompiledLayoutProgram> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(layouts.computeIfAbsent(name, key -> {
            var loaded = loader.apply(key);
            if (loaded != null) {
                LOG.debug("Loaded layout '{}'", key);
            }
            return loaded;
        }));
    }

    public CompiledLayoutProgram resolve(String name) {
        return find(name).orElseThrow(() -> new LayoutNotFoundException(name));
    }

    public void unregister(String name) {
        if (name != null) {
            layouts.remove(name);
        }
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(layouts.keySet());
    }
}
