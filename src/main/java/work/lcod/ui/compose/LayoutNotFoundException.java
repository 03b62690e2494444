package work.lcod.ui.compose;

/**
 * Raised by {@link LayoutRegistry#resolve(String)} when no layout is known under the requested name.
 */
public final class LayoutNotFoundException extends RuntimeException {
    private final String layoutName;

    public LayoutNotFoundException(String layoutName) {
        super("Layout not found: " + layoutName);
        this.layoutName = layoutName;
    }

    public String layoutName() {
        return layoutName;
    }
}
