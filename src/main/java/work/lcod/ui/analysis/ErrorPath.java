package work.lcod.ui.analysis;

/**
 * Immutable pointer into the program being analyzed, e.g. {@code /view/children/0/props/onClick}.
 */
public record ErrorPath(String value) {
    private static final ErrorPath ROOT = new ErrorPath("");

    public static ErrorPath root() {
        return ROOT;
    }

    public ErrorPath child(String segment) {
        return new ErrorPath(value + "/" + segment.replace("~", "~0").replace("/", "~1"));
    }

    public ErrorPath index(int position) {
        return new ErrorPath(value + "/" + position);
    }

    @Override
    public String toString() {
        return value.isEmpty() ? "/" : value;
    }
}
