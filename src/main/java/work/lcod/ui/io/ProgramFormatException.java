package work.lcod.ui.io;

/**
 * A value in a program file does not have the shape the reader expects.
 */
public final class ProgramFormatException extends RuntimeException {
    private final String pointer;
    private final String detail;

    public ProgramFormatException(String pointer, String detail) {
        super(detail + " at " + displayPointer(pointer));
        this.pointer = pointer;
        this.detail = detail;
    }

    public String pointer() {
        return pointer;
    }

    /** The message without the pointer. */
    public String detail() {
        return detail;
    }

    /** The pointer as shown to users; the document root is {@code /}. */
    public String displayPointer() {
        return displayPointer(pointer);
    }

    private static String displayPointer(String pointer) {
        return pointer == null || pointer.isEmpty() ? "/" : pointer;
    }
}
