package work.lcod.forge.format;

/**
 * Raised when formatted tool output does not match the layout of its {@link FormatDescriptor}.
 * This always points at a version mismatch with the tool that produced the output.
 */
public final class DecodeException extends RuntimeException {
    private final int offset;

    public DecodeException(String message, int offset) {
        super(message + " (offset " + offset + ")");
        this.offset = offset;
    }

    public int offset() {
        return offset;
    }
}
