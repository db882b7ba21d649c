package fr.imt.distroforge.distroforge.business.model;

/**
 * Uniform outcome of an external toolchain call: either a value or an error message.
 */
public record ToolResult<T>(T value, String error) {

    public static <T> ToolResult<T> success(T value) {
        return new ToolResult<>(value, null);
    }

    public static <T> ToolResult<T> failure(String error) {
        return new ToolResult<>(null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
