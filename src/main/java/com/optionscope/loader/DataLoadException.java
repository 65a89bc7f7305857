package com.optionscope.loader;

/**
 * A file could not be loaded into its category. Fatal for the whole run.
 */
public class DataLoadException extends IllegalStateException {
    private final DatasetCategory category;
    private final String fileName;

    public DataLoadException(DatasetCategory category, String fileName, String message) {
        super(describe(category, fileName, message));
        this.category = category;
        this.fileName = fileName;
    }

    public DataLoadException(DatasetCategory category, String fileName, String message, Throwable cause) {
        super(describe(category, fileName, message), cause);
        this.category = category;
        this.fileName = fileName;
    }

    public DatasetCategory category() {
        return category;
    }

    public String fileName() {
        return fileName;
    }

    private static String describe(DatasetCategory category, String fileName, String message) {
        StringBuilder sb = new StringBuilder("load failed");
        if (category != null) {
            sb.append(": category=").append(category.key());
        }
        if (fileName != null && !fileName.isEmpty()) {
            sb.append(category == null ? ": " : ", ").append("file=").append(fileName);
        }
        if (message != null && !message.isEmpty()) {
            sb.append(" (").append(message).append(')');
        }
        return sb.toString();
    }
}
