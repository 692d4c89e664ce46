package com.vidnyan.vbuilder.domain.model;

/**
 * Source code location.
 */
public record Location(
    String filePath,
    int line,
    int column
) {
    
    /**
     * Create a location with just line and column information.
     */
    public static Location at(String filePath, int line, int column) {
        return new Location(filePath, line, column);
    }
    
    /**
     * Format as readable string.
     */
    public String format() {
        return (filePath != null ? filePath : "<text>") + ":" + line + ":" + column;
    }
}
