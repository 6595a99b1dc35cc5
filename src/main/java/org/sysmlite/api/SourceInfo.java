package org.sysmlite.api;

/**
 * A pure data class representing a position in the model source.
 * It is part of the public API and free of implementation details.
 *
 * @param fileName The source the element was read from.
 * @param lineNumber The 1-based line number.
 * @param columnNumber The 1-based column number.
 */
public record SourceInfo(String fileName, int lineNumber, int columnNumber) {

    @Override
    public String toString() {
        return fileName + ":" + lineNumber + ":" + columnNumber;
    }
}
