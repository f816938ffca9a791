package org.laminar.excel;

import java.io.IOException;

/**
 * A workbook could not be opened or a sheet could not be read.
 */
public class SourceReadException extends IOException {

    public SourceReadException(String message) {
        super(message);
    }

    public SourceReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
