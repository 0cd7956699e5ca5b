package org.instrumental.cpp;

/**
 * Thrown when a macro body cannot be converted into a constant
 * expression. This never aborts a run: the macro is left out of the
 * transpiled table.
 */
public class ConvertException extends Exception {

    public ConvertException(String msg) {
        super(msg);
    }

    public ConvertException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
