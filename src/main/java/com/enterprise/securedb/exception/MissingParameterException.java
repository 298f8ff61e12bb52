package com.enterprise.securedb.exception;

public class MissingParameterException extends TemplateException {

    private final int index;

    public MissingParameterException(String placeholder, int index) {
        super("Missing parameter for placeholder " + placeholder + " at index " + index);
        this.index = index;
    }

    /** Zero-based position in the (macro-filtered) parameter list. */
    public int index() {
        return index;
    }
}
