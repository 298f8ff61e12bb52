package com.enterprise.securedb.exception;

public class ArrayParamException extends TemplateException {

    public ArrayParamException(String message) {
        super(message);
    }
}
