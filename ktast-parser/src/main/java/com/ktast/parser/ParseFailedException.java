package com.ktast.parser;

import java.util.Collections;
import java.util.List;

/**
 * 源码含有语法错误
 */
public class ParseFailedException extends RuntimeException {
    private final String fileName;
    private final List<ParseError> errors;

    public ParseFailedException(String fileName, List<ParseError> errors) {
        super("Failed with " + errors.size() + " errors in " + fileName
                + (errors.isEmpty() ? "" : ", first: " + errors.get(0)));
        this.fileName = fileName;
        this.errors = Collections.unmodifiableList(errors);
    }

    public String getFileName() {
        return fileName;
    }

    public List<ParseError> getErrors() {
        return errors;
    }
}
