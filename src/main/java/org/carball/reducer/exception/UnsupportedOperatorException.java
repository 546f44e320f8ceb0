package org.carball.reducer.exception;

import lombok.Getter;

@Getter
public class UnsupportedOperatorException extends FilterCompileException {

    private final String operator;

    public UnsupportedOperatorException(String operator) {
        super("Unsupported operator: " + operator);
        this.operator = operator;
    }
}
