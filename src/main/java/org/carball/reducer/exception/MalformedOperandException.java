package org.carball.reducer.exception;

import lombok.Getter;

@Getter
public class MalformedOperandException extends FilterCompileException {

    private final String column;
    private final String operator;

    public MalformedOperandException(String column, String operator, String detail) {
        super(String.format("Malformed operand for '%s' on column %s: %s", operator, column, detail));
        this.column = column;
        this.operator = operator;
    }
}
