package org.carball.reducer.exception;

import lombok.Getter;

@Getter
public class UnknownColumnException extends FilterCompileException {

    private final String column;

    public UnknownColumnException(String column) {
        super("Unknown column: " + column);
        this.column = column;
    }
}
