package com.funcplan.syntax;

import java.util.List;

/**
 * One catch clause of a try statement.
 *
 * @param header the caught declaration as written, e.g. {@code IOException e}
 */
public record HandlerDescriptor(String header, int line, List<StatementDescriptor> body) {
    public HandlerDescriptor {
        header = header == null ? "" : header;
        body = List.copyOf(body);
    }
}
