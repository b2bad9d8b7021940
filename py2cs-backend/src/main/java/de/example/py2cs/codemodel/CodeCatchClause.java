package de.example.py2cs.codemodel;

import java.util.List;

/** A null {@code catchExceptionType} is a catch-all clause. */
public record CodeCatchClause(String localName, CodeTypeReference catchExceptionType, List<CodeStatement> statements) {
}
