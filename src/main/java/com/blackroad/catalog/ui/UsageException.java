package com.blackroad.catalog.ui;

/** Argumentos de línea de comandos inválidos. */
public class UsageException extends RuntimeException {
    public UsageException(String message) {
        super(message);
    }
}
