package com.blackroad.catalog.services;

/** Fallo al abrir o consultar la base del catálogo. */
public class CatalogException extends RuntimeException {

    public CatalogException(String message, Throwable cause) {
        super(message, cause);
    }
}
