package br.com.eichler.registry.controller;

/** Error payload returned by {@link RestExceptionHandler}. */
public record ErrorResponse(Object detail) {}
