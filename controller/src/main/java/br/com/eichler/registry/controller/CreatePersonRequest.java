package br.com.eichler.registry.controller;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Body of {@code POST /persons}. Age is not range checked; negative values are accepted.
 */
public record CreatePersonRequest(
        @NotBlank String name,
        @NotNull Integer age,
        @NotBlank String email
) {}
