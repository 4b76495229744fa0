package br.com.eichler.registry.controller;

import br.com.eichler.registry.model.FieldUpdate;
import br.com.eichler.registry.model.PersonPatch;
import jakarta.validation.constraints.Pattern;

/**
 * Body of {@code PUT /persons/{id}}. Omitted or {@code null} fields leave the stored value unchanged.
 */
public record UpdatePersonRequest(
        @Pattern(regexp = "(?s).*\\S.*", message = "must not be blank") String name,
        Integer age,
        @Pattern(regexp = "(?s).*\\S.*", message = "must not be blank") String email
) {
    public PersonPatch toPatch() {
        return new PersonPatch(
                FieldUpdate.ofNullable(name),
                FieldUpdate.ofNullable(age),
                FieldUpdate.ofNullable(email));
    }
}
