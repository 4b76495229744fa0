package br.com.eichler.registry.controller;

import br.com.eichler.registry.model.Person;
import br.com.eichler.registry.service.PersonService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST controller exposing operations over Persons.
 */
@RestController
@RequestMapping("/persons")
public class PersonController {
    private final PersonService service;

    public PersonController(PersonService service) {
        this.service = service;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Person create(@Valid @RequestBody CreatePersonRequest request) {
        return service.create(request.name(), request.age(), request.email());
    }

    @GetMapping("/{id}")
    public Person get(@PathVariable Long id) {
        return service.getById(id);
    }

    @GetMapping
    public List<Person> list() {
        return service.getAll();
    }

    @PutMapping("/{id}")
    public Person update(@PathVariable Long id, @Valid @RequestBody UpdatePersonRequest request) {
        return service.update(id, request.toPatch());
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@PathVariable Long id) {
        service.delete(id);
    }
}
