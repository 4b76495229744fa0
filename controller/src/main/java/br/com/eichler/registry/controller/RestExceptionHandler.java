package br.com.eichler.registry.controller;

import br.com.eichler.registry.model.BackingStoreUnavailableException;
import br.com.eichler.registry.model.DuplicateEmailException;
import br.com.eichler.registry.model.PersonNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Maps registry errors and request validation failures to HTTP responses.
 */
@RestControllerAdvice
public class RestExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(RestExceptionHandler.class);

    static final String NOT_FOUND = "Person not found";
    static final String DUPLICATE_EMAIL = "Email already registered";

    private static final Pattern INTEGER = Pattern.compile("[+-]?\\d+");

    @ExceptionHandler(PersonNotFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public ErrorResponse notFound(PersonNotFoundException e) {
        return new ErrorResponse(NOT_FOUND);
    }

    @ExceptionHandler(DuplicateEmailException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ErrorResponse duplicateEmail(DuplicateEmailException e) {
        return new ErrorResponse(DUPLICATE_EMAIL);
    }

    @ExceptionHandler(BackingStoreUnavailableException.class)
    @ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
    public ErrorResponse storeUnavailable(BackingStoreUnavailableException e) {
        log.error("Backing store unavailable", e);
        return new ErrorResponse(e.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    @ResponseStatus(HttpStatus.UNPROCESSABLE_ENTITY)
    public ErrorResponse invalidBody(MethodArgumentNotValidException e) {
        List<String> errors = e.getBindingResult().getFieldErrors().stream()
                .map(f -> f.getField() + ": " + f.getDefaultMessage())
                .toList();
        return new ErrorResponse(errors);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    @ResponseStatus(HttpStatus.UNPROCESSABLE_ENTITY)
    public ErrorResponse unreadableBody(HttpMessageNotReadableException e) {
        return new ErrorResponse("Malformed request body");
    }

    /**
     * A well-formed integer id too large for {@code Long} cannot name a stored person, so it
     * is reported as absent; anything that is not an integer is a validation failure.
     */
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> invalidPathVariable(MethodArgumentTypeMismatchException e) {
        Object value = e.getValue();
        if ("id".equals(e.getName()) && value != null && INTEGER.matcher(value.toString()).matches()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(new ErrorResponse(NOT_FOUND));
        }
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(new ErrorResponse(e.getName() + ": invalid value '" + value + "'"));
    }
}
