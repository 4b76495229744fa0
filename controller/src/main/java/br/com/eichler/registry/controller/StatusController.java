package br.com.eichler.registry.controller;

import br.com.eichler.registry.model.HealthStatus;
import br.com.eichler.registry.service.PersonService;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
public class StatusController {
    static final String WELCOME = "Person API - Use /docs for API documentation";

    private final PersonService service;

    public StatusController(PersonService service) {
        this.service = service;
    }

    @GetMapping("/")
    public Map<String, String> root() {
        return Map.of("message", WELCOME);
    }

    @GetMapping("/health")
    public ResponseEntity<HealthResponse> health() {
        HealthStatus status = service.healthCheck();
        HttpStatus code = status.healthy() ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE;
        return ResponseEntity.status(code).body(HealthResponse.from(status));
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record HealthResponse(String status, String api, String database, String error) {
        static HealthResponse from(HealthStatus s) {
            return new HealthResponse(s.status(), s.api(), s.database(), s.error());
        }
    }
}
