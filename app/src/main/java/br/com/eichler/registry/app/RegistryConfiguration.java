package br.com.eichler.registry.app;

import br.com.eichler.registry.repository.InMemoryPersonStore;
import br.com.eichler.registry.repository.JdbcPersonStore;
import br.com.eichler.registry.repository.PersonStore;
import br.com.eichler.registry.service.PersonService;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;

/**
 * Wires the registry to the store selected by {@code persons.store.type}.
 */
@Configuration
public class RegistryConfiguration {

    @Bean
    @ConditionalOnProperty(name = "persons.store.type", havingValue = "memory", matchIfMissing = true)
    public PersonStore inMemoryPersonStore() {
        return new InMemoryPersonStore();
    }

    @Bean
    @ConditionalOnProperty(name = "persons.store.type", havingValue = "jdbc")
    public PersonStore jdbcPersonStore(DataSource dataSource) {
        return new JdbcPersonStore(dataSource);
    }

    @Bean
    public PersonService personService(PersonStore store) {
        return new PersonService(store);
    }
}
