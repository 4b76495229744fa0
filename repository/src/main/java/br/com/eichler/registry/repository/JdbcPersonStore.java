package br.com.eichler.registry.repository;

import br.com.eichler.registry.model.BackingStoreUnavailableException;
import br.com.eichler.registry.model.DuplicateEmailException;
import br.com.eichler.registry.model.Person;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.springframework.jdbc.datasource.init.UncategorizedScriptException;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.sql.PreparedStatement;
import java.sql.Statement;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * JDBC store over the {@code persons} table.
 *
 * <p>Mutations run inside a database transaction; the unique index on
 * {@code email} backs the duplicate check when two transactions race. The
 * identity column provides ids, which the database never hands out twice.
 * The table is created on construction when it does not exist yet.
 */
public class JdbcPersonStore implements PersonStore {
    private static final Logger log = LoggerFactory.getLogger(JdbcPersonStore.class);

    static final String SCHEMA = "db/persons-schema.sql";

    private static final RowMapper<Person> ROW_MAPPER = (rs, rowNum) -> new Person(
            rs.getLong("id"),
            rs.getString("name"),
            rs.getInt("age"),
            rs.getString("email"));

    private final DataSource dataSource;
    private final JdbcTemplate jdbc;
    private final TransactionTemplate writeTx;
    private final TransactionTemplate readTx;

    public JdbcPersonStore(DataSource dataSource) {
        this.dataSource = dataSource;
        this.jdbc = new JdbcTemplate(dataSource);
        DataSourceTransactionManager txManager = new DataSourceTransactionManager(dataSource);
        this.writeTx = new TransactionTemplate(txManager);
        this.readTx = new TransactionTemplate(txManager);
        this.readTx.setReadOnly(true);
        initializeSchema();
    }

    private void initializeSchema() {
        try {
            new ResourceDatabasePopulator(new ClassPathResource(SCHEMA)).execute(dataSource);
            log.info("Person table ready ({})", SCHEMA);
        } catch (UncategorizedScriptException e) {
            // connection failures surface wrapped by the script runner
            throw new BackingStoreUnavailableException("Cannot initialize person table", e);
        }
    }

    @Override
    public <T> T readOnly(Supplier<T> work) {
        return execute(readTx, work);
    }

    @Override
    public <T> T inTransaction(Supplier<T> work) {
        return execute(writeTx, work);
    }

    @Override
    public List<Person> findAll() {
        return translated(() -> jdbc.query("SELECT id, name, age, email FROM persons ORDER BY id", ROW_MAPPER));
    }

    @Override
    public Optional<Person> findById(long id) {
        return translated(() -> jdbc.query(
                "SELECT id, name, age, email FROM persons WHERE id = ?", ROW_MAPPER, id)
                .stream().findFirst());
    }

    @Override
    public boolean existsByEmail(String email) {
        return translated(() -> {
            Integer n = jdbc.queryForObject("SELECT COUNT(*) FROM persons WHERE email = ?", Integer.class, email);
            return n != null && n > 0;
        });
    }

    @Override
    public Person insert(String name, int age, String email) {
        return translated(() -> {
            KeyHolder keys = new GeneratedKeyHolder();
            try {
                jdbc.update(con -> {
                    PreparedStatement ps = con.prepareStatement(
                            "INSERT INTO persons (name, age, email) VALUES (?, ?, ?)",
                            Statement.RETURN_GENERATED_KEYS);
                    ps.setString(1, name);
                    ps.setInt(2, age);
                    ps.setString(3, email);
                    return ps;
                }, keys);
            } catch (DuplicateKeyException e) {
                throw new DuplicateEmailException(email, e);
            }
            Map<String, Object> generated = keys.getKeys();
            Number id = generated == null ? null : (Number) generated.get("id");
            if (id == null) {
                throw new IllegalStateException("No id generated for person " + email);
            }
            return new Person(id.longValue(), name, age, email);
        });
    }

    @Override
    public Optional<Person> update(Person person) {
        return translated(() -> {
            int rows;
            try {
                rows = jdbc.update("UPDATE persons SET name = ?, age = ?, email = ? WHERE id = ?",
                        person.getName(), person.getAge(), person.getEmail(), person.getId());
            } catch (DuplicateKeyException e) {
                throw new DuplicateEmailException(person.getEmail(), e);
            }
            return rows == 0 ? Optional.<Person>empty() : Optional.of(person.copy());
        });
    }

    @Override
    public boolean deleteById(long id) {
        return translated(() -> jdbc.update("DELETE FROM persons WHERE id = ?", id) > 0);
    }

    @Override
    public void ping() {
        translated(() -> jdbc.queryForObject("SELECT 1", Integer.class));
    }

    private static <T> T execute(TransactionTemplate tx, Supplier<T> work) {
        try {
            return tx.execute(status -> work.get());
        } catch (TransactionException e) {
            throw new BackingStoreUnavailableException("Person store transaction failed", e);
        }
    }

    private static <T> T translated(Supplier<T> work) {
        try {
            return work.get();
        } catch (DataAccessResourceFailureException e) {
            throw new BackingStoreUnavailableException("Person store unreachable", e);
        }
    }
}
