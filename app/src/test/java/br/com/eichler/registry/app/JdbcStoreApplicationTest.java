package br.com.eichler.registry.app;

import br.com.eichler.registry.repository.JdbcPersonStore;
import br.com.eichler.registry.repository.PersonStore;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = "persons.store.type=jdbc")
@AutoConfigureMockMvc
@DirtiesContext
class JdbcStoreApplicationTest {

    @Autowired
    private MockMvc mvc;

    @Autowired
    private PersonStore store;

    @Test
    void jdbcStoreBackedRegistry() throws Exception {
        assertThat(store).isInstanceOf(JdbcPersonStore.class);

        mvc.perform(post("/persons").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Alice\",\"age\":25,\"email\":\"alice@x.com\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(1));
        mvc.perform(post("/persons").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Bob\",\"age\":35,\"email\":\"bob@x.com\"}"))
                .andExpect(status().isCreated());

        mvc.perform(put("/persons/2").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"alice@x.com\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail").value("Email already registered"));

        mvc.perform(get("/persons/2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.email").value("bob@x.com"));

        mvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.database").value("connected"));
    }
}
