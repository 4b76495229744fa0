package br.com.eichler.registry.app;

import br.com.eichler.registry.repository.InMemoryPersonStore;
import br.com.eichler.registry.repository.PersonStore;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_EACH_TEST_METHOD)
class PersonRegistryApplicationTest {

    @Autowired
    private MockMvc mvc;

    @Autowired
    private PersonStore store;

    @Test
    void usesInMemoryStoreByDefault() {
        assertThat(store).isInstanceOf(InMemoryPersonStore.class);
    }

    @Test
    void completeCrudWorkflow() throws Exception {
        mvc.perform(post("/persons").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"John Doe\",\"age\":30,\"email\":\"john@x.com\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(1));

        mvc.perform(post("/persons").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Jane\",\"age\":28,\"email\":\"john@x.com\"}"))
                .andExpect(status().isBadRequest());

        mvc.perform(put("/persons/1").contentType(MediaType.APPLICATION_JSON).content("{\"age\":31}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("John Doe"))
                .andExpect(jsonPath("$.age").value(31))
                .andExpect(jsonPath("$.email").value("john@x.com"));

        mvc.perform(delete("/persons/1")).andExpect(status().isNoContent());
        mvc.perform(get("/persons/1")).andExpect(status().isNotFound());
    }

    @Test
    void deletingOnePersonKeepsTheOthers() throws Exception {
        for (String name : new String[]{"alice", "bob", "charlie"}) {
            mvc.perform(post("/persons").contentType(MediaType.APPLICATION_JSON)
                            .content("{\"name\":\"" + name + "\",\"age\":20,\"email\":\"" + name + "@x.com\"}"))
                    .andExpect(status().isCreated());
        }

        mvc.perform(delete("/persons/2")).andExpect(status().isNoContent());

        mvc.perform(get("/persons"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[0].id").value(1))
                .andExpect(jsonPath("$[1].id").value(3));
    }

    @Test
    void healthReportsConnectedStore() throws Exception {
        mvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("healthy"))
                .andExpect(jsonPath("$.api").value("operational"))
                .andExpect(jsonPath("$.database").value("connected"));
    }

    @Test
    void fractionalAgeIsRejected() throws Exception {
        mvc.perform(post("/persons").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"J\",\"age\":30.9,\"email\":\"j@x.com\"}"))
                .andExpect(status().isUnprocessableEntity());

        mvc.perform(get("/persons")).andExpect(jsonPath("$", hasSize(0)));
    }
}
