package com.familyagenda.controller;

import com.familyagenda.repository.ChildRepository;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.SpyBean;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.jdbc.Sql;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@Sql(scripts = "/reset.sql", executionPhase = Sql.ExecutionPhase.BEFORE_TEST_METHOD)
class ChildApiControllerTest {

    private static final String PARENT = "7";
    private static final String OTHER_PARENT = "8";

    private static final String ANA = """
        {"fullName": "Ana Silva", "nationalId": "111.111.111-11", "birthDate": "2015-03-02"}
        """;

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @SpyBean
    private ChildRepository childRepository;

    @Test
    @DisplayName("register child, schedule an appointment, delete the child")
    void childAndScheduleLifecycle() throws Exception {
        long childId = createChild(PARENT, ANA);

        mockMvc.perform(post("/schedules").header("X-User-Id", PARENT)
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"childId": %d, "title": "Consulta", "start": "2024-01-10T09:00",
                     "end": "2024-01-10T10:00", "type": "medico"}
                    """.formatted(childId)))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.id").isNumber());

        mockMvc.perform(get("/children/{id}/schedules", childId).header("X-User-Id", PARENT))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(1))
            .andExpect(jsonPath("$[0].title").value("Consulta"))
            .andExpect(jsonPath("$[0].start").value("2024-01-10T09:00:00"));

        mockMvc.perform(delete("/children/{id}", childId).header("X-User-Id", PARENT))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.message").value("Child deleted successfully."));

        mockMvc.perform(get("/children/{id}/schedules", childId).header("X-User-Id", PARENT))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(0));

        mockMvc.perform(get("/children").header("X-User-Id", PARENT))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(0));
    }

    @Nested
    @DisplayName("POST /children")
    class CreateChild {

        @Test
        void returnsCreatedWithIdAndName() throws Exception {
            mockMvc.perform(post("/children").header("X-User-Id", PARENT)
                    .contentType(MediaType.APPLICATION_JSON).content(ANA))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").isNumber())
                .andExpect(jsonPath("$.fullName").value("Ana Silva"));
        }

        @Test
        void duplicateNationalIdIsConflict() throws Exception {
            createChild(PARENT, ANA);

            mockMvc.perform(post("/children").header("X-User-Id", OTHER_PARENT)
                    .contentType(MediaType.APPLICATION_JSON).content(ANA))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.message").value("National identifier already registered."));
        }

        @Test
        void missingFieldsAreBadRequest() throws Exception {
            mockMvc.perform(post("/children").header("X-User-Id", PARENT)
                    .contentType(MediaType.APPLICATION_JSON).content("{\"fullName\": \"Ana Silva\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message")
                    .value("Validation failed: nationalId is required; birthDate is required."));
        }

        @Test
        void malformedBodyIsBadRequest() throws Exception {
            mockMvc.perform(post("/children").header("X-User-Id", PARENT)
                    .contentType(MediaType.APPLICATION_JSON).content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Malformed request body."));
        }
    }

    @Nested
    @DisplayName("GET /children")
    class ListChildren {

        @Test
        void listsOnlyTheCallersChildren() throws Exception {
            long mine = createChild(PARENT, ANA);
            createChild(OTHER_PARENT, """
                {"fullName": "Caio Lima", "nationalId": "222.222.222-22", "birthDate": "2012-07-19"}
                """);

            mockMvc.perform(get("/children").header("X-User-Id", PARENT))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].id").value(mine))
                .andExpect(jsonPath("$[0].nationalId").value("111.111.111-11"))
                .andExpect(jsonPath("$[0].birthDate").value("2015-03-02"));
        }

        @Test
        void storeFailureIsGenericInternalError() throws Exception {
            doThrow(new DataAccessResourceFailureException("SELECT c.* FROM child c failed"))
                .when(childRepository).findByParentId(any());

            MvcResult result = mockMvc.perform(get("/children").header("X-User-Id", PARENT))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.message").value("Internal server error."))
                .andReturn();

            assertThat(result.getResponse().getContentAsString()).doesNotContain("SELECT");
        }
    }

    @Nested
    @DisplayName("DELETE /children/{id}")
    class DeleteChild {

        @Test
        void unknownChildIsNotFound() throws Exception {
            mockMvc.perform(delete("/children/999999").header("X-User-Id", PARENT))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Child not found."));
        }

        @Test
        void nonNumericIdIsBadRequest() throws Exception {
            mockMvc.perform(delete("/children/abc").header("X-User-Id", PARENT))
                .andExpect(status().isBadRequest());
        }
    }

    private long createChild(String parent, String body) throws Exception {
        MvcResult result = mockMvc.perform(post("/children").header("X-User-Id", parent)
                .contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isCreated())
            .andReturn();
        JsonNode json = objectMapper.readTree(result.getResponse().getContentAsString());
        return json.get("id").asLong();
    }
}
