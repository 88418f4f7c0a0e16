package com.geico.poc.kqlcompiler;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import static com.geico.poc.kqlcompiler.AstFixtures.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * HTTP surface with no parser configured: trees are accepted, KQL text is not.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
public class KqlControllerTest {

    @Autowired
    private MockMvc mockMvc;

    private static String body(String field, Object value) throws Exception {
        ObjectNode request = MAPPER.createObjectNode();
        if (value instanceof String) {
            request.put(field, (String) value);
        } else {
            request.set(field, MAPPER.valueToTree(value));
        }
        return MAPPER.writeValueAsString(request);
    }

    @Test
    @DisplayName("Compile a posted tree")
    public void testCompile() throws Exception {
        mockMvc.perform(post("/api/kql/compile")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body("ast", load("failed_logons"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.sql").value("SELECT \"user_id\", COUNT(*) AS \"attempts\" FROM \"events\""
                        + " WHERE (\"event_type_id\" = '4625') GROUP BY \"user_id\""
                        + " ORDER BY \"attempts\" DESC LIMIT 10;"))
                .andExpect(jsonPath("$.success").value(true));
    }

    @Test
    @DisplayName("Missing tree is a bad request")
    public void testCompileMissingAst() throws Exception {
        mockMvc.perform(post("/api/kql/compile")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Missing ast"));
    }

    @Test
    @DisplayName("Unrecognized tree is a bad request")
    public void testCompileInvalidTree() throws Exception {
        ObjectNode emptyTree = MAPPER.createObjectNode();
        emptyTree.putArray("statements");
        mockMvc.perform(post("/api/kql/compile")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body("ast", emptyTree)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value(KqlQueryService.INVALID_TREE));
    }

    @Test
    @DisplayName("Translate without a parser reports it as unavailable")
    public void testTranslateWithoutParser() throws Exception {
        mockMvc.perform(post("/api/kql/translate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body("query", "events | take 10")))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value(KqlQueryService.PARSER_UNAVAILABLE));
    }

    @Test
    @DisplayName("Health check")
    public void testHealth() throws Exception {
        mockMvc.perform(get("/api/kql/health"))
                .andExpect(status().isOk())
                .andExpect(content().string("OK"));
    }
}
