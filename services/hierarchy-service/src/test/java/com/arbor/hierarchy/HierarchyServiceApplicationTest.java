package com.arbor.hierarchy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.arbor.hierarchy.config.HierarchyProperties;
import com.arbor.hierarchy.config.ServiceProperties;
import com.arbor.hierarchy.domain.ports.NodeStore;
import com.arbor.hierarchy.infrastructure.occupancy.InMemoryOccupantRegistry;
import com.arbor.hierarchy.infrastructure.persistence.InMemoryNodeStore;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.MockHttpServletRequestBuilder;

/**
 * Full-context tests over MockMvc. The test profile uses the in-memory store, so no external
 * infrastructure is needed; every test works in a tenant of its own.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DisplayName("Hierarchy Service Application")
class HierarchyServiceApplicationTest {

    private static final String ACTOR = "actor-42";

    @Autowired private ApplicationContext context;
    @Autowired private MockMvc mockMvc;
    @Autowired private ObjectMapper objectMapper;
    @Autowired private InMemoryOccupantRegistry occupants;

    @Test
    @DisplayName("context loads with the in-memory store")
    void contextLoads() {
        assertThat(context.getBean(NodeStore.class)).isInstanceOf(InMemoryNodeStore.class);
        assertThat(context.getBean(HierarchyProperties.class).store()).isEqualTo(HierarchyProperties.StoreType.MEMORY);
        assertThat(context.getBean(ServiceProperties.class).name()).isEqualTo("hierarchy-service-test");
    }

    @Test
    @DisplayName("service info endpoint reports name and settings")
    void serviceInfo() throws Exception {
        mockMvc.perform(get("/api/v1/info"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("hierarchy-service-test"))
                .andExpect(jsonPath("$.store").value("memory"))
                .andExpect(jsonPath("$.status").value("running"))
                .andExpect(header().exists("X-Correlation-ID"));
    }

    @Test
    @DisplayName("actuator health endpoint is available")
    void actuatorHealth() throws Exception {
        mockMvc.perform(get("/actuator/health")).andExpect(status().isOk());
    }

    @Nested
    @DisplayName("Nodes API")
    class NodesApi {

        private String tenant;
        private String a;
        private String b;
        private String d;

        @BeforeEach
        void buildTree() throws Exception {
            JsonNode root = createNode(null, "{\"name\":\"R\",\"kind\":\"ROOT_CLASS\"}");
            tenant = root.get("id").asText();
            a = createNode(tenant, child(tenant, "A")).get("id").asText();
            b = createNode(tenant, child(a, "B")).get("id").asText();
            d = createNode(tenant, child(tenant, "D")).get("id").asText();
        }

        @Test
        @DisplayName("creating a root without tenant establishes a tenant")
        void createRoot() throws Exception {
            mockMvc.perform(post("/api/v1/nodes")
                            .header("X-Actor-ID", ACTOR)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"name\":\"Acme\",\"kind\":\"ROOT_CLASS\",\"metadata\":{\"region\":\"EU\"}}"))
                    .andExpect(status().isCreated())
                    .andExpect(jsonPath("$.level").value(0))
                    .andExpect(jsonPath("$.path").value("Acme"))
                    .andExpect(jsonPath("$.metadata.region").value("EU"))
                    .andExpect(jsonPath("$.createdBy").value(ACTOR))
                    .andExpect(result -> {
                        JsonNode body = objectMapper.readTree(result.getResponse().getContentAsString());
                        assertThat(body.get("tenantId").asText()).isEqualTo(body.get("id").asText());
                        assertThat(result.getResponse().getHeader("Location"))
                                .isEqualTo("/api/v1/nodes/" + body.get("id").asText());
                    });
        }

        @Test
        @DisplayName("a child gets path, level and ancestor chain")
        void createChild() throws Exception {
            mockMvc.perform(tenantScoped(get("/api/v1/nodes/" + b)))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.path").value("R > A > B"))
                    .andExpect(jsonPath("$.level").value(2))
                    .andExpect(jsonPath("$.ancestorIds", contains(tenant, a, b)))
                    .andExpect(jsonPath("$.tenantId").value(tenant));
        }

        @Test
        @DisplayName("move cascades and rename propagates")
        void moveAndRename() throws Exception {
            mockMvc.perform(tenantScoped(post("/api/v1/nodes/" + a + "/move"))
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"parentId\":\"" + d + "\"}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.path").value("R > D > A"));

            mockMvc.perform(tenantScoped(patch("/api/v1/nodes/" + a + "/name"))
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"name\":\"A2\"}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.name").value("A2"));

            mockMvc.perform(tenantScoped(get("/api/v1/nodes/" + b)))
                    .andExpect(jsonPath("$.path").value("R > D > A2 > B"))
                    .andExpect(jsonPath("$.level").value(3));

            mockMvc.perform(tenantScoped(get("/api/v1/nodes/consistency")))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.consistent").value(true));
        }

        @Test
        @DisplayName("structural conflicts map to 409")
        void structuralConflicts() throws Exception {
            mockMvc.perform(tenantScoped(post("/api/v1/nodes/" + a + "/move"))
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"parentId\":\"" + b + "\"}"))
                    .andExpect(status().isConflict())
                    .andExpect(jsonPath("$.title").value("Structural Conflict"))
                    .andExpect(jsonPath("$.correlationId").exists());

            mockMvc.perform(tenantScoped(post("/api/v1/nodes/" + a + "/move"))
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{}"))
                    .andExpect(status().isConflict());
        }

        @Test
        @DisplayName("nodes of another tenant are not found")
        void crossTenantIsNotFound() throws Exception {
            String otherTenant = createNode(null, "{\"name\":\"Other\",\"kind\":\"ROOT_CLASS\"}").get("id").asText();

            mockMvc.perform(get("/api/v1/nodes/" + a)
                            .header("X-Tenant-ID", otherTenant)
                            .header("X-Actor-ID", ACTOR))
                    .andExpect(status().isNotFound())
                    .andExpect(jsonPath("$.title").value("Not Found"));
        }

        @Test
        @DisplayName("delete is blocked by children and occupants, then succeeds")
        void deleteGuards() throws Exception {
            mockMvc.perform(tenantScoped(delete("/api/v1/nodes/" + a)))
                    .andExpect(status().isConflict())
                    .andExpect(jsonPath("$.dependency").value("ACTIVE_CHILDREN"));

            occupants.place("occupant-" + b, tenant, List.of(tenant, a, b));
            mockMvc.perform(tenantScoped(delete("/api/v1/nodes/" + b)))
                    .andExpect(status().isConflict())
                    .andExpect(jsonPath("$.dependency").value("ACTIVE_OCCUPANTS"));

            occupants.deactivate("occupant-" + b);
            mockMvc.perform(tenantScoped(delete("/api/v1/nodes/" + b))).andExpect(status().isNoContent());
            mockMvc.perform(tenantScoped(get("/api/v1/nodes/" + b))).andExpect(status().isNotFound());
        }

        @Test
        @DisplayName("hierarchy queries")
        void queries() throws Exception {
            mockMvc.perform(tenantScoped(get("/api/v1/nodes/" + tenant + "/children")))
                    .andExpect(jsonPath("$[*].name", contains("A", "D")));
            mockMvc.perform(tenantScoped(get("/api/v1/nodes/" + b + "/ancestors")))
                    .andExpect(jsonPath("$[*].name", contains("R", "A")));
            mockMvc.perform(tenantScoped(get("/api/v1/nodes/" + tenant + "/descendants")))
                    .andExpect(jsonPath("$", hasSize(3)));
            mockMvc.perform(tenantScoped(get("/api/v1/nodes/search/by-path").param("prefix", "R > A")))
                    .andExpect(jsonPath("$[*].path", contains("R > A", "R > A > B")));
            mockMvc.perform(tenantScoped(get("/api/v1/nodes").param("level", "1")))
                    .andExpect(jsonPath("$[*].name", contains("A", "D")));
            mockMvc.perform(tenantScoped(get("/api/v1/nodes/hierarchy").param("maxDepth", "0")))
                    .andExpect(jsonPath("$[*].name", contains("R")));
            mockMvc.perform(tenantScoped(get("/api/v1/nodes/stats")))
                    .andExpect(jsonPath("$.totalNodes").value(4))
                    .andExpect(jsonPath("$.maxLevel").value(2))
                    .andExpect(jsonPath("$.byKind.BUSINESS_UNIT.count").value(3));
            mockMvc.perform(tenantScoped(post("/api/v1/nodes/" + a + "/repair")))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$", hasSize(0)));
        }

        @Test
        @DisplayName("bad input maps to 400")
        void badRequests() throws Exception {
            mockMvc.perform(get("/api/v1/nodes/" + a).header("X-Tenant-ID", tenant))
                    .andExpect(status().isBadRequest());
            mockMvc.perform(get("/api/v1/nodes/" + a).header("X-Actor-ID", ACTOR))
                    .andExpect(status().isBadRequest());
            mockMvc.perform(tenantScoped(post("/api/v1/nodes"))
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(child(a, "X > Y")))
                    .andExpect(status().isBadRequest());
            mockMvc.perform(tenantScoped(post("/api/v1/nodes"))
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"name\":\"\",\"kind\":\"DEPARTMENT\"}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.title").value("Validation Error"));
            mockMvc.perform(tenantScoped(get("/api/v1/nodes").param("kind", "GALAXY")))
                    .andExpect(status().isBadRequest());
        }

        private MockHttpServletRequestBuilder tenantScoped(MockHttpServletRequestBuilder request) {
            return request.header("X-Tenant-ID", tenant).header("X-Actor-ID", ACTOR);
        }

        private String child(String parentId, String name) {
            return "{\"name\":\"%s\",\"kind\":\"BUSINESS_UNIT\",\"parentId\":\"%s\"}".formatted(name, parentId);
        }

        private JsonNode createNode(String tenantId, String body) throws Exception {
            MockHttpServletRequestBuilder request = post("/api/v1/nodes")
                    .header("X-Actor-ID", ACTOR)
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(body);
            if (tenantId != null) {
                request = request.header("X-Tenant-ID", tenantId);
            }
            String response = mockMvc.perform(request)
                    .andExpect(status().isCreated())
                    .andReturn().getResponse().getContentAsString();
            return objectMapper.readTree(response);
        }
    }
}
