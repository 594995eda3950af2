package org.tanzu.proxmoxmcp.web;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import org.tanzu.proxmoxmcp.proxmox.FakeProxmoxBackend;
import org.tanzu.proxmoxmcp.tools.ToolFixtures;

import static org.junit.jupiter.api.Assertions.*;

class ToolControllerTest {

    private FakeProxmoxBackend backend;
    private WebTestClient client;

    @BeforeEach
    void setUp() {
        backend = new FakeProxmoxBackend()
                .node("pve")
                .storage("pve", "local-lvm", "lvmthin", "images,rootdir")
                .vm("pve", 100, "web", "stopped");
        client = WebTestClient.bindToController(new ToolController(new ToolFixtures(backend).callbacks())).build();
    }

    @Test
    void healthReportsToolCount() {
        client.get().uri("/health").exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("UP")
                .jsonPath("$.tools").isEqualTo(30);
    }

    @Test
    void catalogueCarriesInputSchemas() {
        client.get().uri("/api/tools").exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$[?(@.name == 'create_vm')].inputSchema.properties.disk_size").exists()
                .jsonPath("$[?(@.name == 'start_container')].description").exists();
    }

    @Test
    void toolCallReturnsOutcome() {
        client.post().uri("/api/tools/start_vm")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"node\":\"pve\",\"vmid\":100}")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("SUCCESS")
                .jsonPath("$.operation").isEqualTo("start_vm")
                .jsonPath("$.payload.upid").exists();

        assertEquals("/nodes/pve/qemu/100/status/start", backend.lastSubmission().getPath());
    }

    @Test
    void validationFailureIsStructured() {
        client.post().uri("/api/tools/create_vm")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"node\":\"pve\",\"vmid\":200,\"name\":\"app\",\"cpus\":64,\"memory\":200,\"disk_size\":20}")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("FAILED")
                .jsonPath("$.error.kind").isEqualTo("VALIDATION")
                .jsonPath("$.error.violations[1].field").exists()
                .jsonPath("$.error.violations[2]").doesNotExist();

        assertTrue(backend.getSubmissions().isEmpty());
    }

    @Test
    void unknownToolIsNotFound() {
        client.post().uri("/api/tools/format_disk")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{}")
                .exchange()
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.error").isEqualTo("Unknown tool 'format_disk'");
    }

    @Test
    void argumentsMustBeAnObject() {
        client.post().uri("/api/tools/get_nodes")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("[1, 2]")
                .exchange()
                .expectStatus().isBadRequest();
    }

    @Test
    void readToolFailureIsServerError() {
        client.post().uri("/api/tools/get_node_status")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"node\":\"pve9\"}")
                .exchange()
                .expectStatus().is5xxServerError();
    }
}
