package com.agentloom.core.artifacts;

import com.agentloom.core.model.Part;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryArtifactServiceTest {

    private InMemoryArtifactService service;

    @BeforeEach
    void setUp() {
        service = new InMemoryArtifactService();
    }

    @Test
    @DisplayName("versions start at 0 and the latest is loaded by default")
    void versions() {
        assertEquals(0, service.saveArtifact("app", "u1", "s1", "report.txt", Part.fromText("draft")));
        assertEquals(1, service.saveArtifact("app", "u1", "s1", "report.txt", Part.fromText("final")));

        assertEquals("final", service.loadArtifact("app", "u1", "s1", "report.txt", null).orElseThrow().text());
        assertEquals("draft", service.loadArtifact("app", "u1", "s1", "report.txt", 0).orElseThrow().text());
        assertTrue(service.loadArtifact("app", "u1", "s1", "report.txt", 5).isEmpty());
        assertEquals(List.of(0, 1), service.listVersions("app", "u1", "s1", "report.txt"));
    }

    @Test
    @DisplayName("session artifacts are private to their session")
    void sessionScoped() {
        service.saveArtifact("app", "u1", "s1", "notes.txt", Part.fromText("mine"));

        assertTrue(service.loadArtifact("app", "u1", "s2", "notes.txt", null).isEmpty());
        assertTrue(service.listArtifactKeys("app", "u1", "s2").isEmpty());
    }

    @Test
    @DisplayName("user: artifacts are shared by all sessions of the user")
    void userNamespace() {
        byte[] bytes = "png".getBytes(StandardCharsets.UTF_8);
        service.saveArtifact("app", "u1", "s1", "user:avatar.png", Part.fromBytes(bytes, "image/png"));
        service.saveArtifact("app", "u1", "s2", "b.txt", Part.fromText("b"));
        service.saveArtifact("app", "u1", "s2", "a.txt", Part.fromText("a"));

        assertTrue(service.loadArtifact("app", "u1", "s2", "user:avatar.png", null).isPresent());
        assertTrue(service.loadArtifact("app", "u2", "s2", "user:avatar.png", null).isEmpty());
        assertEquals(List.of("a.txt", "b.txt", "user:avatar.png"), service.listArtifactKeys("app", "u1", "s2"));
    }

    @Test
    @DisplayName("deleting removes every version")
    void delete() {
        service.saveArtifact("app", "u1", "s1", "tmp.txt", Part.fromText("x"));
        service.deleteArtifact("app", "u1", "s1", "tmp.txt");

        assertTrue(service.loadArtifact("app", "u1", "s1", "tmp.txt", null).isEmpty());
        assertEquals(List.of(), service.listVersions("app", "u1", "s1", "tmp.txt"));
    }
}
