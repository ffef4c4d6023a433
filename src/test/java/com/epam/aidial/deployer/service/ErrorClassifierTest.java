package com.epam.aidial.deployer.service;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ErrorClassifierTest {

    @Test
    void testDockerfileParseError() {
        String logs = """
                #1 [internal] load build definition from Dockerfile
                ERROR: failed to solve: dockerfile parse error on line 3: unknown instruction: RUNN
                """;

        ErrorClassifier.Classification classification = ErrorClassifier.classify(logs);
        assertEquals(ErrorClassifier.Kind.DOCKERFILE_INVALID, classification.kind());
        assertEquals("failed to solve: dockerfile parse error on line 3: unknown instruction: RUNN", classification.message());
        assertFalse(classification.kind().isResourceFault());
    }

    @Test
    void testResourceFaults() {
        ErrorClassifier.Classification port = ErrorClassifier.classify(
                "Error response from daemon: driver failed programming external connectivity: Bind for 0.0.0.0:8080 failed: port is already allocated");
        assertEquals(ErrorClassifier.Kind.PORT_CONFLICT, port.kind());
        assertTrue(port.kind().isResourceFault());

        ErrorClassifier.Classification disk = ErrorClassifier.classify("write /var/lib/docker/tmp: no space left on device");
        assertEquals(ErrorClassifier.Kind.DISK_FULL, disk.kind());
        assertTrue(disk.kind().isResourceFault());
    }

    @Test
    void testNpmFailure() {
        String logs = """
                npm ERR! code E404
                npm ERR! 404 Not Found - GET https://registry.npmjs.org/left-padd
                """;

        ErrorClassifier.Classification classification = ErrorClassifier.classify(logs);
        assertEquals(ErrorClassifier.Kind.DEPENDENCY_MISSING, classification.kind());
        assertEquals("code E404", classification.message());
    }

    @Test
    void testUnknown() {
        ErrorClassifier.Classification classification = ErrorClassifier.classify("step 1\nstep 2\nsomething odd happened\n");
        assertEquals(ErrorClassifier.Kind.UNKNOWN, classification.kind());
        assertEquals("something odd happened", classification.message());
    }

    @Test
    void testSummarizeSkipsNoise() {
        String logs = """
                Error: for more information visit https://docs.docker.com
                error: module 'express' could not be loaded
                """;

        assertEquals("module 'express' could not be loaded", ErrorClassifier.summarize(logs));
        assertEquals("No output", ErrorClassifier.summarize(null));
        assertEquals("No output", ErrorClassifier.summarize("\n\n"));
    }
}
